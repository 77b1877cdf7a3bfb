package morriscore.io;

import morriscore.design.MorrisDesign;
import morriscore.design.MorrisExperiment;
import morriscore.design.MorrisFactor;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

public final class DesignExcelWriter {

    public static final String DESIGN_SHEET = "DESIGN";
    public static final String FACTORS_SHEET = "FACTORS";

    private DesignExcelWriter() {}

    public static void writeXlsx(String path,
                                 MorrisExperiment experiment,
                                 List<MorrisFactor> factors,
                                 MorrisDesign design) throws IOException {
        try (FileOutputStream out = new FileOutputStream(path)) {
            writeXlsx(out, experiment, factors, design);
        }
    }

    public static void writeXlsx(OutputStream out,
                                 MorrisExperiment experiment,
                                 List<MorrisFactor> factors,
                                 MorrisDesign design) throws IOException {

        if (factors.size() != design.getDimension()) {
            throw new IllegalArgumentException("factors.size != design.dimension");
        }

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle passportStyle = wb.createCellStyle();
            passportStyle.setWrapText(false);
            passportStyle.setVerticalAlignment(VerticalAlignment.TOP);

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            // числа оставляем числами, формат только отображение
            CellStyle centeredNumberStyle = wb.createCellStyle();
            centeredNumberStyle.setAlignment(HorizontalAlignment.CENTER);
            centeredNumberStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            centeredNumberStyle.setDataFormat(df.getFormat("0.000000"));

            CellStyle centeredIntStyle = wb.createCellStyle();
            centeredIntStyle.setAlignment(HorizontalAlignment.CENTER);
            centeredIntStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            centeredIntStyle.setDataFormat(df.getFormat("0"));

            // ===== DESIGN sheet =====
            Sheet sheet = wb.createSheet(DESIGN_SHEET);

            int r = 0;

            Row row0 = sheet.createRow(r++);
            Cell passportCell = row0.createCell(0);
            passportCell.setCellValue(DesignCsvWriter.buildPassport(experiment));
            passportCell.setCellStyle(passportStyle);

            // узкая колонка A: паспорт не задаёт ширину
            sheet.setColumnWidth(0, 10 * 256);
            row0.setHeightInPoints(14);

            Row hdr = sheet.createRow(r++);
            int c = 0;
            c = writeHeader(hdr, c, "k", headerStyle);
            c = writeHeader(hdr, c, "traj", headerStyle);
            c = writeHeader(hdr, c, "row", headerStyle);
            for (MorrisFactor f : factors) {
                c = writeHeader(hdr, c, f.getName(), headerStyle);
            }

            final int len = design.getTrajectoryLength();
            for (int k = 0; k < design.getSize(); k++) {
                Row rr = sheet.createRow(r++);
                int cc = 0;
                writeInt(rr, cc++, k, centeredIntStyle);
                writeInt(rr, cc++, k / len, centeredIntStyle);
                writeInt(rr, cc++, k % len, centeredIntStyle);
                for (int j = 0; j < design.getDimension(); j++) {
                    writeNumber(rr, cc++, design.get(k, j), centeredNumberStyle);
                }
            }

            setWidthFrom(sheet, hdr.getLastCellNum(), 1, 14);

            // ===== FACTORS sheet =====
            Sheet fs = wb.createSheet(FACTORS_SHEET);
            Row fh = fs.createRow(0);
            c = 0;
            c = writeHeader(fh, c, "name", headerStyle);
            c = writeHeader(fh, c, "min", headerStyle);
            c = writeHeader(fh, c, "max", headerStyle);
            c = writeHeader(fh, c, "step", headerStyle);
            c = writeHeader(fh, c, "delta", headerStyle);

            double[] step = experiment.getStep();
            double[] delta = experiment.getInterval().getDelta();
            for (int j = 0; j < factors.size(); j++) {
                MorrisFactor f = factors.get(j);
                Row fr = fs.createRow(j + 1);
                Cell name = fr.createCell(0);
                name.setCellValue(f.getName());
                name.setCellStyle(headerStyle);
                writeNumber(fr, 1, f.getMin(), centeredNumberStyle);
                writeNumber(fr, 2, f.getMax(), centeredNumberStyle);
                writeNumber(fr, 3, step[j], centeredNumberStyle);
                // шаг траектории в единицах фактора
                writeNumber(fr, 4, delta[j] * step[j], centeredNumberStyle);
            }
            setWidthFrom(fs, c, 0, 14);

            wb.write(out);
        }
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    private static void writeInt(Row row, int col, long value, CellStyle intStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(intStyle);
    }

    // autoSizeColumn тянет AWT-шрифты, на headless-машинах ширину задаём сами
    private static void setWidthFrom(Sheet sh, int cols, int fromCol, int chars) {
        for (int i = fromCol; i < cols; i++) sh.setColumnWidth(i, chars * 256);
    }
}
