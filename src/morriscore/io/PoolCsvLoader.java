package morriscore.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка внешнего плана (пула базовых точек): одна точка на строку,
 * значения через ';' или пробелы, десятичный разделитель точка или запятая.
 * Пустые строки и строки с '#' пропускаются.
 */
public class PoolCsvLoader {

    public double[][] load(String filePath) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(Path.of(filePath), StandardCharsets.UTF_8)) {
            return read(br, filePath);
        }
    }

    /** Загрузка с classpath (для фиксированных планов внутри jar). */
    public double[][] loadResource(String resource) throws IOException {
        InputStream in = PoolCsvLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) throw new IOException("Ресурс не найден: " + resource);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return read(br, resource);
        }
    }

    public double[][] read(Reader reader, String source) throws IOException {
        BufferedReader br = (reader instanceof BufferedReader)
                ? (BufferedReader) reader
                : new BufferedReader(reader);

        List<double[]> rows = new ArrayList<>();
        int dimension = -1;
        int lineNo = 0;
        String line;

        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            String[] cells = line.split("[;\\s]+");
            double[] x = new double[cells.length];
            for (int k = 0; k < cells.length; k++) {
                try {
                    x[k] = Double.parseDouble(cells[k].replace(",", "."));
                } catch (NumberFormatException e) {
                    throw new IOException("Не число '" + cells[k] + "' в строке " + lineNo
                            + " (" + source + ")", e);
                }
            }

            if (dimension < 0) {
                dimension = x.length;
            } else if (x.length != dimension) {
                throw new IOException("Ожидалось " + dimension + " значений, получено " + x.length
                        + " в строке " + lineNo + " (" + source + ")");
            }
            rows.add(x);
        }

        if (rows.isEmpty()) {
            throw new IOException("План пуст (" + source + ")");
        }
        return rows.toArray(new double[0][]);
    }
}
