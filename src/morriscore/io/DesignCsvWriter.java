package morriscore.io;

import morriscore.design.MorrisDesign;
import morriscore.design.MorrisExperiment;
import morriscore.design.MorrisFactor;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

public final class DesignCsvWriter {

    private static final Locale RU = new Locale("ru", "RU");

    private DesignCsvWriter() {}

    public static void write(String path,
                             MorrisExperiment experiment,
                             List<MorrisFactor> factors,
                             MorrisDesign design) throws IOException {
        try (BufferedWriter w = new BufferedWriter(new FileWriter(path, false))) {
            write(w, experiment, factors, design);
        }
    }

    /**
     * Строка паспорта, заголовок k;traj;row;имена факторов, затем по строке на точку.
     */
    public static void write(Writer out,
                             MorrisExperiment experiment,
                             List<MorrisFactor> factors,
                             MorrisDesign design) throws IOException {

        if (factors.size() != design.getDimension()) {
            throw new IllegalArgumentException("factors.size != design.dimension");
        }

        BufferedWriter w = (out instanceof BufferedWriter) ? (BufferedWriter) out : new BufferedWriter(out);

        w.write(csvCell(buildPassport(experiment)));
        w.newLine();

        StringBuilder hdr = new StringBuilder("k;traj;row");
        for (MorrisFactor f : factors) hdr.append(';').append(f.getName());
        w.write(hdr.toString());
        w.newLine();

        final int len = design.getTrajectoryLength();
        for (int k = 0; k < design.getSize(); k++) {
            StringBuilder sb = new StringBuilder(64);
            sb.append(k).append(';')
                    .append(k / len).append(';')
                    .append(k % len);
            for (int j = 0; j < design.getDimension(); j++) {
                sb.append(';').append(fmt6(design.get(k, j)));
            }
            w.write(sb.toString());
            w.newLine();
        }
        w.flush();
    }

    static String buildPassport(MorrisExperiment e) {
        return String.format(RU, "d=%d; N=%d; pool=%s; poolSize=%d; step=%s",
                e.getDimension(),
                e.getN(),
                e.isPoolBased() ? "yes" : "grid",
                e.getExperiment().length,
                stepList(e.getStep()));
    }

    private static String stepList(double[] step) {
        StringBuilder sb = new StringBuilder("[");
        for (int k = 0; k < step.length; k++) {
            if (k > 0) sb.append(' ');
            sb.append(String.format(RU, "%.4f", step[k]));
        }
        return sb.append(']').toString();
    }

    private static String csvCell(String s) {
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    private static String fmt6(double v) { return String.format(RU, "%.6f", v); }
}
