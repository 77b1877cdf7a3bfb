package morriscore.design;

import morriscore.random.RandomSource;
import org.apache.commons.math3.random.SobolSequenceGenerator;

/**
 * Готовые пулы базовых точек в [0;1]^d.
 */
public final class UnitCubePools {

    private UnitCubePools() {}

    /**
     * Первые size точек последовательности Соболя.
     *
     * @param skip сколько начальных точек пропустить (первая всегда нулевая)
     */
    public static double[][] sobol(int size, int dimension, int skip) {
        if (size <= 0) throw new IllegalArgumentException("size must be > 0");
        if (skip < 0) throw new IllegalArgumentException("skip must be >= 0");

        SobolSequenceGenerator sobol = new SobolSequenceGenerator(dimension);
        // skipTo(i) сам отдаёт i-ю точку, поэтому пропускаем перебором
        for (int i = 0; i < skip; i++) sobol.nextVector();

        double[][] pool = new double[size][];
        for (int i = 0; i < size; i++) {
            pool[i] = sobol.nextVector();
        }
        return pool;
    }

    /**
     * Центрированный латинский гиперкуб: по каждой координате каждая из size
     * ячеек занята ровно одной точкой, точка в центре ячейки.
     */
    public static double[][] latinHypercube(int size, int dimension, RandomSource random) {
        if (size <= 0) throw new IllegalArgumentException("size must be > 0");
        if (dimension < 0) throw new IllegalArgumentException("dimension must be >= 0");

        double[][] pool = new double[size][dimension];
        for (int k = 0; k < dimension; k++) {
            int[] cells = random.nextPermutation(size);
            for (int i = 0; i < size; i++) {
                pool[i][k] = (cells[i] + 0.5) / size;
            }
        }
        return pool;
    }
}
