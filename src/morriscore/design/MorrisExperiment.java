// File: morriscore/design/MorrisExperiment.java
package morriscore.design;

import morriscore.random.CommonsRandomSource;
import morriscore.random.RandomSource;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.NotFiniteNumberException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.OutOfRangeException;

import java.util.Arrays;
import java.util.Objects;

/**
 * План эксперимента для метода Морриса (one-at-a-time).
 *
 * Строит N случайных траекторий по d + 1 точке. Соседние точки траектории
 * отличаются ровно одной координатой на один шаг дискретизации.
 * Базовые точки берутся либо с p-уровневой сетки, либо из готового плана
 * (LHS, Соболь), нормированного в [0;1]^d.
 *
 * Область, шаг и пул фиксируются в конструкторе и дальше не меняются;
 * каждый вызов {@link #generate()} строит план заново.
 */
public final class MorrisExperiment {

    private final Interval interval;

    /** Пул базовых точек в [0;1]^d; пустой для сетки. */
    private final double[][] experiment;

    private final double[] step;

    /** Число траекторий. */
    private final int n;

    private final RandomSource random;
    private final BasePointGenerator basePointGenerator;

    /** p-уровневая сетка в [0;1]^d. */
    public MorrisExperiment(int[] levels, int n) {
        this(levels, n, new CommonsRandomSource());
    }

    public MorrisExperiment(int[] levels, int n, RandomSource random) {
        this(new Interval(levels.length), stepFromLevels(levels), new double[0][], n, random);
    }

    /** p-уровневая сетка в заданной области. */
    public MorrisExperiment(int[] levels, Interval interval, int n) {
        this(levels, interval, n, new CommonsRandomSource());
    }

    public MorrisExperiment(int[] levels, Interval interval, int n, RandomSource random) {
        this(requireDimension(interval, levels.length),
                stepFromLevels(levels),
                new double[0][],
                n,
                random);
    }

    /** Готовый план (предположительно LHS), уже лежащий в [0;1]^d. */
    public MorrisExperiment(double[][] lhsDesign, int n) {
        this(lhsDesign, n, new CommonsRandomSource());
    }

    public MorrisExperiment(double[][] lhsDesign, int n, RandomSource random) {
        this(new Interval(poolDimension(lhsDesign)),
                stepFromPool(lhsDesign),
                requireUnitCube(copyOf(lhsDesign)),
                n,
                random);
    }

    /** Готовый план в координатах области; сразу переводится в [0;1]^d. */
    public MorrisExperiment(double[][] lhsDesign, Interval interval, int n) {
        this(lhsDesign, interval, n, new CommonsRandomSource());
    }

    public MorrisExperiment(double[][] lhsDesign, Interval interval, int n, RandomSource random) {
        this(requireDimension(interval, poolDimension(lhsDesign)),
                stepFromPool(lhsDesign),
                requireFinite(normalize(lhsDesign, interval)),
                n,
                random);
    }

    private MorrisExperiment(Interval interval,
                             double[] step,
                             double[][] experiment,
                             int n,
                             RandomSource random) {
        if (n < 0) throw new NotPositiveException(n);
        try {
            Math.multiplyExact(n, step.length + 1);
        } catch (ArithmeticException e) {
            // план из n * (d + 1) строк должен помещаться в массив
            throw new NumberIsTooLargeException(n, Integer.MAX_VALUE / (step.length + 1), true);
        }
        this.interval = Objects.requireNonNull(interval, "interval");
        this.step = step;
        this.experiment = experiment;
        this.n = n;
        this.random = Objects.requireNonNull(random, "random");
        this.basePointGenerator = (experiment.length > 0)
                ? new PoolBasePointGenerator(experiment, step)
                : new GridBasePointGenerator(step);
    }

    /**
     * Восстановление из сохранённого состояния: пул уже нормирован, шаг уже посчитан.
     *
     * @param experiment пул в [0;1]^d или пустой массив для сетки
     */
    public static MorrisExperiment restore(Interval interval,
                                           double[] step,
                                           double[][] experiment,
                                           int n,
                                           RandomSource random) {
        requireDimension(interval, step.length);
        for (int k = 0; k < step.length; k++) {
            if (!(step[k] > 0.0) || Double.isInfinite(step[k])) {
                throw new IllegalArgumentException("step[" + k + "] must be positive; step[" + k + "]=" + step[k]);
            }
        }
        double[][] pool = copyOf(experiment);
        if (pool.length > 0) requireDimension(interval, poolDimension(requireFinite(pool)));
        return new MorrisExperiment(interval, step.clone(), pool, n, random);
    }

    // -------------------------------------------------------------------------
    // Генерация
    // -------------------------------------------------------------------------

    /** План на собственном источнике случайности. */
    public MorrisDesign generate() {
        return generate(random);
    }

    /**
     * Генерация k-й траектории:
     *  1) базовая точка xBase;
     *  2) ориентационная матрица B размера (d + 1) x d;
     *  3) перестановка столбцов P;
     *  4) направления D = diag(+-1);
     *  5) Z = (B * P * D + 1) * 0.5;
     *  6) Z * diag(step) + xBase, затем перевод в область.
     * B * P не умножается явно: шаг p траектории меняет координату permutation[p]
     * по столбцу p матрицы B.
     */
    public MorrisDesign generate(RandomSource random) {
        final int dimension = step.length;
        final double[] lowerBound = interval.getLowerBound();
        final double[] delta = interval.getDelta();

        double[][] realizations = new double[n * (dimension + 1)][dimension];

        for (int k = 0; k < n; k++) {
            double[] xBase = basePointGenerator.next(random);
            int[] permutation = random.nextPermutation(dimension);
            int[] directions = random.nextDirections(dimension);

            for (int p = 0; p < dimension; p++) {
                double[] orientationMatrixColumn = getOrientationMatrixColumn(p);
                int q = permutation[p];
                for (int i = 0; i < dimension + 1; i++) {
                    realizations[k * (dimension + 1) + i][q] = delta[q]
                            * ((orientationMatrixColumn[i] * directions[q] + 1.0) * 0.5 * step[q] + xBase[q])
                            + lowerBound[q];
                }
            }
        }
        return new MorrisDesign(realizations, n, dimension);
    }

    /**
     * p-й столбец ориентационной матрицы: -1 в строках 0..p, +1 ниже.
     */
    public double[] getOrientationMatrixColumn(int p) {
        final int dimension = step.length;
        Objects.checkIndex(p, dimension);
        double[] orientation = new double[dimension + 1];
        Arrays.fill(orientation, 1.0);
        for (int i = 0; i <= p; i++) orientation[i] = -1.0;
        return orientation;
    }

    // -------------------------------------------------------------------------
    // Доступ
    // -------------------------------------------------------------------------

    public Interval getInterval() { return interval; }
    public double[] getStep() { return step.clone(); }
    public double[][] getExperiment() { return copyOf(experiment); }
    public int getN() { return n; }
    public int getDimension() { return step.length; }
    public boolean isPoolBased() { return experiment.length > 0; }

    @Override
    public String toString() {
        return "class=MorrisExperiment"
                + " interval=" + interval
                + " step=" + Arrays.toString(step)
                + " poolSize=" + experiment.length
                + " N=" + n;
    }

    // -------------------------------------------------------------------------
    // Проверки и вспомогательное
    // -------------------------------------------------------------------------

    private static double[] stepFromLevels(int[] levels) {
        double[] step = new double[levels.length];
        for (int k = 0; k < levels.length; k++) {
            if (levels[k] <= 1) {
                // уровни должны быть >= 2
                throw new NumberIsTooSmallException(levels[k], 2, true);
            }
            step[k] = 1.0 / (levels[k] - 1.0);
        }
        return step;
    }

    private static double[] stepFromPool(double[][] lhsDesign) {
        double[] step = new double[poolDimension(lhsDesign)];
        Arrays.fill(step, 0.5 / lhsDesign.length);
        return step;
    }

    private static int poolDimension(double[][] lhsDesign) {
        if (lhsDesign.length == 0) throw new NoDataException();
        int dimension = lhsDesign[0].length;
        for (double[] x : lhsDesign) {
            if (x.length != dimension) throw new DimensionMismatchException(x.length, dimension);
        }
        return dimension;
    }

    private static Interval requireDimension(Interval interval, int dimension) {
        if (interval.getDimension() != dimension) {
            throw new DimensionMismatchException(dimension, interval.getDimension());
        }
        return interval;
    }

    private static double[][] requireUnitCube(double[][] lhsDesign) {
        for (double[] x : lhsDesign) {
            for (double v : x) {
                if (!(v >= 0.0 && v <= 1.0)) throw new OutOfRangeException(v, 0.0, 1.0);
            }
        }
        return lhsDesign;
    }

    private static double[][] requireFinite(double[][] pool) {
        for (double[] x : pool) {
            for (double v : x) {
                if (!Double.isFinite(v)) throw new NotFiniteNumberException(v);
            }
        }
        return pool;
    }

    /** (x - lowerBound) / (upperBound - lowerBound); вырожденная координата -> 0. */
    private static double[][] normalize(double[][] lhsDesign, Interval interval) {
        final double[] lowerBound = interval.getLowerBound();
        final double[] delta = interval.getDelta();
        double[][] normalized = new double[lhsDesign.length][];
        for (int i = 0; i < lhsDesign.length; i++) {
            double[] x = new double[delta.length];
            for (int k = 0; k < delta.length; k++) {
                x[k] = (delta[k] == 0.0) ? 0.0 : (lhsDesign[i][k] - lowerBound[k]) / delta[k];
            }
            normalized[i] = x;
        }
        return normalized;
    }

    private static double[][] copyOf(double[][] sample) {
        double[][] copy = new double[sample.length][];
        for (int i = 0; i < sample.length; i++) copy[i] = sample[i].clone();
        return copy;
    }
}
