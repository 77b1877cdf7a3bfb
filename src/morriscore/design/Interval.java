package morriscore.design;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;

import java.util.Arrays;

/**
 * Прямоугольная область [lowerBound; upperBound] в R^d.
 */
public final class Interval {

    private final double[] lowerBound;
    private final double[] upperBound;

    /** Единичный гиперкуб [0;1]^d. */
    public Interval(int dimension) {
        if (dimension < 0) throw new IllegalArgumentException("dimension must be >= 0");
        this.lowerBound = new double[dimension];
        this.upperBound = new double[dimension];
        Arrays.fill(upperBound, 1.0);
    }

    public Interval(double[] lowerBound, double[] upperBound) {
        if (lowerBound.length != upperBound.length) {
            throw new DimensionMismatchException(upperBound.length, lowerBound.length);
        }
        for (int k = 0; k < lowerBound.length; k++) {
            if (lowerBound[k] > upperBound[k]) {
                throw new NumberIsTooLargeException(lowerBound[k], upperBound[k], true);
            }
        }
        this.lowerBound = lowerBound.clone();
        this.upperBound = upperBound.clone();
    }

    public int getDimension() {
        return lowerBound.length;
    }

    public double[] getLowerBound() {
        return lowerBound.clone();
    }

    public double[] getUpperBound() {
        return upperBound.clone();
    }

    /** upperBound - lowerBound */
    public double[] getDelta() {
        double[] delta = new double[lowerBound.length];
        for (int k = 0; k < delta.length; k++) {
            delta[k] = upperBound[k] - lowerBound[k];
        }
        return delta;
    }

    /**
     * @param x         точка размерности d
     * @param tolerance допуск на границах
     */
    public boolean contains(double[] x, double tolerance) {
        if (x.length != lowerBound.length) {
            throw new DimensionMismatchException(x.length, lowerBound.length);
        }
        for (int k = 0; k < x.length; k++) {
            if (x[k] < lowerBound[k] - tolerance || x[k] > upperBound[k] + tolerance) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;
        Interval other = (Interval) o;
        return Arrays.equals(lowerBound, other.lowerBound)
                && Arrays.equals(upperBound, other.upperBound);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(lowerBound) + Arrays.hashCode(upperBound);
    }

    @Override
    public String toString() {
        return "Interval" + Arrays.toString(lowerBound) + "-" + Arrays.toString(upperBound);
    }
}
