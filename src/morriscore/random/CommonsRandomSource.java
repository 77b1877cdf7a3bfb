package morriscore.random;

import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.exception.NotPositiveException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * RandomSource поверх commons-math3.
 *
 * Все три вида выборок (целое, перестановка, направление) идут из одного
 * потока {@link RandomGenerator}, поэтому зерно полностью задаёт результат.
 */
public final class CommonsRandomSource implements RandomSource {

    private static final int[] DIRECTIONS = {1, -1};
    private static final double[] DIRECTION_PROBABILITIES = {0.5, 0.5};

    private final RandomGenerator rng;
    private final RandomDataGenerator data;
    private final EnumeratedIntegerDistribution directionDistribution;

    /** Зерно от системного времени. */
    public CommonsRandomSource() {
        this(new MersenneTwister());
    }

    /**
     * @param seed зерно генератора (для повторяемости)
     */
    public CommonsRandomSource(long seed) {
        this(new MersenneTwister(seed));
    }

    public CommonsRandomSource(RandomGenerator rng) {
        if (rng == null) throw new IllegalArgumentException("rng must not be null");
        this.rng = rng;
        this.data = new RandomDataGenerator(rng);
        this.directionDistribution =
                new EnumeratedIntegerDistribution(rng, DIRECTIONS, DIRECTION_PROBABILITIES);
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) throw new NotStrictlyPositiveException(bound);
        return rng.nextInt(bound);
    }

    @Override
    public int[] nextPermutation(int n) {
        if (n < 0) throw new NotPositiveException(n);
        // nextPermutation(n, k) не принимает k = 0
        if (n == 0) return new int[0];
        return data.nextPermutation(n, n);
    }

    @Override
    public int[] nextDirections(int n) {
        if (n < 0) throw new NotPositiveException(n);
        if (n == 0) return new int[0];
        return directionDistribution.sample(n);
    }
}
