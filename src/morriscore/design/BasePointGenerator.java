package morriscore.design;

import morriscore.random.RandomSource;

/**
 * Стратегия выбора базовой точки траектории в [0;1]^d.
 */
@FunctionalInterface
public interface BasePointGenerator {

    /**
     * @param random источник случайности (общий для всего плана)
     * @return новая базовая точка; вызывающий может её менять
     */
    double[] next(RandomSource random);
}
