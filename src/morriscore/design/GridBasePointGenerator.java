package morriscore.design;

import morriscore.config.MorrisConstants;
import morriscore.random.RandomSource;

/**
 * Базовая точка с регулярной сетки: по каждой координате x = j * step,
 * j равномерно из [0; level - 1), где level = floor(1 + 1/step).
 *
 * Координаты разыгрываются независимо, повторы базовых точек допустимы.
 */
public final class GridBasePointGenerator implements BasePointGenerator {

    private final double[] step;
    private final int[] levels;

    public GridBasePointGenerator(double[] step) {
        this.step = step.clone();
        this.levels = new int[step.length];
        for (int p = 0; p < step.length; p++) {
            levels[p] = levelCount(step[p]);
            if (levels[p] < MorrisConstants.MIN_LEVELS) {
                throw new IllegalArgumentException("step[" + p + "]=" + step[p] + " gives less than 2 levels");
            }
        }
    }

    /** Число уровней сетки для шага step; допуск EPSILON гасит ошибку 1/(1/(L-1)). */
    static int levelCount(double step) {
        return (int) Math.floor(1.0 + 1.0 / step + MorrisConstants.EPSILON);
    }

    public int[] getLevels() {
        return levels.clone();
    }

    @Override
    public double[] next(RandomSource random) {
        double[] xBase = new double[step.length];
        for (int p = 0; p < step.length; p++) {
            xBase[p] = step[p] * random.nextInt(levels[p] - 1);
        }
        return xBase;
    }
}
