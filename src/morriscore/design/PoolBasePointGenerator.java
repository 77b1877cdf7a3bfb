package morriscore.design;

import morriscore.random.RandomSource;

/**
 * Базовая точка из готового плана (LHS, Соболь, ...) в [0;1]^d.
 *
 * Индекс разыгрывается равномерно, с возвращением: одна точка пула может
 * стать базой нескольких траекторий. Координата, которой не хватает
 * места на шаг до верхней грани, сдвигается вниз до 1 - step,
 * иначе траектория вышла бы за область.
 */
public final class PoolBasePointGenerator implements BasePointGenerator {

    private final double[][] pool;
    private final double[] ceiling;

    public PoolBasePointGenerator(double[][] pool, double[] step) {
        if (pool.length == 0) throw new IllegalArgumentException("pool must not be empty");
        this.pool = pool;
        this.ceiling = new double[step.length];
        for (int p = 0; p < step.length; p++) {
            ceiling[p] = Math.max(0.0, 1.0 - step[p]);
        }
    }

    @Override
    public double[] next(RandomSource random) {
        int index = random.nextInt(pool.length);
        double[] xBase = pool[index].clone();
        for (int p = 0; p < xBase.length; p++) {
            if (xBase[p] > ceiling[p]) xBase[p] = ceiling[p];
            if (xBase[p] < 0.0) xBase[p] = 0.0;
        }
        return xBase;
    }
}
