// File: morriscore/config/MorrisConstants.java
package morriscore.config;

/**
 * Глобальные константы генератора плана Морриса.
 */
public final class MorrisConstants {

    /** Погрешность вычислений */
    public static final double EPSILON = 1e-6;

    /** Минимально допустимое число уровней по одной координате */
    public static final int MIN_LEVELS = 2;

    // =========================================================================
    // ===========================  ПО УМОЛЧАНИЮ  ==============================
    // =========================================================================

    /** Зерно генератора по умолчанию (общий для всех запусков раннера) */
    public static final long DEFAULT_SEED = 1_000_000L;

    /** Число траекторий r */
    public static final int DEFAULT_TRAJECTORIES = 10;

    /** Число уровней сетки p */
    public static final int DEFAULT_LEVELS = 4;

    /** Размер пула базовых точек (LHS / Sobol) */
    public static final int DEFAULT_POOL_SIZE = 64;

    /**
     * Сколько первых точек последовательности Соболя пропускать.
     * Первая точка всегда нулевой вектор.
     */
    public static final int DEFAULT_SOBOL_SKIP = 1;

    private MorrisConstants() {}
}
