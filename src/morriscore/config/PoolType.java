package morriscore.config;

/**
 * Откуда берутся базовые точки траекторий.
 */
public enum PoolType {
    GRID,    // регулярная p-уровневая сетка, пул не нужен
    LHS,     // центрированный латинский гиперкуб
    SOBOL,   // квазислучайная последовательность Соболя
    FILE     // готовый план из файла
}
