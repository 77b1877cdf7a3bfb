package morriscore.config;

import morriscore.design.DefaultMorrisFactors;
import morriscore.design.Interval;
import morriscore.design.MorrisExperiment;
import morriscore.design.MorrisFactor;
import morriscore.design.UnitCubePools;
import morriscore.io.PoolCsvLoader;
import morriscore.random.CommonsRandomSource;
import morriscore.random.RandomSource;

import java.io.IOException;
import java.util.*;

/**
 * Параметры одного запуска генератора: факторы, число траекторий, зерно
 * и источник базовых точек.
 */
public final class MorrisConfig {

    private final int trajectories;
    private final long seed;
    private final PoolType poolType;
    private final int levels;
    private final int poolSize;
    private final String poolFile;

    private final List<MorrisFactor> factors;

    private MorrisConfig(int trajectories,
                         long seed,
                         PoolType poolType,
                         int levels,
                         int poolSize,
                         String poolFile,
                         List<MorrisFactor> factors) {
        if (trajectories <= 0) throw new IllegalArgumentException("trajectories must be > 0");
        Objects.requireNonNull(poolType, "poolType");
        Objects.requireNonNull(factors, "factors");
        if (factors.isEmpty()) throw new IllegalArgumentException("factors must not be empty");
        if (poolType == PoolType.GRID && levels < MorrisConstants.MIN_LEVELS) {
            throw new IllegalArgumentException("levels must be >= " + MorrisConstants.MIN_LEVELS);
        }
        if ((poolType == PoolType.LHS || poolType == PoolType.SOBOL) && poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }
        if (poolType == PoolType.FILE && (poolFile == null || poolFile.isBlank())) {
            throw new IllegalArgumentException("poolFile is required for " + poolType);
        }

        this.trajectories = trajectories;
        this.seed = seed;
        this.poolType = poolType;
        this.levels = levels;
        this.poolSize = poolSize;
        this.poolFile = poolFile;
        this.factors = new ArrayList<>(factors);
    }

    /** p-уровневая сетка, одинаковое число уровней по всем факторам. */
    public static MorrisConfig grid(int trajectories,
                                    long seed,
                                    int levels,
                                    List<MorrisFactor> factors) {
        return new MorrisConfig(trajectories, seed, PoolType.GRID, levels, 0, null, factors);
    }

    /** Пул из LHS или последовательности Соболя заданного размера. */
    public static MorrisConfig pool(int trajectories,
                                    long seed,
                                    PoolType poolType,
                                    int poolSize,
                                    List<MorrisFactor> factors) {
        if (poolType != PoolType.LHS && poolType != PoolType.SOBOL) {
            throw new IllegalArgumentException("pool() supports LHS and SOBOL, got " + poolType);
        }
        return new MorrisConfig(trajectories, seed, poolType, 0, poolSize, null, factors);
    }

    /** Пул из файла; точки в координатах факторов, не в [0;1]. */
    public static MorrisConfig poolFile(int trajectories,
                                        long seed,
                                        String poolFile,
                                        List<MorrisFactor> factors) {
        return new MorrisConfig(trajectories, seed, PoolType.FILE, 0, 0, poolFile, factors);
    }

    public int getTrajectories() { return trajectories; }
    public long getSeed() { return seed; }
    public PoolType getPoolType() { return poolType; }
    public int getLevels() { return levels; }
    public int getPoolSize() { return poolSize; }
    public String getPoolFile() { return poolFile; }

    public List<MorrisFactor> getFactors() { return Collections.unmodifiableList(factors); }
    public int dim() { return factors.size(); }

    public Interval getInterval() {
        return DefaultMorrisFactors.toInterval(factors);
    }

    /**
     * Собирает генератор. Один источник случайности на весь запуск:
     * сначала из него строится LHS (если нужен), затем траектории.
     */
    public MorrisExperiment buildExperiment() throws IOException {
        RandomSource random = new CommonsRandomSource(seed);
        Interval interval = getInterval();

        switch (poolType) {
            case GRID: {
                int[] lv = new int[dim()];
                Arrays.fill(lv, levels);
                return new MorrisExperiment(lv, interval, trajectories, random);
            }
            case LHS: {
                double[][] unit = UnitCubePools.latinHypercube(poolSize, dim(), random);
                return new MorrisExperiment(scaleFromUnit(unit), interval, trajectories, random);
            }
            case SOBOL: {
                double[][] unit = UnitCubePools.sobol(poolSize, dim(), MorrisConstants.DEFAULT_SOBOL_SKIP);
                return new MorrisExperiment(scaleFromUnit(unit), interval, trajectories, random);
            }
            case FILE: {
                double[][] pool = new PoolCsvLoader().load(poolFile);
                return new MorrisExperiment(pool, interval, trajectories, random);
            }
            default:
                throw new IllegalStateException("Unknown pool type: " + poolType);
        }
    }

    // Пулы строятся в [0;1]^d, а конструктор с областью ждёт координаты факторов
    private double[][] scaleFromUnit(double[][] unit) {
        double[][] scaled = new double[unit.length][dim()];
        for (int i = 0; i < unit.length; i++) {
            for (int k = 0; k < dim(); k++) {
                scaled[i][k] = factors.get(k).scaleFromUnit(unit[i][k]);
            }
        }
        return scaled;
    }

    @Override
    public String toString() {
        return "MorrisConfig{N=" + trajectories + ", seed=" + seed + ", pool=" + poolType
                + ", levels=" + levels + ", poolSize=" + poolSize + ", factors=" + factors + "}";
    }
}
