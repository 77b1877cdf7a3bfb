package morriscore;

import morriscore.config.MorrisConfig;
import morriscore.config.MorrisConstants;
import morriscore.config.PoolType;
import morriscore.design.*;
import morriscore.io.DesignCsvWriter;
import morriscore.io.DesignExcelWriter;
import morriscore.io.MorrisExperimentStore;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Генерация плана Морриса для тестовой функции Ishigami.
 *
 * Аргументы (все необязательны):
 * [GRID|LHS|SOBOL] [число траекторий] [зерно] [results.xlsx] [design.csv]
 */
public final class MainMorris {

    public static void main(String[] args) {

        try {
            // 0) аргументы
            PoolType poolType = (args.length > 0) ? PoolType.valueOf(args[0].toUpperCase()) : PoolType.GRID;
            int trajectories = (args.length > 1) ? Integer.parseInt(args[1]) : MorrisConstants.DEFAULT_TRAJECTORIES;
            long seed = (args.length > 2) ? Long.parseLong(args[2]) : MorrisConstants.DEFAULT_SEED;
            String resultsXlsxPath = (args.length > 3) ? args[3] : "morris_design.xlsx";
            String designCsvPath = (args.length > 4) ? args[4] : "morris_design.csv";
            String statePath = resultsXlsxPath.replaceAll("\\.xlsx$", "") + ".json";

            // 1) факторы и конфиг
            List<MorrisFactor> factors = DefaultMorrisFactors.ishigami();
            MorrisConfig cfg = buildConfig(poolType, trajectories, seed, factors);

            // 2) генератор
            MorrisExperiment experiment = cfg.buildExperiment();
            System.out.println("Experiment: " + experiment);

            // 3) план
            MorrisDesign design = experiment.generate();

            // 4) проверка траекторий
            TrajectoryChecker.Report report = TrajectoryChecker.check(experiment, design);
            System.out.printf("Morris design: d=%d N=%d points=%d%n",
                    design.getDimension(), design.getTrajectoryCount(), design.getSize());
            System.out.println("Check: " + report);
            System.out.println("Perturbations per factor: " + Arrays.toString(report.getPerturbations()));
            if (!report.isValid()) {
                System.err.println("Plan violates trajectory structure, see check above");
            }

            // 5) сохранение
            DesignExcelWriter.writeXlsx(resultsXlsxPath, experiment, factors, design);
            DesignCsvWriter.write(designCsvPath, experiment, factors, design);
            MorrisExperimentStore.save(experiment, Path.of(statePath));

            System.out.println("Saved: " + resultsXlsxPath + ", " + designCsvPath + ", " + statePath);

        } catch (Exception e) {
            System.err.println("Ошибка в MainMorris: " + e.getMessage());
            e.printStackTrace();
        }
    }

    static MorrisConfig buildConfig(PoolType poolType,
                                    int trajectories,
                                    long seed,
                                    List<MorrisFactor> factors) {
        if (poolType == PoolType.GRID) {
            return MorrisConfig.grid(trajectories, seed, MorrisConstants.DEFAULT_LEVELS, factors);
        }
        if (poolType == PoolType.FILE) {
            throw new IllegalArgumentException("FILE pools are configured through MorrisConfig.poolFile");
        }
        return MorrisConfig.pool(trajectories, seed, poolType, MorrisConstants.DEFAULT_POOL_SIZE, factors);
    }
}
