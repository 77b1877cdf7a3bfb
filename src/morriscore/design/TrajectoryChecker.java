package morriscore.design;

import morriscore.config.MorrisConstants;

/**
 * Проверка структуры плана Морриса:
 * - в плане N * (d + 1) точек;
 * - соседние точки траектории отличаются ровно одной координатой k на delta_k * step_k;
 * - за траекторию каждая координата меняется ровно один раз;
 * - все точки лежат в области.
 */
public final class TrajectoryChecker {

    private TrajectoryChecker() {}

    public static final class Report {
        private final int expectedSize;
        private final int actualSize;
        private final int stepViolations;
        private final int repeatViolations;
        private final int boundViolations;
        private final int[] perturbations;

        public Report(int expectedSize,
                      int actualSize,
                      int stepViolations,
                      int repeatViolations,
                      int boundViolations,
                      int[] perturbations) {
            this.expectedSize = expectedSize;
            this.actualSize = actualSize;
            this.stepViolations = stepViolations;
            this.repeatViolations = repeatViolations;
            this.boundViolations = boundViolations;
            this.perturbations = perturbations;
        }

        public int getExpectedSize()      { return expectedSize; }
        public int getActualSize()        { return actualSize; }
        public int getStepViolations()    { return stepViolations; }
        public int getRepeatViolations()  { return repeatViolations; }
        public int getBoundViolations()   { return boundViolations; }

        /** Сколько раз менялась каждая координата по всему плану. */
        public int[] getPerturbations()   { return perturbations.clone(); }

        public boolean isValid() {
            return expectedSize == actualSize
                    && stepViolations == 0
                    && repeatViolations == 0
                    && boundViolations == 0;
        }

        @Override
        public String toString() {
            return String.format(
                    "size=%d/%d stepViolations=%d repeatViolations=%d boundViolations=%d",
                    actualSize, expectedSize, stepViolations, repeatViolations, boundViolations);
        }
    }

    public static Report check(MorrisExperiment experiment, MorrisDesign design) {
        return check(design, experiment.getInterval(), experiment.getStep(), experiment.getN(),
                MorrisConstants.EPSILON);
    }

    public static Report check(MorrisDesign design,
                               Interval interval,
                               double[] step,
                               int trajectories,
                               double tolerance) {

        final int d = step.length;
        final double[] delta = interval.getDelta();
        final int expectedSize = trajectories * (d + 1);

        int stepViolations = 0;
        int repeatViolations = 0;
        int boundViolations = 0;
        int[] perturbations = new int[d];

        for (int i = 0; i < design.getSize(); i++) {
            if (!interval.contains(design.getPoint(i), tolerance)) boundViolations++;
        }

        for (int t = 0; t < design.getTrajectoryCount(); t++) {
            double[][] trajectory = design.getTrajectory(t);
            boolean[] seen = new boolean[d];

            for (int i = 0; i < d; i++) {
                int changed = -1;
                int changedCount = 0;
                for (int k = 0; k < d; k++) {
                    if (Math.abs(trajectory[i + 1][k] - trajectory[i][k]) > tolerance) {
                        changed = k;
                        changedCount++;
                    }
                }
                if (changedCount == 0) {
                    // вырожденная координата (нулевой шаг в единицах фактора) не видна в плане
                    int degenerate = -1;
                    for (int k = 0; k < d; k++) {
                        if (!seen[k] && delta[k] * step[k] <= tolerance) {
                            degenerate = k;
                            break;
                        }
                    }
                    if (degenerate < 0) {
                        stepViolations++;
                    } else {
                        seen[degenerate] = true;
                        perturbations[degenerate]++;
                    }
                    continue;
                }
                if (changedCount != 1) {
                    stepViolations++;
                    continue;
                }
                double expected = delta[changed] * step[changed];
                double actual = Math.abs(trajectory[i + 1][changed] - trajectory[i][changed]);
                if (Math.abs(actual - expected) > tolerance * Math.max(1.0, expected)) {
                    stepViolations++;
                }
                if (seen[changed]) repeatViolations++;
                seen[changed] = true;
                perturbations[changed]++;
            }
        }

        return new Report(expectedSize, design.getSize(), stepViolations, repeatViolations,
                boundViolations, perturbations);
    }
}
