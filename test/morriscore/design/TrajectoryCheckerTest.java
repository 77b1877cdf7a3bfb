package morriscore.design;

import static org.assertj.core.api.Assertions.*;

import morriscore.random.CommonsRandomSource;
import org.junit.jupiter.api.Test;

class TrajectoryCheckerTest {

    private static final Interval UNIT_SQUARE = new Interval(2);
    private static final double[] HALF = {0.5, 0.5};

    @Test
    void generatedDesignIsValid() {
        MorrisExperiment e = new MorrisExperiment(new int[]{5, 5, 5}, 30, new CommonsRandomSource(4L));
        TrajectoryChecker.Report report = TrajectoryChecker.check(e, e.generate());
        assertThat(report.isValid()).isTrue();
        assertThat(report.getExpectedSize()).isEqualTo(120);
        assertThat(report.getActualSize()).isEqualTo(120);
        assertThat(report.getPerturbations()).containsExactly(30, 30, 30);
    }

    @Test
    void degenerateDimensionAcceptedWithoutVisibleMove() {
        Interval domain = new Interval(new double[]{0.0, 2.0}, new double[]{1.0, 2.0});
        MorrisExperiment e = new MorrisExperiment(new int[]{3, 3}, domain, 10, new CommonsRandomSource(8L));
        TrajectoryChecker.Report report = TrajectoryChecker.check(e, e.generate());

        assertThat(report.getStepViolations()).isZero();
        assertThat(report.getRepeatViolations()).isZero();
        assertThat(report.isValid()).isTrue();
        assertThat(report.getPerturbations()).containsExactly(10, 10);
    }

    @Test
    void unchangedRowWithoutDegenerateDimensionIsViolation() {
        MorrisDesign design = new MorrisDesign(new double[][]{
                {0.0, 0.0}, {0.0, 0.0}, {0.0, 0.5}}, 1, 2);
        TrajectoryChecker.Report report = TrajectoryChecker.check(design, UNIT_SQUARE, HALF, 1, 1e-9);
        assertThat(report.getStepViolations()).isEqualTo(1);
    }

    @Test
    void detectsTwoCoordinatesChangedAtOnce() {
        MorrisDesign design = new MorrisDesign(new double[][]{
                {0.0, 0.0}, {0.5, 0.5}, {0.5, 1.0}}, 1, 2);
        TrajectoryChecker.Report report = TrajectoryChecker.check(design, UNIT_SQUARE, HALF, 1, 1e-9);
        assertThat(report.getStepViolations()).isEqualTo(1);
        assertThat(report.isValid()).isFalse();
    }

    @Test
    void detectsWrongStepLength() {
        MorrisDesign design = new MorrisDesign(new double[][]{
                {0.0, 0.0}, {0.25, 0.0}, {0.25, 0.5}}, 1, 2);
        TrajectoryChecker.Report report = TrajectoryChecker.check(design, UNIT_SQUARE, HALF, 1, 1e-9);
        assertThat(report.getStepViolations()).isEqualTo(1);
    }

    @Test
    void detectsSameCoordinateMovedTwice() {
        MorrisDesign design = new MorrisDesign(new double[][]{
                {0.0, 0.0}, {0.5, 0.0}, {1.0, 0.0}}, 1, 2);
        TrajectoryChecker.Report report = TrajectoryChecker.check(design, UNIT_SQUARE, HALF, 1, 1e-9);
        assertThat(report.getStepViolations()).isZero();
        assertThat(report.getRepeatViolations()).isEqualTo(1);
    }

    @Test
    void detectsPointsOutsideDomain() {
        MorrisDesign design = new MorrisDesign(new double[][]{
                {0.75, 0.0}, {1.25, 0.0}, {1.25, 0.5}}, 1, 2);
        TrajectoryChecker.Report report = TrajectoryChecker.check(design, UNIT_SQUARE, HALF, 1, 1e-9);
        assertThat(report.getBoundViolations()).isEqualTo(2);
        assertThat(report.getStepViolations()).isZero();
    }

    @Test
    void detectsSizeMismatch() {
        MorrisDesign design = new MorrisDesign(new double[][]{
                {0.0, 0.0}, {0.5, 0.0}, {0.5, 0.5}}, 1, 2);
        TrajectoryChecker.Report report = TrajectoryChecker.check(design, UNIT_SQUARE, HALF, 2, 1e-9);
        assertThat(report.getExpectedSize()).isEqualTo(6);
        assertThat(report.isValid()).isFalse();
    }
}
