package morriscore.io;

import static org.assertj.core.api.Assertions.*;

import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import morriscore.design.Interval;
import morriscore.design.MorrisExperiment;
import morriscore.design.UnitCubePools;
import morriscore.random.CommonsRandomSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MorrisExperimentStoreTest {

    @Test
    void gridRoundTripReproducesDesign(@TempDir Path dir) throws IOException {
        Interval interval = new Interval(new double[]{-Math.PI, 0.1, 3.0}, new double[]{Math.PI, 0.7, 11.0});
        MorrisExperiment saved = new MorrisExperiment(new int[]{4, 7, 3}, interval, 12);

        Path file = dir.resolve("experiment.json");
        MorrisExperimentStore.save(saved, file);
        MorrisExperiment loaded = MorrisExperimentStore.load(file, new CommonsRandomSource(31L));

        assertThat(loaded.getInterval()).isEqualTo(saved.getInterval());
        assertThat(loaded.getStep()).containsExactly(saved.getStep());
        assertThat(loaded.getN()).isEqualTo(12);
        assertThat(loaded.isPoolBased()).isFalse();

        double[][] expected = saved.generate(new CommonsRandomSource(31L)).toArray();
        assertThat(Arrays.deepEquals(loaded.generate().toArray(), expected)).isTrue();
    }

    @Test
    void poolRoundTripKeepsNormalizedPool() {
        Interval interval = new Interval(new double[]{0.0, 100.0}, new double[]{3.0, 200.0});
        double[][] pool = UnitCubePools.sobol(5, 2, 1);
        for (double[] x : pool) {
            x[0] = 3.0 * x[0];
            x[1] = 100.0 + 100.0 * x[1];
        }
        MorrisExperiment saved = new MorrisExperiment(pool, interval, 4);

        String json = MorrisExperimentStore.toJson(saved);
        MorrisExperiment loaded = MorrisExperimentStore.fromJson(json, new CommonsRandomSource(2L));

        assertThat(Arrays.deepEquals(loaded.getExperiment(), saved.getExperiment())).isTrue();
        assertThat(loaded.getStep()).containsExactly(0.1, 0.1);

        double[][] expected = saved.generate(new CommonsRandomSource(2L)).toArray();
        assertThat(Arrays.deepEquals(loaded.generate().toArray(), expected)).isTrue();
    }

    @Test
    void jsonUsesSnakeCaseFields() {
        String json = MorrisExperimentStore.toJson(new MorrisExperiment(new int[]{3}, 2));
        assertThat(json).contains("\"lower_bound\"", "\"upper_bound\"", "\"step\"", "\"trajectories\": 2");
    }

    @Test
    void missingFieldRejected() {
        String json = "{\"lower_bound\": [0.0], \"upper_bound\": [1.0], \"trajectories\": 3}";
        assertThatThrownBy(() -> MorrisExperimentStore.fromJson(json, new CommonsRandomSource(1L)))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("step");
    }

    @Test
    void inconsistentStateRejected() {
        String json = "{\"lower_bound\": [0.0, 0.0], \"upper_bound\": [1.0, 1.0],"
                + " \"step\": [0.5], \"trajectories\": 3}";
        assertThatThrownBy(() -> MorrisExperimentStore.fromJson(json, new CommonsRandomSource(1L)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
