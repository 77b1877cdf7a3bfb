package morriscore.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import morriscore.design.Interval;
import morriscore.design.MorrisExperiment;
import morriscore.random.RandomSource;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Сохранение и загрузка состояния {@link MorrisExperiment} в JSON.
 *
 * <p>Хранится всё, что фиксируется в конструкторе: границы области,
 * нормированный пул, шаг и число траекторий. Double пишется без потери
 * точности, поэтому загруженный генератор на том же состоянии источника
 * случайности выдаёт тот же план бит в бит.
 *
 * <pre>{@code
 * {
 *   "lower_bound": [0.0, 0.0],
 *   "upper_bound": [1.0, 1.0],
 *   "experiment": [],
 *   "step": [0.5, 0.5],
 *   "trajectories": 10
 * }
 * }</pre>
 */
public final class MorrisExperimentStore {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private MorrisExperimentStore() {}

    static final class State {
        @SerializedName("lower_bound")
        double[] lowerBound;

        @SerializedName("upper_bound")
        double[] upperBound;

        @SerializedName("experiment")
        double[][] experiment;

        @SerializedName("step")
        double[] step;

        @SerializedName("trajectories")
        Integer trajectories;
    }

    public static void save(MorrisExperiment experiment, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toState(experiment), writer);
        }
    }

    public static MorrisExperiment load(Path path, RandomSource random) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromState(GSON.fromJson(reader, State.class), random);
        }
    }

    public static String toJson(MorrisExperiment experiment) {
        return GSON.toJson(toState(experiment));
    }

    public static MorrisExperiment fromJson(String json, RandomSource random) {
        return fromState(GSON.fromJson(json, State.class), random);
    }

    private static State toState(MorrisExperiment experiment) {
        State s = new State();
        s.lowerBound = experiment.getInterval().getLowerBound();
        s.upperBound = experiment.getInterval().getUpperBound();
        s.experiment = experiment.getExperiment();
        s.step = experiment.getStep();
        s.trajectories = experiment.getN();
        return s;
    }

    private static MorrisExperiment fromState(State s, RandomSource random) {
        if (s == null) throw new JsonParseException("empty experiment state");
        require(s.lowerBound, "lower_bound");
        require(s.upperBound, "upper_bound");
        require(s.step, "step");
        require(s.trajectories, "trajectories");
        double[][] experiment = (s.experiment == null) ? new double[0][] : s.experiment;

        return MorrisExperiment.restore(
                new Interval(s.lowerBound, s.upperBound),
                s.step,
                experiment,
                s.trajectories,
                random);
    }

    private static void require(Object value, String field) {
        if (value == null) throw new JsonParseException("missing field: " + field);
    }
}
