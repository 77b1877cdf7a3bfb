package morriscore.design;

import java.util.ArrayList;
import java.util.List;

public final class DefaultMorrisFactors {

    private DefaultMorrisFactors() {}

    /** x1..xd в [0;1]. */
    public static List<MorrisFactor> unitCube(int dimension) {
        List<MorrisFactor> factors = new ArrayList<>(dimension);
        for (int k = 0; k < dimension; k++) {
            factors.add(new MorrisFactor("x" + (k + 1), 0.0, 1.0));
        }
        return factors;
    }

    /** Тестовая функция Ishigami: три фактора в [-pi; pi]. */
    public static List<MorrisFactor> ishigami() {
        return List.of(
                new MorrisFactor("x1", -Math.PI, Math.PI),
                new MorrisFactor("x2", -Math.PI, Math.PI),
                new MorrisFactor("x3", -Math.PI, Math.PI)
        );
    }

    /** Область определения по списку факторов. */
    public static Interval toInterval(List<MorrisFactor> factors) {
        double[] lower = new double[factors.size()];
        double[] upper = new double[factors.size()];
        for (int k = 0; k < factors.size(); k++) {
            lower[k] = factors.get(k).getMin();
            upper[k] = factors.get(k).getMax();
        }
        return new Interval(lower, upper);
    }
}
