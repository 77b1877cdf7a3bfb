package morriscore.design;

import java.util.Objects;

/**
 * Входной фактор модели: имя и диапазон [min, max].
 */
public final class MorrisFactor {

    private final String name;
    private final double min;
    private final double max;

    public MorrisFactor(String name, double min, double max) {
        if (max < min) throw new IllegalArgumentException("max < min for " + name);
        this.name = Objects.requireNonNull(name);
        this.min = min;
        this.max = max;
    }

    public String getName() { return name; }
    public double getMin() { return min; }
    public double getMax() { return max; }

    /** Перевод из [0..1] в [min..max]. */
    public double scaleFromUnit(double u) {
        return min + u * (max - min);
    }

    /** Обратный перевод из [min..max] в [0..1]; для вырожденного диапазона 0. */
    public double toUnit(double v) {
        double width = max - min;
        if (width == 0.0) return 0.0;
        return (v - min) / width;
    }

    @Override
    public String toString() {
        return name + "[" + min + ", " + max + "]";
    }
}
