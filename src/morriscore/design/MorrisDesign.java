package morriscore.design;

/**
 * Сгенерированный план: N траекторий по d + 1 точке, подряд.
 *
 * Порядок строк важен: точки сгруппированы по траекториям в порядке генерации,
 * внутри траектории идут в порядке обхода. По нему потом восстанавливаются
 * элементарные эффекты.
 */
public final class MorrisDesign {

    private final double[][] points;
    private final int trajectoryCount;
    private final int dimension;

    MorrisDesign(double[][] points, int trajectoryCount, int dimension) {
        if (points.length != trajectoryCount * (dimension + 1)) {
            throw new IllegalArgumentException("points.length != N * (d + 1): " + points.length
                    + " vs " + trajectoryCount + " * " + (dimension + 1));
        }
        this.points = points;
        this.trajectoryCount = trajectoryCount;
        this.dimension = dimension;
    }

    /** Общее число точек N * (d + 1). */
    public int getSize() { return points.length; }
    public int getDimension() { return dimension; }
    public int getTrajectoryCount() { return trajectoryCount; }

    /** Число точек в одной траектории. */
    public int getTrajectoryLength() { return dimension + 1; }

    public double[] getPoint(int index) {
        return points[index].clone();
    }

    public double get(int index, int k) {
        return points[index][k];
    }

    /**
     * @param k номер траектории 0..N-1
     * @return d + 1 точек траектории в порядке обхода
     */
    public double[][] getTrajectory(int k) {
        if (k < 0 || k >= trajectoryCount) {
            throw new IndexOutOfBoundsException("trajectory " + k + " of " + trajectoryCount);
        }
        double[][] trajectory = new double[dimension + 1][];
        for (int i = 0; i <= dimension; i++) {
            trajectory[i] = points[k * (dimension + 1) + i].clone();
        }
        return trajectory;
    }

    public double[][] toArray() {
        double[][] copy = new double[points.length][];
        for (int i = 0; i < points.length; i++) copy[i] = points[i].clone();
        return copy;
    }
}
