package photorestore;

public final class Kernel {

    private final int size;
    private final double[][] weights;

    private Kernel(double[][] weights) {
        this.size = weights.length;
        this.weights = weights;
    }

    public static Kernel of(double[][] weights) {
        int size = weights.length;
        checkSize(size);
        double[][] copy = new double[size][];
        for (int i = 0; i < size; i++) {
            if (weights[i].length != size) {
                throw new IllegalArgumentException("Kernel must be square, row " + i + " has "
                        + weights[i].length + " weights");
            }
            copy[i] = weights[i].clone();
        }
        return new Kernel(copy);
    }

    // Samples the 2D Gaussian density on a size x size grid and normalizes it to sum 1
    public static Kernel gaussian(int size, double sigma) {
        checkSize(size);
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("Sigma must be positive, got " + sigma);
        }

        double[][] kernel = new double[size][size];
        int center = size / 2;
        double sum = 0.0;

        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                double exponent = -((x - center) * (x - center) + (y - center) * (y - center))
                        / (2 * sigma * sigma);
                kernel[y][x] = Math.exp(exponent) / (2 * Math.PI * sigma * sigma);
                sum += kernel[y][x];
            }
        }

        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                kernel[y][x] /= sum;
            }
        }
        return new Kernel(kernel);
    }

    // Center-heavy sharpening kernel, weights sum to 1
    public static Kernel sharpen() {
        return new Kernel(new double[][] {
                { -1, -2, -1 },
                { -2, 13, -2 },
                { -1, -2, -1 }
        });
    }

    // Lighter four-neighbor sharpening kernel, weights sum to 1
    public static Kernel crossSharpen() {
        return new Kernel(new double[][] {
                { 0, -1, 0 },
                { -1, 5, -1 },
                { 0, -1, 0 }
        });
    }

    public int getSize() {
        return size;
    }

    public int getRadius() {
        return size / 2;
    }

    public double get(int row, int column) {
        return weights[row][column];
    }

    double sum() {
        double sum = 0.0;
        for (double[] row : weights) {
            for (double w : row) {
                sum += w;
            }
        }
        return sum;
    }

    private static void checkSize(int size) {
        if (size < 1 || size % 2 == 0) {
            throw new IllegalArgumentException("Kernel size must be a positive odd number, got " + size);
        }
    }
}
