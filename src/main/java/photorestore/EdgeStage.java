package photorestore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EdgeStage {

    private static final Logger logger = LoggerFactory.getLogger(EdgeStage.class);

    public static final double DEFAULT_THRESHOLD = 0.2;

    private static final int[][] SOBEL_X = {
            { -1, 0, 1 },
            { -2, 0, 2 },
            { -1, 0, 1 }
    };

    private static final int[][] SOBEL_Y = {
            { -1, -2, -1 },
            { 0, 0, 0 },
            { 1, 2, 1 }
    };

    private final double threshold;

    public EdgeStage() {
        this(DEFAULT_THRESHOLD);
    }

    public EdgeStage(double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Edge threshold must be within [0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    public WeightGrid apply(PixelGrid image, StageExecutor executor) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[] edges = new double[width * height];
        MaxReducer maxGradient = new MaxReducer();

        executor.run(executor.tiles(width, height, 1),
                region -> maxGradient.merge(gradients(image, edges, region)));

        double max = maxGradient.complete();
        logger.debug("Edge: max gradient {}", max);

        if (max > 0) {
            executor.run(executor.tiles(width, height, 0),
                    region -> normalize(edges, width, max, region));
        }
        return WeightGrid.wrap(width, height, edges);
    }

    // Fills the region's interior cells with raw gradients and returns their maximum
    private static double gradients(PixelGrid image, double[] edges, Region region) {
        int width = image.getWidth();
        int height = image.getHeight();
        double localMax = 0.0;

        for (int y = Math.max(region.getY(), 1); y < Math.min(region.getEndY(), height - 1); y++) {
            for (int x = Math.max(region.getX(), 1); x < Math.min(region.getEndX(), width - 1); x++) {
                double gx = 0, gy = 0;

                for (int ky = -1; ky <= 1; ky++) {
                    for (int kx = -1; kx <= 1; kx++) {
                        double gray = gray(image.getArgb(x + kx, y + ky));
                        gx += SOBEL_X[ky + 1][kx + 1] * gray;
                        gy += SOBEL_Y[ky + 1][kx + 1] * gray;
                    }
                }

                double gradient = Math.sqrt(gx * gx + gy * gy);
                edges[y * width + x] = gradient;
                if (gradient > localMax) {
                    localMax = gradient;
                }
            }
        }
        return localMax;
    }

    private void normalize(double[] edges, int width, double max, Region region) {
        for (int y = region.getY(); y < region.getEndY(); y++) {
            for (int x = region.getX(); x < region.getEndX(); x++) {
                int i = y * width + x;
                double value = edges[i] / max;
                edges[i] = value < threshold ? 0.0 : Math.min(1.0, value);
            }
        }
    }

    static double gray(int argb) {
        return (PixelGrid.red(argb) + PixelGrid.green(argb) + PixelGrid.blue(argb)) / 3.0;
    }
}
