package photorestore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InpaintStage {

    private static final Logger logger = LoggerFactory.getLogger(InpaintStage.class);

    public static final int DEFAULT_RADIUS = 5;

    private static final double DISTANCE_EPSILON = 1e-6;

    private final int radius;

    public InpaintStage() {
        this(DEFAULT_RADIUS);
    }

    public InpaintStage(int radius) {
        if (radius < 1) {
            throw new IllegalArgumentException("Inpaint radius must be at least 1, got " + radius);
        }
        this.radius = radius;
    }

    public PixelGrid apply(PixelGrid image, WeightGrid feathered, WeightGrid edges, StageExecutor executor) {
        if (!feathered.sameDimensions(image) || !edges.sameDimensions(image)) {
            throw new IllegalArgumentException("Feathered mask " + feathered + " and edge map " + edges
                    + " must match image " + image);
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] output = new int[width * height];

        executor.run(executor.tiles(width, height, 2 * radius),
                region -> inpaint(image, feathered, edges, output, region));

        logger.debug("Inpaint: radius {} over {}", radius, image);
        return PixelGrid.wrap(width, height, output);
    }

    private void inpaint(PixelGrid image, WeightGrid feathered, WeightGrid edges, int[] output, Region region) {
        int width = image.getWidth();
        for (int y = region.getY(); y < region.getEndY(); y++) {
            for (int x = region.getX(); x < region.getEndX(); x++) {
                int i = y * width + x;
                if (feathered.get(i) > 0) {
                    output[i] = blend(image, feathered, edges, x, y);
                } else {
                    output[i] = image.getArgb(i);
                }
            }
        }
    }

    // Edge- and distance-weighted average of the undamaged neighbors of (x, y)
    int blend(PixelGrid image, WeightGrid feathered, WeightGrid edges, int x, int y) {
        int width = image.getWidth();
        int height = image.getHeight();

        int r = radius;
        if (x < radius || x >= width - radius || y < radius || y >= height - radius) {
            r = 2 * radius; // fewer samples near the border
        }

        double sumR = 0, sumG = 0, sumB = 0, weightSum = 0;
        for (int ny = Math.max(0, y - r); ny <= Math.min(height - 1, y + r); ny++) {
            for (int nx = Math.max(0, x - r); nx <= Math.min(width - 1, x + r); nx++) {
                if (feathered.get(nx, ny) >= 1.0) {
                    continue;
                }
                int dx = nx - x;
                int dy = ny - y;
                double weight = (1.0 - edges.get(nx, ny)) / (Math.sqrt(dx * dx + dy * dy) + DISTANCE_EPSILON);
                int argb = image.getArgb(nx, ny);
                sumR += PixelGrid.red(argb) * weight;
                sumG += PixelGrid.green(argb) * weight;
                sumB += PixelGrid.blue(argb) * weight;
                weightSum += weight;
            }
        }

        int original = image.getArgb(x, y);
        if (weightSum == 0) {
            return original;
        }
        return PixelGrid.pack(PixelGrid.alpha(original),
                PixelGrid.clampChannel(sumR / weightSum),
                PixelGrid.clampChannel(sumG / weightSum),
                PixelGrid.clampChannel(sumB / weightSum));
    }
}
