package photorestore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MaskStage {

    private static final Logger logger = LoggerFactory.getLogger(MaskStage.class);

    public static final int DEFAULT_THRESHOLD = 427;

    private final int threshold;

    public MaskStage() {
        this(DEFAULT_THRESHOLD);
    }

    public MaskStage(int threshold) {
        if (threshold < 0 || threshold > 765) {
            throw new IllegalArgumentException("Mask threshold must be within [0, 765], got " + threshold);
        }
        this.threshold = threshold;
    }

    public WeightGrid apply(PixelGrid image, StageExecutor executor) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[] mask = new double[width * height];

        // No neighborhood, no halo
        executor.run(executor.tiles(width, height, 0),
                region -> classify(image, mask, region));

        WeightGrid result = WeightGrid.wrap(width, height, mask);
        logger.debug("Mask: {} of {} pixels damaged", result.countSaturated(), mask.length);
        return result;
    }

    private void classify(PixelGrid image, double[] mask, Region region) {
        int width = image.getWidth();
        for (int y = region.getY(); y < region.getEndY(); y++) {
            for (int x = region.getX(); x < region.getEndX(); x++) {
                int argb = image.getArgb(x, y);
                int sum = PixelGrid.red(argb) + PixelGrid.green(argb) + PixelGrid.blue(argb);
                mask[y * width + x] = sum > threshold ? 1.0 : 0.0;
            }
        }
    }
}
