package photorestore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SharpenSmoothStage {

    private static final Logger logger = LoggerFactory.getLogger(SharpenSmoothStage.class);

    public static final int DEFAULT_KERNEL_SIZE = 3;
    public static final double DEFAULT_SIGMA = 0.5;

    private final Kernel blur;
    private final Kernel sharpen;

    public SharpenSmoothStage() {
        this(Kernel.gaussian(DEFAULT_KERNEL_SIZE, DEFAULT_SIGMA), Kernel.sharpen());
    }

    public SharpenSmoothStage(Kernel blur, Kernel sharpen) {
        this.blur = blur;
        this.sharpen = sharpen;
    }

    public PixelGrid apply(PixelGrid image, StageExecutor executor) {
        PixelGrid blurred = convolve(image, blur, executor);
        logger.debug("Smooth: {}x{} gaussian applied", blur.getSize(), blur.getSize());
        return convolve(blurred, sharpen, executor);
    }

    PixelGrid blur(PixelGrid image, StageExecutor executor) {
        return convolve(image, blur, executor);
    }

    public PixelGrid sharpen(PixelGrid image, StageExecutor executor) {
        return convolve(image, sharpen, executor);
    }

    public static PixelGrid convolve(PixelGrid image, Kernel kernel, StageExecutor executor) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] output = new int[width * height];

        executor.run(executor.tiles(width, height, kernel.getRadius()),
                region -> convolveRegion(image, kernel, output, region));
        return PixelGrid.wrap(width, height, output);
    }

    private static void convolveRegion(PixelGrid img, Kernel kernel, int[] output, Region region) {
        int width = img.getWidth();
        int height = img.getHeight();
        int offset = kernel.getRadius();

        for (int y = region.getY(); y < region.getEndY(); y++) {
            for (int x = region.getX(); x < region.getEndX(); x++) {
                double r = 0, g = 0, b = 0;

                for (int ky = -offset; ky <= offset; ky++) {
                    for (int kx = -offset; kx <= offset; kx++) {
                        int px = PixelGrid.clamp(x + kx, 0, width - 1);
                        int py = PixelGrid.clamp(y + ky, 0, height - 1);
                        int argb = img.getArgb(px, py);
                        double weight = kernel.get(ky + offset, kx + offset);

                        r += PixelGrid.red(argb) * weight;
                        g += PixelGrid.green(argb) * weight;
                        b += PixelGrid.blue(argb) * weight;
                    }
                }

                output[y * width + x] = PixelGrid.pack(img.getAlpha(x, y),
                        PixelGrid.clampChannel(r), PixelGrid.clampChannel(g), PixelGrid.clampChannel(b));
            }
        }
    }
}
