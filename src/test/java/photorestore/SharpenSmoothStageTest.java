package photorestore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SharpenSmoothStageTest {

    private final StageExecutor executor = new StageExecutor(ProcessorType.EXECUTOR, 4);

    @Test
    void uniformImageIsUnchanged() {
        PixelGrid image = TestImages.uniform(9, 7, TestImages.rgb(90, 140, 210));
        assertEquals(image, new SharpenSmoothStage().apply(image, executor));
        PixelGrid white = TestImages.uniform(4, 4, TestImages.WHITE);
        assertEquals(white, new SharpenSmoothStage().apply(white, executor));
    }

    @Test
    void blurSpreadsASinglePointByTheKernelWeights() {
        int[] pixels = new int[25];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = TestImages.rgb(0, 0, 0);
        }
        pixels[12] = TestImages.rgb(200, 200, 200);
        Kernel kernel = Kernel.gaussian(3, 1.0);

        PixelGrid blurred = new SharpenSmoothStage(kernel, Kernel.sharpen())
                .blur(PixelGrid.of(5, 5, pixels), executor);
        assertEquals((int) Math.round(200 * kernel.get(1, 1)), blurred.getRed(2, 2));
        assertEquals((int) Math.round(200 * kernel.get(0, 1)), blurred.getRed(2, 1));
        assertEquals(0, blurred.getRed(0, 0));
    }

    @Test
    void bordersReplicateEdgePixels() {
        // Left column white, rest black: clamp-to-edge keeps the left column bright
        int[] pixels = new int[16];
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                pixels[y * 4 + x] = x == 0 ? TestImages.WHITE : TestImages.rgb(0, 0, 0);
            }
        }
        Kernel kernel = Kernel.gaussian(3, 1.0);
        PixelGrid blurred = new SharpenSmoothStage(kernel, Kernel.sharpen())
                .blur(PixelGrid.of(4, 4, pixels), executor);
        double leftWeight = kernel.get(0, 0) + kernel.get(1, 0) + kernel.get(2, 0)
                + kernel.get(0, 1) + kernel.get(1, 1) + kernel.get(2, 1);
        assertEquals((int) Math.round(255 * leftWeight), blurred.getRed(0, 0));
    }

    @Test
    void sharpenClampsToChannelRange() {
        int[] pixels = new int[9];
        for (int i = 0; i < 9; i++) {
            pixels[i] = TestImages.rgb(0, 0, 0);
        }
        pixels[4] = TestImages.rgb(100, 100, 100);
        PixelGrid sharpened = new SharpenSmoothStage().sharpen(PixelGrid.of(3, 3, pixels), executor);
        assertEquals(255, sharpened.getRed(1, 1));
        assertEquals(0, sharpened.getRed(0, 1));
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                int red = sharpened.getRed(x, y);
                assertTrue(red >= 0 && red <= 255);
            }
        }
    }
}
