package photorestore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

class MaskStageTest {

    private final StageExecutor executor = new StageExecutor(ProcessorType.FORKJOIN, 4);

    @Test
    void midGrayIsNotDamaged() {
        WeightGrid mask = new MaskStage().apply(TestImages.uniform(5, 5, TestImages.rgb(128, 128, 128)), executor);
        assertEquals(0, mask.countSaturated());
        for (double v : mask.toArray()) {
            assertEquals(0.0, v);
        }
    }

    @Test
    void whiteImageIsFullyDamaged() {
        WeightGrid mask = new MaskStage().apply(TestImages.uniform(4, 4, TestImages.WHITE), executor);
        assertEquals(16, mask.countSaturated());
    }

    @Test
    void thresholdIsStrict() {
        // 142 + 142 + 143 = 427 stays normal, 428 is damaged
        int[] pixels = { TestImages.rgb(142, 142, 143), TestImages.rgb(142, 143, 143) };
        WeightGrid mask = new MaskStage().apply(PixelGrid.of(2, 1, pixels), executor);
        assertEquals(0.0, mask.get(0, 0));
        assertEquals(1.0, mask.get(1, 0));
    }

    @Test
    void visualizationIsWhiteOnBlack() {
        int[] pixels = { TestImages.WHITE, TestImages.rgb(10, 10, 10) };
        BufferedImage image = new MaskStage().apply(PixelGrid.of(2, 1, pixels), executor).toGrayImage();
        assertEquals(0xFFFFFF, image.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(0x000000, image.getRGB(1, 0) & 0xFFFFFF);
    }

    @Test
    void rejectsOutOfRangeThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new MaskStage(800));
    }
}
