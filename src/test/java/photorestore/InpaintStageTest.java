package photorestore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class InpaintStageTest {

    private final StageExecutor executor = new StageExecutor(ProcessorType.EXECUTOR, 4);

    @Test
    void damagedPixelTakesUniformNeighborColor() {
        int color = TestImages.rgb(100, 120, 140);
        int[] pixels = TestImages.uniform(11, 11, color).toArgbArray();
        pixels[5 * 11 + 5] = TestImages.WHITE;
        PixelGrid image = PixelGrid.of(11, 11, pixels);

        WeightGrid mask = new MaskStage().apply(image, executor);
        assertEquals(1, mask.countSaturated());
        WeightGrid edges = WeightGrid.zeros(11, 11);
        WeightGrid feathered = new FeatherStage(3, 0.01).apply(mask, edges, executor);

        PixelGrid restored = new InpaintStage().apply(image, feathered, edges, executor);
        assertEquals(color, restored.getArgb(5, 5));
        assertEquals(TestImages.uniform(11, 11, color), restored);
    }

    @Test
    void passesThroughWhereFeatheredWeightIsZero() {
        PixelGrid image = TestImages.scratched(30, 20, 5L);
        WeightGrid mask = new MaskStage().apply(image, executor);
        WeightGrid edges = new EdgeStage().apply(image, executor);
        WeightGrid feathered = new FeatherStage(2, 0.01).apply(mask, edges, executor);

        PixelGrid restored = new InpaintStage().apply(image, feathered, edges, executor);
        int changed = 0;
        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 30; x++) {
                if (feathered.get(x, y) == 0.0) {
                    assertEquals(image.getArgb(x, y), restored.getArgb(x, y), "pixel " + x + "," + y);
                } else if (restored.getArgb(x, y) != image.getArgb(x, y)) {
                    changed++;
                }
            }
        }
        assertNotEquals(0, changed);
    }

    @Test
    void allNeighborsDamagedKeepsOriginalColor() {
        PixelGrid white = TestImages.uniform(4, 4, TestImages.WHITE);
        WeightGrid mask = new MaskStage().apply(white, executor);
        WeightGrid edges = new EdgeStage().apply(white, executor);
        WeightGrid feathered = new FeatherStage().apply(mask, edges, executor);

        assertEquals(16, feathered.countSaturated());
        assertEquals(white, new InpaintStage().apply(white, feathered, edges, executor));
    }

    @Test
    void strongEdgeNeighborsAreIgnored() {
        // Damaged center, left neighbor on a full-strength edge, right neighbor clean
        int[] pixels = { TestImages.rgb(10, 10, 10), TestImages.WHITE, TestImages.rgb(90, 60, 30) };
        PixelGrid image = PixelGrid.of(3, 1, pixels);
        WeightGrid feathered = WeightGrid.of(3, 1, new double[] { 0.0, 1.0, 0.0 });
        WeightGrid edges = WeightGrid.of(3, 1, new double[] { 1.0, 0.0, 0.0 });

        PixelGrid restored = new InpaintStage(1).apply(image, feathered, edges, executor);
        assertEquals(TestImages.rgb(90, 60, 30), restored.getArgb(1, 0));
        assertEquals(pixels[0], restored.getArgb(0, 0));
    }

    @Test
    void alphaIsCarriedFromTheInput() {
        int[] pixels = { 0x80102030, 0x40FFFFFF, 0x80102030 };
        PixelGrid image = PixelGrid.of(3, 1, pixels);
        WeightGrid feathered = WeightGrid.of(3, 1, new double[] { 0.0, 1.0, 0.0 });
        PixelGrid restored = new InpaintStage(1).apply(image, feathered, WeightGrid.zeros(3, 1), executor);
        assertEquals(0x40102030, restored.getArgb(1, 0));
    }

    @Test
    void rejectsMismatchedInputs() {
        PixelGrid image = TestImages.uniform(4, 4, TestImages.WHITE);
        assertThrows(IllegalArgumentException.class, () -> new InpaintStage()
                .apply(image, WeightGrid.zeros(4, 3), WeightGrid.zeros(4, 4), executor));
    }
}
