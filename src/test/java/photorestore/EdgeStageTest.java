package photorestore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EdgeStageTest {

    private final StageExecutor executor = new StageExecutor(ProcessorType.EXECUTOR, 3);

    @Test
    void flatImageHasNoEdges() {
        WeightGrid edges = new EdgeStage().apply(TestImages.uniform(5, 5, TestImages.rgb(128, 128, 128)), executor);
        for (double v : edges.toArray()) {
            assertEquals(0.0, v);
        }
    }

    @Test
    void valuesAreNormalizedAndThresholded() {
        WeightGrid edges = new EdgeStage().apply(TestImages.scratched(40, 30, 7L), executor);
        double max = 0;
        for (double v : edges.toArray()) {
            assertTrue(v >= 0.0 && v <= 1.0, "out of range: " + v);
            assertTrue(v == 0.0 || v >= 0.2, "below threshold but not zeroed: " + v);
            max = Math.max(max, v);
        }
        assertEquals(1.0, max, 1e-12);
    }

    @Test
    void borderIsAlwaysZero() {
        WeightGrid edges = new EdgeStage().apply(TestImages.random(17, 11, 3L), executor);
        for (int x = 0; x < 17; x++) {
            assertEquals(0.0, edges.get(x, 0));
            assertEquals(0.0, edges.get(x, 10));
        }
        for (int y = 0; y < 11; y++) {
            assertEquals(0.0, edges.get(0, y));
            assertEquals(0.0, edges.get(16, y));
        }
    }

    @Test
    void verticalStepProducesEdgeAlongTheStep() {
        int width = 8;
        int height = 6;
        int[] pixels = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[y * width + x] = x < 4 ? TestImages.rgb(0, 0, 0) : TestImages.rgb(200, 200, 200);
            }
        }
        WeightGrid edges = new EdgeStage().apply(PixelGrid.of(width, height, pixels), executor);
        assertEquals(1.0, edges.get(3, 2), 1e-12);
        assertEquals(1.0, edges.get(4, 2), 1e-12);
        assertEquals(0.0, edges.get(1, 2));
        assertEquals(0.0, edges.get(6, 2));
    }

    @Test
    void grayIsChannelMean() {
        assertEquals(100.0, EdgeStage.gray(TestImages.rgb(50, 100, 150)), 1e-12);
    }
}
