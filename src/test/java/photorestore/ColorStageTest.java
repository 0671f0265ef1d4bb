package photorestore;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ColorStageTest {

    private final StageExecutor executor = new StageExecutor(ProcessorType.FORKJOIN, 3);
    private final ColorStage stage = new ColorStage();

    @Test
    void histogramBucketsSumToPixelCount() {
        PixelGrid image = TestImages.random(31, 17, 9L);
        ChannelHistograms histograms = stage.histograms(image, executor);
        for (int c = 0; c < 3; c++) {
            assertEquals(31 * 17, histograms.total(c));
        }
    }

    @Test
    void cdfIsNondecreasingAndEndsAtPixelCount() {
        PixelGrid image = TestImages.scratched(23, 19, 2L);
        ChannelHistograms histograms = stage.histograms(image, executor);
        for (int c = 0; c < 3; c++) {
            long[] cdf = histograms.cdf(c);
            for (int i = 1; i < cdf.length; i++) {
                assertTrue(cdf[i] >= cdf[i - 1]);
            }
            assertEquals(23 * 19, cdf[255]);
        }
    }

    @Test
    void flatImageIsLeftUnchanged() {
        PixelGrid gray = TestImages.uniform(5, 5, TestImages.rgb(128, 128, 128));
        assertEquals(gray, stage.apply(gray, executor));
    }

    @Test
    void twoLevelImageIsStretchedToFullRange() {
        int[] pixels = new int[8];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = i < 4 ? TestImages.rgb(100, 100, 100) : TestImages.rgb(120, 120, 120);
        }
        PixelGrid equalized = stage.apply(PixelGrid.of(4, 2, pixels), executor);
        assertEquals(TestImages.rgb(0, 0, 0), equalized.getArgb(0, 0));
        assertEquals(TestImages.rgb(255, 255, 255), equalized.getArgb(3, 1));
    }

    @Test
    void equalizationUsesNonZeroCdfRange() {
        long[] cdf = new long[256];
        for (int i = 10; i < 256; i++) {
            cdf[i] = i < 20 ? 5 : 10;
        }
        int[] lookup = ColorStage.equalization(cdf);
        assertEquals(0, lookup[10]);
        assertEquals(255, lookup[20]);
        assertEquals(255, lookup[255]);
        assertArrayEquals(new long[] { 5, 10 }, ChannelHistograms.nonZeroRange(cdf));
    }

    @Test
    void flatChannelKeepsItsValuesWhileOthersAreEqualized() {
        int[] pixels = { TestImages.rgb(50, 10, 200), TestImages.rgb(50, 90, 200) };
        PixelGrid equalized = stage.apply(PixelGrid.of(2, 1, pixels), executor);
        assertEquals(TestImages.rgb(50, 0, 200), equalized.getArgb(0, 0));
        assertEquals(TestImages.rgb(50, 255, 200), equalized.getArgb(1, 0));
    }

    @Test
    void averageColorTruncatesChannelMeans() {
        int[] pixels = { TestImages.rgb(10, 0, 255), TestImages.rgb(21, 1, 255) };
        assertEquals(TestImages.rgb(15, 0, 255), stage.averageColor(PixelGrid.of(2, 1, pixels), executor));
    }
}
