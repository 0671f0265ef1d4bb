package photorestore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ColorStage {

    private static final Logger logger = LoggerFactory.getLogger(ColorStage.class);

    public PixelGrid apply(PixelGrid image, StageExecutor executor) {
        ChannelHistograms histograms = histograms(image, executor);
        int[][] lookup = new int[3][];
        for (int c = 0; c < 3; c++) {
            lookup[c] = equalization(histograms.cdf(c));
        }

        int width = image.getWidth();
        int[] output = new int[image.size()];
        executor.run(executor.rows(width, image.getHeight()),
                region -> remap(image, lookup, output, region));
        return PixelGrid.wrap(width, image.getHeight(), output);
    }

    // Phase 1 on its own: the summed histograms of every channel
    public ChannelHistograms histograms(PixelGrid image, StageExecutor executor) {
        HistogramReducer reducer = new HistogramReducer();
        executor.run(executor.rows(image.getWidth(), image.getHeight()), region -> {
            ChannelHistograms local = new ChannelHistograms();
            for (int y = region.getY(); y < region.getEndY(); y++) {
                for (int x = region.getX(); x < region.getEndX(); x++) {
                    local.record(image.getArgb(x, y));
                }
            }
            reducer.merge(local);
        });
        return reducer.complete();
    }

    // Lookup table old value -> new value for one channel
    static int[] equalization(long[] cdf) {
        long[] range = ChannelHistograms.nonZeroRange(cdf);
        long min = range[0];
        long max = range[1];
        int[] lookup = new int[ChannelHistograms.BUCKETS];

        if (max == min) {
            logger.debug("Color: flat channel, keeping values");
            for (int v = 0; v < lookup.length; v++) {
                lookup[v] = v;
            }
            return lookup;
        }

        for (int v = 0; v < lookup.length; v++) {
            long mapped = (cdf[v] - min) * 255 / (max - min);
            lookup[v] = (int) Math.max(0, Math.min(255, mapped));
        }
        logger.debug("Color: cdf range [{}, {}]", min, max);
        return lookup;
    }

    private static void remap(PixelGrid image, int[][] lookup, int[] output, Region region) {
        int width = image.getWidth();
        for (int y = region.getY(); y < region.getEndY(); y++) {
            for (int x = region.getX(); x < region.getEndX(); x++) {
                int argb = image.getArgb(x, y);
                output[y * width + x] = PixelGrid.pack(PixelGrid.alpha(argb),
                        lookup[ChannelHistograms.RED][PixelGrid.red(argb)],
                        lookup[ChannelHistograms.GREEN][PixelGrid.green(argb)],
                        lookup[ChannelHistograms.BLUE][PixelGrid.blue(argb)]);
            }
        }
    }

    // Mean color of the image as an opaque ARGB value, channels truncated toward zero
    public int averageColor(PixelGrid image, StageExecutor executor) {
        ChannelSumReducer reducer = new ChannelSumReducer();
        executor.run(executor.rows(image.getWidth(), image.getHeight()), region -> {
            long[] sums = new long[4];
            for (int y = region.getY(); y < region.getEndY(); y++) {
                for (int x = region.getX(); x < region.getEndX(); x++) {
                    int argb = image.getArgb(x, y);
                    sums[0] += PixelGrid.red(argb);
                    sums[1] += PixelGrid.green(argb);
                    sums[2] += PixelGrid.blue(argb);
                    sums[3]++;
                }
            }
            reducer.merge(sums);
        });

        long[] total = reducer.complete();
        return PixelGrid.pack(0xFF,
                (int) (total[0] / total[3]),
                (int) (total[1] / total[3]),
                (int) (total[2] / total[3]));
    }
}
