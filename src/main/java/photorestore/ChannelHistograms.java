package photorestore;

public final class ChannelHistograms {

    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;
    public static final int BUCKETS = 256;

    private final long[][] counts = new long[3][BUCKETS];

    void record(int argb) {
        counts[RED][PixelGrid.red(argb)]++;
        counts[GREEN][PixelGrid.green(argb)]++;
        counts[BLUE][PixelGrid.blue(argb)]++;
    }

    void add(ChannelHistograms other) {
        for (int c = 0; c < 3; c++) {
            for (int i = 0; i < BUCKETS; i++) {
                counts[c][i] += other.counts[c][i];
            }
        }
    }

    ChannelHistograms copy() {
        ChannelHistograms copy = new ChannelHistograms();
        copy.add(this);
        return copy;
    }

    long count(int channel, int bucket) {
        return counts[channel][bucket];
    }

    long total(int channel) {
        long sum = 0;
        for (long count : counts[channel]) {
            sum += count;
        }
        return sum;
    }

    // Running sum of the channel's histogram; cdf[255] is the pixel count
    public long[] cdf(int channel) {
        long[] hist = counts[channel];
        long[] cdf = new long[BUCKETS];
        cdf[0] = hist[0];
        for (int i = 1; i < BUCKETS; i++) {
            cdf[i] = cdf[i - 1] + hist[i];
        }
        return cdf;
    }

    // Smallest and largest non-zero CDF value, or {-1, -1} for an empty histogram
    public static long[] nonZeroRange(long[] cdf) {
        long min = -1;
        long max = -1;
        for (long value : cdf) {
            if (value > 0 && min == -1) {
                min = value;
            }
            if (value > 0) {
                max = value;
            }
        }
        return new long[] { min, max };
    }
}
