package photorestore;

public final class ChannelSumReducer implements Reducer<long[]> {

    private final long[] total = new long[4];

    @Override
    public synchronized void merge(long[] partial) {
        if (partial.length != total.length) {
            throw new IllegalArgumentException("Expected " + total.length + " sums, got " + partial.length);
        }
        for (int i = 0; i < total.length; i++) {
            total[i] += partial[i];
        }
    }

    @Override
    public synchronized long[] complete() {
        return total.clone();
    }
}
