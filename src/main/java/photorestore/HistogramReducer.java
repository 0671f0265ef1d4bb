package photorestore;

public final class HistogramReducer implements Reducer<ChannelHistograms> {

    private final Object lock = new Object();
    private final ChannelHistograms total = new ChannelHistograms();

    @Override
    public void merge(ChannelHistograms partial) {
        synchronized (lock) {
            total.add(partial);
        }
    }

    @Override
    public ChannelHistograms complete() {
        synchronized (lock) {
            return total.copy();
        }
    }
}
