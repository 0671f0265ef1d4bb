package photorestore;

import java.util.concurrent.atomic.DoubleAccumulator;

public final class MaxReducer implements Reducer<Double> {

    private final DoubleAccumulator max = new DoubleAccumulator(Math::max, 0.0);

    @Override
    public void merge(Double partial) {
        max.accumulate(partial);
    }

    @Override
    public Double complete() {
        return max.get();
    }
}
