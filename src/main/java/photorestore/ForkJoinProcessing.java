package photorestore;

import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;

public class ForkJoinProcessing {

    public static void processRegions(List<Region> regions, RegionWorker worker, int numThreads) {
        if (regions.isEmpty()) {
            return;
        }
        ForkJoinPool pool = new ForkJoinPool(numThreads);
        try {
            pool.invoke(new RegionTask(regions, worker, 0, regions.size()));
        } catch (RestorationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RestorationException("Fork-join worker failed: " + e.getMessage(), e);
        } finally {
            pool.shutdown();
        }
    }

    private static class RegionTask extends RecursiveAction {

        private final List<Region> regions;
        private final RegionWorker worker;
        private final int from, to;

        RegionTask(List<Region> regions, RegionWorker worker, int from, int to) {
            this.regions = regions;
            this.worker = worker;
            this.from = from;
            this.to = to;
        }

        @Override
        protected void compute() {
            if (to - from == 1) {
                // Single region left: process it directly
                worker.process(regions.get(from));
            } else {
                int mid = (from + to) >>> 1;

                invokeAll(
                    new RegionTask(regions, worker, from, mid),
                    new RegionTask(regions, worker, mid, to)
                );
            }
        }
    }
}
