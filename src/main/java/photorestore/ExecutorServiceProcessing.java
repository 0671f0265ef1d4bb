package photorestore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class ExecutorServiceProcessing {

    public static void processRegions(List<Region> regions, RegionWorker worker, int numThreads) {
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        List<Future<?>> futures = new ArrayList<>(regions.size());
        try {
            // One task per owned region
            for (Region region : regions) {
                futures.add(executor.submit(() -> worker.process(region)));
            }

            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestorationException("Interrupted while waiting for region workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RestorationException) {
                throw (RestorationException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RestorationException("Region worker failed: " + cause.getMessage(), cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
