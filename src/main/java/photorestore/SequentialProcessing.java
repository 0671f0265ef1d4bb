package photorestore;

import java.util.List;

public class SequentialProcessing {

    public static void processRegions(List<Region> regions, RegionWorker worker) {
        for (Region region : regions) {
            worker.process(region);
        }
    }
}
