package photorestore;

import java.util.List;

public final class StageExecutor {

    private final ProcessorType processorType;
    private final int numThreads;

    public StageExecutor(ProcessorType processorType, int numThreads) {
        if (processorType == null) {
            throw new IllegalArgumentException("Processor type must be set");
        }
        if (numThreads < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, got " + numThreads);
        }
        this.processorType = processorType;
        this.numThreads = numThreads;
    }

    public static StageExecutor sequential() {
        return new StageExecutor(ProcessorType.SEQUENTIAL, 1);
    }

    public void run(List<Region> regions, RegionWorker worker) {
        switch (processorType) {
            case SEQUENTIAL -> SequentialProcessing.processRegions(regions, worker);
            case FORKJOIN -> ForkJoinProcessing.processRegions(regions, worker, numThreads);
            case EXECUTOR -> ExecutorServiceProcessing.processRegions(regions, worker, numThreads);
            default -> throw new IllegalArgumentException("Unsupported processor type: " + processorType);
        }
    }

    // Owned tiles for neighborhood stages
    public List<Region> tiles(int width, int height, int halo) {
        return ChunkPartitioner.tiles(width, height, numThreads, halo);
    }

    // Owned row bands for histogram-style stages
    public List<Region> rows(int width, int height) {
        return ChunkPartitioner.rows(width, height, numThreads, 0);
    }

    public ProcessorType getProcessorType() {
        return processorType;
    }

    public int getNumThreads() {
        return numThreads;
    }

    @Override
    public String toString() {
        return processorType + "x" + numThreads;
    }
}
