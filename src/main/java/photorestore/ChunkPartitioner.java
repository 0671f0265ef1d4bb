package photorestore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ChunkPartitioner {

    private ChunkPartitioner() {
    }

    // Near-square tiles of side ceil(sqrt(H*W / workers)), for 2D neighborhood stages
    public static List<Region> tiles(int width, int height, int workers, int halo) {
        check(width, height, workers, halo);
        int blockSize = blockSize(width, height, workers);

        List<Region> regions = new ArrayList<>();
        for (int y = 0; y < height; y += blockSize) {
            for (int x = 0; x < width; x += blockSize) {
                int blockWidth = Math.min(blockSize, width - x);
                int blockHeight = Math.min(blockSize, height - y);
                regions.add(new Region(x, y, blockWidth, blockHeight, halo, width, height));
            }
        }
        return Collections.unmodifiableList(regions);
    }

    // Full-width bands of ceil(H / workers) rows, for histogram-style stages
    public static List<Region> rows(int width, int height, int workers, int halo) {
        check(width, height, workers, halo);
        int bandHeight = (int) Math.ceil((double) height / workers);

        List<Region> regions = new ArrayList<>();
        for (int y = 0; y < height; y += bandHeight) {
            regions.add(new Region(0, y, width, Math.min(bandHeight, height - y), halo, width, height));
        }
        return Collections.unmodifiableList(regions);
    }

    static int blockSize(int width, int height, int workers) {
        double blockArea = Math.max(1.0, (double) width * height / workers);
        return Math.max(1, (int) Math.ceil(Math.sqrt(blockArea)));
    }

    private static void check(int width, int height, int workers, int halo) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Cannot partition an empty grid: " + width + "x" + height);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1, got " + workers);
        }
        if (halo < 0) {
            throw new IllegalArgumentException("Halo must not be negative, got " + halo);
        }
    }
}
