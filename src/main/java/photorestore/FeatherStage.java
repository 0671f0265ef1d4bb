package photorestore;

import java.util.Arrays;
import java.util.Comparator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FeatherStage {

    private static final Logger logger = LoggerFactory.getLogger(FeatherStage.class);

    public static final int DEFAULT_RADIUS = 5;
    public static final double DEFAULT_EPSILON = 0.01;

    private final int radius;
    private final double epsilon;
    // Offsets inside the disc d^2 <= R^2, nearest first: {dx, dy, d^2}
    private final int[][] offsets;

    public FeatherStage() {
        this(DEFAULT_RADIUS, DEFAULT_EPSILON);
    }

    public FeatherStage(int radius, double epsilon) {
        if (radius < 1) {
            throw new IllegalArgumentException("Feather radius must be at least 1, got " + radius);
        }
        if (!(epsilon >= 0.0 && epsilon < 1.0)) {
            throw new IllegalArgumentException("Feather epsilon must be within [0, 1), got " + epsilon);
        }
        this.radius = radius;
        this.epsilon = epsilon;
        this.offsets = discOffsets(radius);
    }

    public WeightGrid apply(WeightGrid mask, WeightGrid edges, StageExecutor executor) {
        if (mask.getWidth() != edges.getWidth() || mask.getHeight() != edges.getHeight()) {
            throw new IllegalArgumentException("Mask " + mask + " and edge map " + edges
                    + " dimensions differ");
        }
        int width = mask.getWidth();
        int height = mask.getHeight();
        double[] feathered = new double[width * height];

        executor.run(executor.tiles(width, height, radius),
                region -> feather(mask, edges, feathered, region));

        WeightGrid result = WeightGrid.wrap(width, height, feathered);
        logger.debug("Feather: radius {}, {} fully weighted pixels", radius, result.countSaturated());
        return result;
    }

    private void feather(WeightGrid mask, WeightGrid edges, double[] feathered, Region region) {
        int width = mask.getWidth();
        int height = mask.getHeight();
        double r2 = (double) radius * radius;

        for (int y = region.getY(); y < region.getEndY(); y++) {
            for (int x = region.getX(); x < region.getEndX(); x++) {
                int i = y * width + x;
                if (mask.get(i) == 1.0) {
                    feathered[i] = 1.0;
                    continue;
                }

                int nearest = nearestDamaged(mask, x, y, width, height);
                if (nearest < 0) {
                    continue;
                }
                double weight = Math.exp(-nearest / r2) * (1.0 - edges.get(i));
                feathered[i] = weight < epsilon ? 0.0 : weight;
            }
        }
    }

    // Squared distance to the nearest damaged pixel inside the disc, or -1 if none
    private int nearestDamaged(WeightGrid mask, int x, int y, int width, int height) {
        for (int[] offset : offsets) {
            int nx = x + offset[0];
            int ny = y + offset[1];
            if (nx >= 0 && nx < width && ny >= 0 && ny < height && mask.get(nx, ny) == 1.0) {
                return offset[2];
            }
        }
        return -1;
    }

    private static int[][] discOffsets(int radius) {
        int r2 = radius * radius;
        int side = 2 * radius + 1;
        int[][] all = new int[side * side][];
        int n = 0;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                int d2 = dx * dx + dy * dy;
                if (d2 > 0 && d2 <= r2) {
                    all[n++] = new int[] { dx, dy, d2 };
                }
            }
        }
        int[][] disc = Arrays.copyOf(all, n);
        Arrays.sort(disc, Comparator.comparingInt(o -> o[2]));
        return disc;
    }
}
