package photorestore;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RestorationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RestorationPipeline.class);

    private final RestorationConfig config;
    private final MaskStage maskStage;
    private final EdgeStage edgeStage;
    private final FeatherStage featherStage;
    private final InpaintStage inpaintStage;
    private final ColorStage colorStage;
    private final SharpenSmoothStage sharpenSmoothStage;

    public RestorationPipeline(RestorationConfig config) {
        this.config = config;
        this.maskStage = config.newMaskStage();
        this.edgeStage = config.newEdgeStage();
        this.featherStage = config.newFeatherStage();
        this.inpaintStage = config.newInpaintStage();
        this.colorStage = new ColorStage();
        this.sharpenSmoothStage = config.newSharpenSmoothStage();
    }

    public RestorationResult restore(PixelGrid image) {
        return restore(image, config.newExecutor());
    }

    // Restores the image using the given executor instead of the configured one
    public RestorationResult restore(PixelGrid image, StageExecutor executor) {
        if (image == null) {
            throw new IllegalArgumentException("Image must not be null");
        }
        logger.info("Restoring {} with {}", image, executor);
        Map<StageType, Duration> times = new EnumMap<>(StageType.class);
        long start = System.nanoTime();

        WeightGrid mask = timed(StageType.MASK, times, () -> maskStage.apply(image, executor));
        WeightGrid edges = timed(StageType.EDGE_DETECTION, times, () -> edgeStage.apply(image, executor));
        WeightGrid feathered = timed(StageType.FEATHER, times,
                () -> featherStage.apply(mask, edges, executor));
        PixelGrid inpainted = timed(StageType.INPAINT, times,
                () -> inpaintStage.apply(image, feathered, edges, executor));
        PixelGrid corrected = timed(StageType.COLOR_CORRECTION, times,
                () -> colorStage.apply(inpainted, executor));
        PixelGrid restored = timed(StageType.SHARPEN_SMOOTH, times,
                () -> sharpenSmoothStage.apply(corrected, executor));

        Duration total = Duration.ofNanos(System.nanoTime() - start);
        int averageColor = colorStage.averageColor(restored, executor);
        logger.info("Restored {} in {} ms ({} damaged pixels, average color #{})",
                image, total.toMillis(), mask.countSaturated(),
                String.format("%06X", averageColor & 0xFFFFFF));

        return new RestorationResult(restored, mask, edges, feathered, inpainted, corrected,
                times, total, averageColor, executor.getNumThreads(), executor.getProcessorType());
    }

    private static <T> T timed(StageType stage, Map<StageType, Duration> times, Supplier<T> body) {
        long start = System.nanoTime();
        T result = body.get();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        times.put(stage, elapsed);
        logger.debug("{} finished in {} ms", stage, elapsed.toMillis());
        return result;
    }

    public RestorationConfig getConfig() {
        return config;
    }
}
