package photorestore;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

public final class RestorationResult {

    private final PixelGrid restored;
    private final WeightGrid mask;
    private final WeightGrid edges;
    private final WeightGrid featheredMask;
    private final PixelGrid inpainted;
    private final PixelGrid colorCorrected;
    private final Map<StageType, Duration> stageTimes;
    private final Duration totalTime;
    private final int averageColor;
    private final int workers;
    private final ProcessorType processorType;

    RestorationResult(PixelGrid restored, WeightGrid mask, WeightGrid edges, WeightGrid featheredMask,
                      PixelGrid inpainted, PixelGrid colorCorrected, Map<StageType, Duration> stageTimes,
                      Duration totalTime, int averageColor, int workers, ProcessorType processorType) {
        this.restored = restored;
        this.mask = mask;
        this.edges = edges;
        this.featheredMask = featheredMask;
        this.inpainted = inpainted;
        this.colorCorrected = colorCorrected;
        this.stageTimes = Collections.unmodifiableMap(new EnumMap<>(stageTimes));
        this.totalTime = totalTime;
        this.averageColor = averageColor;
        this.workers = workers;
        this.processorType = processorType;
    }

    public PixelGrid getRestored() {
        return restored;
    }

    public WeightGrid getMask() {
        return mask;
    }

    public WeightGrid getEdges() {
        return edges;
    }

    public WeightGrid getFeatheredMask() {
        return featheredMask;
    }

    public PixelGrid getInpainted() {
        return inpainted;
    }

    public PixelGrid getColorCorrected() {
        return colorCorrected;
    }

    public Map<StageType, Duration> getStageTimes() {
        return stageTimes;
    }

    public Duration getTotalTime() {
        return totalTime;
    }

    // Mean color of the restored image, opaque ARGB
    public int getAverageColor() {
        return averageColor;
    }

    public int getWorkers() {
        return workers;
    }

    public ProcessorType getProcessorType() {
        return processorType;
    }

    // Metadata string sent back to network clients
    public String metadata() {
        return String.format(Locale.ROOT, "Workers: %d, Processing Time: %.3fms",
                workers, totalTime.toNanos() / 1e6);
    }
}
