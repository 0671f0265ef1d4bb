package photorestore;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

public class RestorationConfig {

    /**
     * Sharpening kernel applied after the Gaussian blur.
     */
    public enum SharpenKernel {
        /** 3x3 kernel with center 13 and all eight neighbors negative */
        STRONG,
        /** 3x3 kernel with center 5 and the four direct neighbors at -1 */
        CROSS;

        Kernel toKernel() {
            return this == CROSS ? Kernel.crossSharpen() : Kernel.sharpen();
        }
    }

    public static final String DEFAULTS_RESOURCE = "/restoration.properties";

    // ForkJoinPool parallelism limit
    public static final int MAX_WORKERS = 0x7fff;

    private final int workers;
    private final ProcessorType processorType;
    private final int maskThreshold;
    private final double edgeThreshold;
    private final int featherRadius;
    private final double featherEpsilon;
    private final int inpaintRadius;
    private final int gaussianSize;
    private final double gaussianSigma;
    private final SharpenKernel sharpenKernel;
    private final String outputFormat;
    private final int serverPort;
    private final long maxFrameBytes;
    private final int readTimeoutMillis;

    private RestorationConfig(Builder builder) {
        this.workers = builder.workers;
        this.processorType = builder.processorType;
        this.maskThreshold = builder.maskThreshold;
        this.edgeThreshold = builder.edgeThreshold;
        this.featherRadius = builder.featherRadius;
        this.featherEpsilon = builder.featherEpsilon;
        this.inpaintRadius = builder.inpaintRadius;
        this.gaussianSize = builder.gaussianSize;
        this.gaussianSigma = builder.gaussianSigma;
        this.sharpenKernel = builder.sharpenKernel;
        this.outputFormat = builder.outputFormat;
        this.serverPort = builder.serverPort;
        this.maxFrameBytes = builder.maxFrameBytes;
        this.readTimeoutMillis = builder.readTimeoutMillis;
    }

    public static RestorationConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults from the bundled {@value #DEFAULTS_RESOURCE}, overridden by the given file.
     */
    public static RestorationConfig load(Path file) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return builder().fromProperties(bundledDefaults()).fromProperties(properties).build();
    }

    public static Properties bundledDefaults() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = RestorationConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        }
        return properties;
    }

    public StageExecutor newExecutor() {
        return new StageExecutor(processorType, workers);
    }

    public MaskStage newMaskStage() {
        return new MaskStage(maskThreshold);
    }

    public EdgeStage newEdgeStage() {
        return new EdgeStage(edgeThreshold);
    }

    public FeatherStage newFeatherStage() {
        return new FeatherStage(featherRadius, featherEpsilon);
    }

    public InpaintStage newInpaintStage() {
        return new InpaintStage(inpaintRadius);
    }

    public SharpenSmoothStage newSharpenSmoothStage() {
        return new SharpenSmoothStage(Kernel.gaussian(gaussianSize, gaussianSigma), sharpenKernel.toKernel());
    }

    public int getWorkers() {
        return workers;
    }

    public ProcessorType getProcessorType() {
        return processorType;
    }

    public int getMaskThreshold() {
        return maskThreshold;
    }

    public double getEdgeThreshold() {
        return edgeThreshold;
    }

    public int getFeatherRadius() {
        return featherRadius;
    }

    public double getFeatherEpsilon() {
        return featherEpsilon;
    }

    public int getInpaintRadius() {
        return inpaintRadius;
    }

    public int getGaussianSize() {
        return gaussianSize;
    }

    public double getGaussianSigma() {
        return gaussianSigma;
    }

    public SharpenKernel getSharpenKernel() {
        return sharpenKernel;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public int getServerPort() {
        return serverPort;
    }

    public long getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public int getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public Builder toBuilder() {
        return builder()
                .workers(workers)
                .processorType(processorType)
                .maskThreshold(maskThreshold)
                .edgeThreshold(edgeThreshold)
                .featherRadius(featherRadius)
                .featherEpsilon(featherEpsilon)
                .inpaintRadius(inpaintRadius)
                .gaussianSize(gaussianSize)
                .gaussianSigma(gaussianSigma)
                .sharpenKernel(sharpenKernel)
                .outputFormat(outputFormat)
                .serverPort(serverPort)
                .maxFrameBytes(maxFrameBytes)
                .readTimeoutMillis(readTimeoutMillis);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "RestorationConfig{workers=%d, processor=%s, mask=%d, edge=%.2f, feather=%d/%.3f, "
                        + "inpaint=%d, gaussian=%d/%.2f, sharpen=%s, format=%s}",
                workers, processorType, maskThreshold, edgeThreshold, featherRadius, featherEpsilon,
                inpaintRadius, gaussianSize, gaussianSigma, sharpenKernel, outputFormat);
    }

    /**
     * Builder for RestorationConfig.
     */
    public static class Builder {
        private int workers = Runtime.getRuntime().availableProcessors();
        private ProcessorType processorType = ProcessorType.FORKJOIN;
        private int maskThreshold = MaskStage.DEFAULT_THRESHOLD;
        private double edgeThreshold = EdgeStage.DEFAULT_THRESHOLD;
        private int featherRadius = FeatherStage.DEFAULT_RADIUS;
        private double featherEpsilon = FeatherStage.DEFAULT_EPSILON;
        private int inpaintRadius = InpaintStage.DEFAULT_RADIUS;
        private int gaussianSize = SharpenSmoothStage.DEFAULT_KERNEL_SIZE;
        private double gaussianSigma = SharpenSmoothStage.DEFAULT_SIGMA;
        private SharpenKernel sharpenKernel = SharpenKernel.STRONG;
        private String outputFormat = "jpg";
        private int serverPort = 8080;
        private long maxFrameBytes = 256L * 1024 * 1024;
        private int readTimeoutMillis = 30_000;

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder processorType(ProcessorType processorType) {
            this.processorType = processorType;
            return this;
        }

        public Builder maskThreshold(int maskThreshold) {
            this.maskThreshold = maskThreshold;
            return this;
        }

        public Builder edgeThreshold(double edgeThreshold) {
            this.edgeThreshold = edgeThreshold;
            return this;
        }

        public Builder featherRadius(int featherRadius) {
            this.featherRadius = featherRadius;
            return this;
        }

        public Builder featherEpsilon(double featherEpsilon) {
            this.featherEpsilon = featherEpsilon;
            return this;
        }

        public Builder inpaintRadius(int inpaintRadius) {
            this.inpaintRadius = inpaintRadius;
            return this;
        }

        public Builder gaussianSize(int gaussianSize) {
            this.gaussianSize = gaussianSize;
            return this;
        }

        public Builder gaussianSigma(double gaussianSigma) {
            this.gaussianSigma = gaussianSigma;
            return this;
        }

        public Builder sharpenKernel(SharpenKernel sharpenKernel) {
            this.sharpenKernel = sharpenKernel;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder maxFrameBytes(long maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public Builder readTimeoutMillis(int readTimeoutMillis) {
            this.readTimeoutMillis = readTimeoutMillis;
            return this;
        }

        /**
         * Applies every {@code restore.*} key present in the given properties.
         *
         * @throws IllegalStateException if a value cannot be parsed
         */
        public Builder fromProperties(Properties properties) {
            for (String key : properties.stringPropertyNames()) {
                String value = properties.getProperty(key).trim();
                try {
                    apply(key, value);
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException("Invalid value '" + value + "' for " + key, e);
                }
            }
            return this;
        }

        private void apply(String key, String value) {
            switch (key) {
                case "restore.workers" -> workers = value.isEmpty()
                        ? Runtime.getRuntime().availableProcessors() : Integer.parseInt(value);
                case "restore.processor" -> processorType = ProcessorType.parse(value);
                case "restore.mask.threshold" -> maskThreshold = Integer.parseInt(value);
                case "restore.edge.threshold" -> edgeThreshold = Double.parseDouble(value);
                case "restore.feather.radius" -> featherRadius = Integer.parseInt(value);
                case "restore.feather.epsilon" -> featherEpsilon = Double.parseDouble(value);
                case "restore.inpaint.radius" -> inpaintRadius = Integer.parseInt(value);
                case "restore.gaussian.size" -> gaussianSize = Integer.parseInt(value);
                case "restore.gaussian.sigma" -> gaussianSigma = Double.parseDouble(value);
                case "restore.sharpen.kernel" -> sharpenKernel = SharpenKernel.valueOf(value.toUpperCase(Locale.ROOT));
                case "restore.output.format" -> outputFormat = value;
                case "restore.server.port" -> serverPort = Integer.parseInt(value);
                case "restore.server.maxFrameBytes" -> maxFrameBytes = Long.parseLong(value);
                case "restore.server.readTimeoutMillis" -> readTimeoutMillis = Integer.parseInt(value);
                default -> {
                    if (key.startsWith("restore.")) {
                        throw new IllegalArgumentException("Unknown configuration key " + key);
                    }
                }
            }
        }

        public RestorationConfig build() {
            if (workers < 1 || workers > MAX_WORKERS) {
                throw new IllegalStateException("Worker count must be between 1 and " + MAX_WORKERS
                        + ", got " + workers);
            }
            if (processorType == null) {
                throw new IllegalStateException("Processor type must be set");
            }
            if (maskThreshold < 0 || maskThreshold > 765) {
                throw new IllegalStateException("Mask threshold must be between 0 and 765");
            }
            if (!(edgeThreshold >= 0.0 && edgeThreshold <= 1.0)) {
                throw new IllegalStateException("Edge threshold must be between 0.0 and 1.0");
            }
            if (featherRadius < 1) {
                throw new IllegalStateException("Feather radius must be at least 1");
            }
            if (!(featherEpsilon >= 0.0 && featherEpsilon < 1.0)) {
                throw new IllegalStateException("Feather epsilon must be between 0.0 and 1.0");
            }
            if (inpaintRadius < 1) {
                throw new IllegalStateException("Inpaint radius must be at least 1");
            }
            if (gaussianSize < 1 || gaussianSize % 2 == 0) {
                throw new IllegalStateException("Gaussian kernel size must be a positive odd number, got "
                        + gaussianSize);
            }
            if (!(gaussianSigma > 0)) {
                throw new IllegalStateException("Gaussian sigma must be positive");
            }
            if (sharpenKernel == null) {
                throw new IllegalStateException("Sharpen kernel must be set");
            }
            if (!"jpg".equalsIgnoreCase(outputFormat) && !"jpeg".equalsIgnoreCase(outputFormat)
                    && !"png".equalsIgnoreCase(outputFormat)) {
                throw new IllegalStateException("Output format must be jpg or png, got " + outputFormat);
            }
            if (serverPort < 0 || serverPort > 65535) {
                throw new IllegalStateException("Server port must be between 0 and 65535");
            }
            if (maxFrameBytes < 1 || maxFrameBytes > Integer.MAX_VALUE) {
                throw new IllegalStateException("Max frame size must be between 1 and " + Integer.MAX_VALUE);
            }
            if (readTimeoutMillis < 0) {
                throw new IllegalStateException("Read timeout must not be negative");
            }
            return new RestorationConfig(this);
        }
    }
}
