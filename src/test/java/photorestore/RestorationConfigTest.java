package photorestore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RestorationConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsMatchDocumentedValues() {
        RestorationConfig config = RestorationConfig.defaults();
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getWorkers());
        assertEquals(ProcessorType.FORKJOIN, config.getProcessorType());
        assertEquals(427, config.getMaskThreshold());
        assertEquals(0.2, config.getEdgeThreshold());
        assertEquals(5, config.getFeatherRadius());
        assertEquals(3, config.getGaussianSize());
        assertEquals(0.5, config.getGaussianSigma());
        assertEquals(RestorationConfig.SharpenKernel.STRONG, config.getSharpenKernel());
        assertEquals(8080, config.getServerPort());
    }

    @Test
    void bundledPropertiesAgreeWithBuilderDefaults() throws IOException {
        RestorationConfig bundled = RestorationConfig.builder()
                .fromProperties(RestorationConfig.bundledDefaults())
                .build();
        assertEquals(RestorationConfig.defaults().toString(), bundled.toString());
    }

    @Test
    void fileOverridesBundledDefaults() throws IOException {
        Path file = tempDir.resolve("restore.properties");
        Files.writeString(file, "restore.workers=3\nrestore.processor=executor\n"
                + "restore.feather.radius=40\nrestore.sharpen.kernel=cross\n", StandardCharsets.UTF_8);

        RestorationConfig config = RestorationConfig.load(file);
        assertEquals(3, config.getWorkers());
        assertEquals(ProcessorType.EXECUTOR, config.getProcessorType());
        assertEquals(40, config.getFeatherRadius());
        assertEquals(RestorationConfig.SharpenKernel.CROSS, config.getSharpenKernel());
        assertEquals(427, config.getMaskThreshold());
    }

    @Test
    void evenGaussianSizeIsAConfigurationError() {
        assertThrows(IllegalStateException.class, () -> RestorationConfig.builder().gaussianSize(4).build());
    }

    @Test
    void zeroWorkersIsAConfigurationError() {
        assertThrows(IllegalStateException.class, () -> RestorationConfig.builder().workers(0).build());
    }

    @Test
    void workerCountAboveForkJoinLimitIsAConfigurationError() {
        assertThrows(IllegalStateException.class, () -> RestorationConfig.builder().workers(40_000).build());
        assertEquals(RestorationConfig.MAX_WORKERS,
                RestorationConfig.builder().workers(RestorationConfig.MAX_WORKERS).build().getWorkers());
    }

    @Test
    void readTimeoutComesFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("restore.server.readTimeoutMillis", "1500");
        assertEquals(1500, RestorationConfig.builder().fromProperties(properties).build().getReadTimeoutMillis());
        assertEquals(30_000, RestorationConfig.defaults().getReadTimeoutMillis());
        assertThrows(IllegalStateException.class, () -> RestorationConfig.builder().readTimeoutMillis(-1).build());
    }

    @Test
    void malformedOrUnknownPropertiesAreRejected() {
        Properties bad = new Properties();
        bad.setProperty("restore.feather.radius", "wide");
        assertThrows(IllegalStateException.class, () -> RestorationConfig.builder().fromProperties(bad));

        Properties unknown = new Properties();
        unknown.setProperty("restore.colour", "1");
        assertThrows(IllegalStateException.class, () -> RestorationConfig.builder().fromProperties(unknown));
    }

    @Test
    void toBuilderRoundTripsEveryValue() {
        RestorationConfig config = RestorationConfig.builder()
                .workers(6).featherRadius(12).gaussianSize(5).gaussianSigma(1.5).outputFormat("png").build();
        assertEquals(config.toString(), config.toBuilder().build().toString());
    }
}
