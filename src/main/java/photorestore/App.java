package photorestore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javafx.application.Application;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(
        name = "photo-restore",
        mixinStandardHelpOptions = true,
        description = "Restores scratched and overexposed photographs.",
        subcommands = {
                App.Restore.class,
                App.Serve.class,
                App.Send.class,
                App.Benchmark.class,
                App.Gui.class
        })
public class App implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new App()).execute(args);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Pipeline options shared by the subcommands that run the pipeline locally.
     */
    static class PipelineOptions {

        @Option(names = "--config", description = "properties file overriding the bundled defaults")
        Path configFile;

        @Option(names = {"--workers", "-w"}, description = "worker threads per stage (default: available processors)")
        Integer workers;

        @Option(names = {"--processor", "-p"}, description = "SEQUENTIAL, FORKJOIN or EXECUTOR")
        String processor;

        @Option(names = "--feather-radius", description = "feathering radius in pixels")
        Integer featherRadius;

        RestorationConfig toConfig() throws IOException {
            RestorationConfig.Builder builder = configFile == null
                    ? RestorationConfig.builder().fromProperties(RestorationConfig.bundledDefaults())
                    : RestorationConfig.load(configFile).toBuilder();
            if (workers != null) {
                builder.workers(workers);
            }
            if (processor != null) {
                builder.processorType(ProcessorType.parse(processor));
            }
            if (featherRadius != null) {
                builder.featherRadius(featherRadius);
            }
            return builder.build();
        }
    }

    @Command(name = "restore", mixinStandardHelpOptions = true, description = "Restore an image file.")
    static class Restore implements Callable<Integer> {

        @Option(names = {"--input", "-i"}, required = true, description = "damaged photo, e.g. old_photo.jpeg")
        Path input;

        @Option(names = {"--output", "-o"}, required = true, description = "restored photo, e.g. restored_photo.jpg")
        Path output;

        @Option(names = "--mask", description = "also save the damage mask (white = damaged)")
        Path maskOutput;

        @Option(names = "--feathered", description = "also save the feathered mask")
        Path featheredOutput;

        @Mixin
        PipelineOptions options;

        @Override
        public Integer call() throws IOException {
            RestorationConfig config = options.toConfig();
            PixelGrid image = ImageCodec.read(input);

            RestorationResult result = new RestorationPipeline(config).restore(image);

            ImageCodec.write(result.getRestored(), output);
            if (maskOutput != null) {
                ImageCodec.writeWeights(result.getMask(), maskOutput);
            }
            if (featheredOutput != null) {
                ImageCodec.writeWeights(result.getFeatheredMask(), featheredOutput);
            }
            System.out.printf(Locale.ROOT, "Restored image saved to: %s%n", output);
            System.out.printf(Locale.ROOT, "Processing time: %d ms (%s)%n",
                    result.getTotalTime().toMillis(), result.metadata());
            return 0;
        }
    }

    @Command(name = "serve", mixinStandardHelpOptions = true, description = "Serve restoration requests over TCP.")
    static class Serve implements Callable<Integer> {

        @Option(names = "--port", description = "listening port (default from configuration)")
        Integer port;

        @Mixin
        PipelineOptions options;

        @Override
        public Integer call() throws IOException, InterruptedException {
            RestorationConfig config = options.toConfig();
            if (port != null) {
                config = config.toBuilder().serverPort(port).build();
            }
            RestorationServer server = new RestorationServer(config);
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                try {
                    server.close();
                } catch (IOException e) {
                    logger.warn("Error stopping server: {}", e.getMessage());
                }
            }));
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "send", mixinStandardHelpOptions = true, description = "Send an image to a running server.")
    static class Send implements Callable<Integer> {

        @Option(names = {"--file", "-f"}, required = true, description = "image to restore")
        Path file;

        @Option(names = "--host", defaultValue = "localhost", description = "server host (default: ${DEFAULT-VALUE})")
        String host;

        @Option(names = "--port", defaultValue = "8080", description = "server port (default: ${DEFAULT-VALUE})")
        int port;

        @Option(names = {"--output", "-o"}, defaultValue = "restored_by_server.jpg",
                description = "where to save the restored image (default: ${DEFAULT-VALUE})")
        Path output;

        @Option(names = "--timeout", defaultValue = "0",
                description = "milliseconds to wait for the server, 0 waits forever (default: ${DEFAULT-VALUE})")
        int timeoutMillis;

        @Override
        public Integer call() throws IOException {
            RestorationResponse response = new RestorationClient(host, port).withTimeout(timeoutMillis).send(file);
            Files.write(output, response.getImage());
            System.out.println("Metadata received: " + response.getMetadata());
            System.out.println("Restored image saved to: " + output);
            return 0;
        }
    }

    /**
     * Speedup exploration: sequential baseline against both parallel strategies for every
     * thread count up to the maximum.
     */
    @Command(name = "benchmark", mixinStandardHelpOptions = true, description = "Measure parallel speedup.")
    static class Benchmark implements Callable<Integer> {

        @Option(names = {"--input", "-i"}, required = true, description = "photo to restore repeatedly")
        Path input;

        @Option(names = "--max-threads", description = "largest thread count (default: available processors)")
        Integer maxThreads;

        @Mixin
        PipelineOptions options;

        @Override
        public Integer call() throws IOException {
            RestorationPipeline pipeline = new RestorationPipeline(options.toConfig());
            PixelGrid image = ImageCodec.read(input);
            int max = maxThreads != null ? maxThreads : Runtime.getRuntime().availableProcessors();

            System.out.println("threads,speedup_fk,speedup_ex");
            for (int numThreads = 1; numThreads <= max; numThreads++) {
                double timeSeqMs = timeMs(pipeline, image, StageExecutor.sequential());
                double timeParFkMs = timeMs(pipeline, image, new StageExecutor(ProcessorType.FORKJOIN, numThreads));
                double timeParExMs = timeMs(pipeline, image, new StageExecutor(ProcessorType.EXECUTOR, numThreads));

                double speedupFk = timeSeqMs / timeParFkMs;
                double speedupEx = timeSeqMs / timeParExMs;
                System.out.printf(Locale.ROOT, "%d,%.4f,%.4f%n", numThreads, speedupFk, speedupEx);
            }
            return 0;
        }

        private static double timeMs(RestorationPipeline pipeline, PixelGrid image, StageExecutor executor) {
            long start = System.nanoTime();
            pipeline.restore(image, executor);
            return (System.nanoTime() - start) / 1_000_000.0;
        }
    }

    @Command(name = "gui", mixinStandardHelpOptions = true, description = "Open the desktop preview window.")
    static class Gui implements Callable<Integer> {

        @Override
        public Integer call() {
            Application.launch(MainGUI.class);
            return 0;
        }
    }
}
