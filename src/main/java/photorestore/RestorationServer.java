package photorestore;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RestorationServer implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(RestorationServer.class);

    private final RestorationPipeline pipeline;
    private final FrameCodec frames;
    private final String outputFormat;
    private final int requestedPort;
    private final int readTimeoutMillis;
    private final ExecutorService connections = Executors.newCachedThreadPool();

    private volatile ServerSocket serverSocket;
    private Thread acceptThread;

    public RestorationServer(RestorationConfig config) {
        this(new RestorationPipeline(config), config.getServerPort());
    }

    public RestorationServer(RestorationPipeline pipeline, int port) {
        this.pipeline = pipeline;
        this.frames = new FrameCodec(pipeline.getConfig().getMaxFrameBytes());
        this.outputFormat = pipeline.getConfig().getOutputFormat();
        this.requestedPort = port;
        this.readTimeoutMillis = pipeline.getConfig().getReadTimeoutMillis();
    }

    // Binds the port and starts accepting in a background thread
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server already started");
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(requestedPort));
        serverSocket = socket;

        acceptThread = new Thread(this::acceptLoop, "restoration-accept");
        acceptThread.start();
        logger.info("Server is running on port {}", getPort());
    }

    // Bound port; useful when started on port 0
    public int getPort() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("Server not started");
        }
        return socket.getLocalPort();
    }

    private void acceptLoop() {
        ServerSocket socket = serverSocket;
        while (!socket.isClosed()) {
            try {
                Socket client = socket.accept();
                connections.execute(() -> handle(client));
            } catch (SocketException e) {
                if (!socket.isClosed()) {
                    logger.warn("Error accepting connection: {}", e.getMessage());
                }
            } catch (IOException e) {
                logger.warn("Error accepting connection: {}", e.getMessage());
            }
        }
    }

    void handle(Socket client) {
        try (Socket socket = client) {
            logger.info("Client connected from {}", socket.getRemoteSocketAddress());
            socket.setSoTimeout(readTimeoutMillis);
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = new BufferedOutputStream(socket.getOutputStream());

            byte[] request = frames.readFrame(in);
            logger.debug("Image size received: {}", request.length);

            RestorationResult result = pipeline.restore(ImageCodec.decode(request));
            byte[] restored = ImageCodec.encode(result.getRestored(), outputFormat);

            FrameCodec.writeText(out, result.metadata());
            FrameCodec.writeFrame(out, restored);
            out.flush();
            logger.info("Restored image sent to client ({} bytes, {})", restored.length, result.metadata());
        } catch (IOException | RestorationException | IllegalArgumentException e) {
            logger.warn("Failed to serve client: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() throws IOException {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            connections.shutdownNow();
            return;
        }
        socket.close();
        connections.shutdown();
        try {
            if (!connections.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Connections still running after shutdown timeout");
                connections.shutdownNow();
            }
            acceptThread.join(TimeUnit.SECONDS.toMillis(10));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connections.shutdownNow();
        }
        logger.info("Server on port {} stopped", socket.getLocalPort());
    }
}
