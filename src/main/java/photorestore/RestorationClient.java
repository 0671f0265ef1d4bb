package photorestore;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RestorationClient {

    private static final Logger logger = LoggerFactory.getLogger(RestorationClient.class);

    private final String host;
    private final int port;
    private final FrameCodec frames;
    private int timeoutMillis = 0;

    public RestorationClient(String host, int port, long maxFrameBytes) {
        this.host = host;
        this.port = port;
        this.frames = new FrameCodec(maxFrameBytes);
    }

    public RestorationClient(String host, int port) {
        this(host, port, RestorationConfig.defaults().getMaxFrameBytes());
    }

    // Read timeout for the response; 0 waits forever
    public RestorationClient withTimeout(int timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    public RestorationResponse send(Path imageFile) throws IOException {
        return send(Files.readAllBytes(imageFile));
    }

    public RestorationResponse send(byte[] imageData) throws IOException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            OutputStream out = new BufferedOutputStream(socket.getOutputStream());
            InputStream in = new BufferedInputStream(socket.getInputStream());

            FrameCodec.writeFrame(out, imageData);
            out.flush();
            logger.info("Image sent to {}:{} ({} bytes)", host, port, imageData.length);

            String metadata = frames.readText(in);
            logger.info("Metadata received: {}", metadata);
            byte[] restored = frames.readFrame(in);
            logger.debug("Restored image size received: {}", restored.length);
            return new RestorationResponse(metadata, restored);
        }
    }
}
