package photorestore;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

public class FrameCodec {

    public static final int HEADER_BYTES = Long.BYTES;

    private final long maxFrameBytes;

    public FrameCodec(long maxFrameBytes) {
        if (maxFrameBytes < 0 || maxFrameBytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Max frame size must be within [0, "
                    + Integer.MAX_VALUE + "], got " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public byte[] readFrame(InputStream in) throws IOException {
        byte[] header = readFully(in, HEADER_BYTES, "frame length");
        long length = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN).getLong();
        if (length < 0) {
            throw new IOException("Negative frame length " + length);
        }
        if (length > maxFrameBytes) {
            throw new IOException("Frame of " + length + " bytes exceeds limit of " + maxFrameBytes);
        }
        return readFully(in, (int) length, "frame body");
    }

    public String readText(InputStream in) throws IOException {
        return new String(readFrame(in), StandardCharsets.UTF_8);
    }

    public static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        byte[] header = ByteBuffer.allocate(HEADER_BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(payload.length)
                .array();
        out.write(header);
        out.write(payload);
    }

    public static void writeText(OutputStream out, String text) throws IOException {
        writeFrame(out, text.getBytes(StandardCharsets.UTF_8));
    }

    // Buffer grows with the bytes actually received, not with the announced length
    private static byte[] readFully(InputStream in, int length, String what) throws IOException {
        byte[] buffer = in.readNBytes(length);
        if (buffer.length < length) {
            throw new EOFException("Stream ended after " + buffer.length + " of " + length + " bytes of " + what);
        }
        return buffer;
    }

    public long getMaxFrameBytes() {
        return maxFrameBytes;
    }
}
