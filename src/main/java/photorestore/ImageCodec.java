package photorestore;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import javax.imageio.ImageIO;

public class ImageCodec {

    public static PixelGrid read(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Unsupported or corrupt image data: " + path);
        }
        return PixelGrid.fromImage(image);
    }

    public static PixelGrid decode(byte[] data) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
        if (image == null) {
            throw new IOException("Unsupported or corrupt image data");
        }
        return PixelGrid.fromImage(image);
    }

    public static byte[] encode(PixelGrid grid, String format) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(toWritable(grid, format), normalize(format), out)) {
            throw new IOException("No image writer for format " + format);
        }
        return out.toByteArray();
    }

    public static void write(PixelGrid grid, Path path) throws IOException {
        String format = formatOf(path);
        writeImage(toWritable(grid, format), format, path.toFile());
    }

    // Saves a mask or weight map as a gray image, white for 1.0
    public static void writeWeights(WeightGrid weights, Path path) throws IOException {
        writeImage(weights.toGrayImage(), formatOf(path), path.toFile());
    }

    // Format name from the file extension, jpg when there is none
    public static String formatOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "jpg" : normalize(name.substring(dot + 1));
    }

    private static void writeImage(BufferedImage image, String format, File file) throws IOException {
        if (!ImageIO.write(image, format, file)) {
            throw new IOException("No image writer for format " + format);
        }
    }

    // JPEG writers reject alpha
    private static BufferedImage toWritable(PixelGrid grid, String format) {
        String normalized = normalize(format);
        return "jpg".equals(normalized) || "bmp".equals(normalized) ? grid.toRgbImage() : grid.toImage();
    }

    private static String normalize(String format) {
        String lower = format.toLowerCase(Locale.ROOT);
        return "jpeg".equals(lower) ? "jpg" : lower;
    }
}
