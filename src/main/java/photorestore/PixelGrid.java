package photorestore;

import java.awt.image.BufferedImage;
import java.util.Arrays;

public final class PixelGrid {

    private final int width;
    private final int height;
    private final int[] argb;

    private PixelGrid(int width, int height, int[] argb) {
        this.width = width;
        this.height = height;
        this.argb = argb;
    }

    public static PixelGrid of(int width, int height, int[] argb) {
        checkDimensions(width, height);
        if (argb.length != width * height) {
            throw new IllegalArgumentException("Pixel array length " + argb.length
                    + " does not match " + width + "x" + height);
        }
        return new PixelGrid(width, height, argb.clone());
    }

    // Grid where every pixel has the same color
    static PixelGrid filled(int width, int height, int argb) {
        checkDimensions(width, height);
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, argb);
        return new PixelGrid(width, height, pixels);
    }

    public static PixelGrid fromImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        checkDimensions(width, height);
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        if (!image.getColorModel().hasAlpha()) {
            for (int i = 0; i < pixels.length; i++) {
                pixels[i] |= 0xFF000000;
            }
        }
        return new PixelGrid(width, height, pixels);
    }

    // Takes ownership of the buffer; only stages call this after their barrier.
    static PixelGrid wrap(int width, int height, int[] argb) {
        return new PixelGrid(width, height, argb);
    }

    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    // Opaque RGB copy, as needed by encoders without alpha support (JPEG)
    public BufferedImage toRgbImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int size() {
        return argb.length;
    }

    public int getArgb(int x, int y) {
        return argb[y * width + x];
    }

    int getArgb(int index) {
        return argb[index];
    }

    int getRed(int x, int y) {
        return red(getArgb(x, y));
    }

    public int getAlpha(int x, int y) {
        return alpha(getArgb(x, y));
    }

    int[] toArgbArray() {
        return argb.clone();
    }

    public boolean sameDimensions(PixelGrid other) {
        return width == other.width && height == other.height;
    }

    public boolean sameDimensions(WeightGrid other) {
        return width == other.getWidth() && height == other.getHeight();
    }

    static int alpha(int argb) {
        return (argb >>> 24) & 0xFF;
    }

    static int red(int argb) {
        return (argb >> 16) & 0xFF;
    }

    static int green(int argb) {
        return (argb >> 8) & 0xFF;
    }

    static int blue(int argb) {
        return argb & 0xFF;
    }

    static int pack(int a, int r, int g, int b) {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    static int clampChannel(double value) {
        return clamp((int) Math.round(value), 0, 255);
    }

    private static void checkDimensions(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must not be empty: " + width + "x" + height);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelGrid)) return false;
        PixelGrid other = (PixelGrid) o;
        return width == other.width && height == other.height && Arrays.equals(argb, other.argb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(argb);
    }

    @Override
    public String toString() {
        return "PixelGrid[" + width + "x" + height + "]";
    }
}
