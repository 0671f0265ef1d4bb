package photorestore;

import java.awt.image.BufferedImage;
import java.util.Arrays;

public final class WeightGrid {

    private final int width;
    private final int height;
    private final double[] values;

    private WeightGrid(int width, int height, double[] values) {
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public static WeightGrid of(int width, int height, double[] values) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid must not be empty: " + width + "x" + height);
        }
        if (values.length != width * height) {
            throw new IllegalArgumentException("Value array length " + values.length
                    + " does not match " + width + "x" + height);
        }
        return new WeightGrid(width, height, values.clone());
    }

    static WeightGrid zeros(int width, int height) {
        return of(width, height, new double[width * height]);
    }

    static WeightGrid wrap(int width, int height, double[] values) {
        return new WeightGrid(width, height, values);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double get(int x, int y) {
        return values[y * width + x];
    }

    double get(int index) {
        return values[index];
    }

    double[] toArray() {
        return values.clone();
    }

    // Number of cells whose value is exactly 1.0
    public int countSaturated() {
        int count = 0;
        for (double v : values) {
            if (v == 1.0) {
                count++;
            }
        }
        return count;
    }

    public boolean sameDimensions(PixelGrid image) {
        return image.sameDimensions(this);
    }

    // 0.0 black, 1.0 white: damaged mask pixels show white
    public BufferedImage toGrayImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int gray = PixelGrid.clamp((int) (get(x, y) * 255), 0, 255);
                image.setRGB(x, y, PixelGrid.pack(0xFF, gray, gray, gray));
            }
        }
        return image;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightGrid)) return false;
        WeightGrid other = (WeightGrid) o;
        return width == other.width && height == other.height && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "WeightGrid[" + width + "x" + height + "]";
    }
}
