package photorestore;

public final class Region {

    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final int readX;
    private final int readY;
    private final int readWidth;
    private final int readHeight;

    Region(int x, int y, int width, int height, int halo, int gridWidth, int gridHeight) {
        if (x < 0 || y < 0 || width <= 0 || height <= 0
                || x + width > gridWidth || y + height > gridHeight) {
            throw new IllegalArgumentException("Region " + x + "," + y + " " + width + "x" + height
                    + " outside " + gridWidth + "x" + gridHeight);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.readX = Math.max(0, x - halo);
        this.readY = Math.max(0, y - halo);
        this.readWidth = Math.min(gridWidth, x + width + halo) - readX;
        this.readHeight = Math.min(gridHeight, y + height + halo) - readY;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getEndX() {
        return x + width;
    }

    public int getEndY() {
        return y + height;
    }

    int getReadX() {
        return readX;
    }

    int getReadY() {
        return readY;
    }

    int getReadEndX() {
        return readX + readWidth;
    }

    int getReadEndY() {
        return readY + readHeight;
    }

    boolean owns(int px, int py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }

    boolean canRead(int px, int py) {
        return px >= readX && px < readX + readWidth && py >= readY && py < readY + readHeight;
    }

    @Override
    public String toString() {
        return "Region[" + x + "," + y + " " + width + "x" + height
                + " read " + readX + "," + readY + " " + readWidth + "x" + readHeight + "]";
    }
}
