package photorestore;

public enum StageType {
    MASK,
    EDGE_DETECTION,
    FEATHER,
    INPAINT,
    COLOR_CORRECTION,
    SHARPEN_SMOOTH
}
