package nl.bytesoflife.deltaoutline.model;

/**
 * Presentation parameters of an imported outline.
 * Only the user scale and target size influence the geometry produced by this library;
 * the rest is handed through to the caller's scene composition.
 */
public class OutlineElement {

    private final String name;
    private double positionX;
    private double positionY;
    private double rotation;
    private double scale = 1.0;
    private double depth = 2.0;
    private ExtrusionStyle style = ExtrusionStyle.RAISED;
    private double targetSize = 20.0;

    public OutlineElement(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public double getPositionX() {
        return positionX;
    }

    public double getPositionY() {
        return positionY;
    }

    public OutlineElement setPosition(double x, double y) {
        this.positionX = x;
        this.positionY = y;
        return this;
    }

    /** Rotation in degrees around the outline center. */
    public double getRotation() {
        return rotation;
    }

    public OutlineElement setRotation(double rotation) {
        this.rotation = rotation;
        return this;
    }

    public double getScale() {
        return scale;
    }

    public OutlineElement setScale(double scale) {
        if (scale <= 0) {
            throw new IllegalArgumentException("Scale must be positive: " + scale);
        }
        this.scale = scale;
        return this;
    }

    public double getDepth() {
        return depth;
    }

    public OutlineElement setDepth(double depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("Depth must be positive: " + depth);
        }
        this.depth = depth;
        return this;
    }

    public ExtrusionStyle getStyle() {
        return style;
    }

    public OutlineElement setStyle(ExtrusionStyle style) {
        this.style = style != null ? style : ExtrusionStyle.RAISED;
        return this;
    }

    public double getTargetSize() {
        return targetSize;
    }

    public OutlineElement setTargetSize(double targetSize) {
        if (targetSize <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + targetSize);
        }
        this.targetSize = targetSize;
        return this;
    }

    @Override
    public String toString() {
        return "OutlineElement{name='" + name + "', style=" + style + ", depth=" + depth +
                ", targetSize=" + targetSize + ", scale=" + scale + "}";
    }
}
