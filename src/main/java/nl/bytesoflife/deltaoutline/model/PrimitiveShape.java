package nl.bytesoflife.deltaoutline.model;

/**
 * Basic shape descriptions that map directly to point sequences.
 */
public sealed interface PrimitiveShape permits PrimitiveShape.Rect, PrimitiveShape.Circle,
        PrimitiveShape.Ellipse, PrimitiveShape.Polygon, PrimitiveShape.Polyline {

    record Rect(double x, double y, double width, double height) implements PrimitiveShape {}

    record Circle(double cx, double cy, double r) implements PrimitiveShape {}

    record Ellipse(double cx, double cy, double rx, double ry) implements PrimitiveShape {}

    /** Closed point list, as in {@code points="x1,y1 x2,y2 ..."}. */
    record Polygon(String points) implements PrimitiveShape {}

    /** Open point list; never auto-closed. */
    record Polyline(String points) implements PrimitiveShape {}
}
