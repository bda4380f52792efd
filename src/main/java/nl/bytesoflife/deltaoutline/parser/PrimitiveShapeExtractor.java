package nl.bytesoflife.deltaoutline.parser;

import nl.bytesoflife.deltaoutline.lexer.PathTokenizer;
import nl.bytesoflife.deltaoutline.model.PrimitiveShape;
import nl.bytesoflife.deltaoutline.model.Subpath;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts basic shapes (rect, circle, ellipse, polygon, polyline) into point sequences.
 */
public class PrimitiveShapeExtractor {

    public static final int DEFAULT_ELLIPSE_SAMPLES = 36;

    private final PathTokenizer tokenizer = new PathTokenizer();
    private final int ellipseSamples;

    public PrimitiveShapeExtractor() {
        this(DEFAULT_ELLIPSE_SAMPLES);
    }

    public PrimitiveShapeExtractor(int ellipseSamples) {
        if (ellipseSamples < 3) {
            throw new IllegalArgumentException("Ellipse sample count must be at least 3: " + ellipseSamples);
        }
        this.ellipseSamples = ellipseSamples;
    }

    public List<Subpath> extract(List<PrimitiveShape> shapes) {
        List<Subpath> subpaths = new ArrayList<>();
        for (PrimitiveShape shape : shapes) {
            Subpath subpath = extract(shape);
            if (subpath != null) {
                subpaths.add(subpath);
            }
        }
        return subpaths;
    }

    /**
     * Returns the shape's outline, or null when the shape has no area or no points.
     */
    public Subpath extract(PrimitiveShape shape) {
        if (shape instanceof PrimitiveShape.Rect rect) {
            return convertRect(rect);
        } else if (shape instanceof PrimitiveShape.Circle circle) {
            if (circle.r() <= 0) return null;
            return ellipse(circle.cx(), circle.cy(), circle.r(), circle.r());
        } else if (shape instanceof PrimitiveShape.Ellipse ellipse) {
            if (ellipse.rx() <= 0 || ellipse.ry() <= 0) return null;
            return ellipse(ellipse.cx(), ellipse.cy(), ellipse.rx(), ellipse.ry());
        } else if (shape instanceof PrimitiveShape.Polygon polygon) {
            return pointList(polygon.points(), true);
        } else if (shape instanceof PrimitiveShape.Polyline polyline) {
            return pointList(polyline.points(), false);
        }
        return null;
    }

    private Subpath convertRect(PrimitiveShape.Rect rect) {
        double x = rect.x();
        double y = rect.y();
        double w = rect.width();
        double h = rect.height();
        if (w <= 0 || h <= 0) return null;
        return Subpath.of(
                x, y,
                x + w, y,
                x + w, y + h,
                x, y + h,
                x, y);
    }

    private Subpath ellipse(double cx, double cy, double rx, double ry) {
        List<Coordinate> points = new ArrayList<>(ellipseSamples + 1);
        for (int i = 0; i < ellipseSamples; i++) {
            double angle = 2 * Math.PI * i / ellipseSamples;
            points.add(new Coordinate(cx + rx * Math.cos(angle), cy + ry * Math.sin(angle)));
        }
        points.add(points.get(0));
        return new Subpath(points);
    }

    private Subpath pointList(String value, boolean close) {
        if (value == null) return null;
        List<Double> numbers = tokenizer.numbers(value);
        List<Coordinate> points = new ArrayList<>(numbers.size() / 2 + 1);
        // A dangling odd coordinate is ignored
        for (int i = 0; i + 1 < numbers.size(); i += 2) {
            points.add(new Coordinate(numbers.get(i), numbers.get(i + 1)));
        }
        if (points.isEmpty()) return null;
        if (close) {
            points.add(points.get(0));
        }
        return new Subpath(points);
    }
}
