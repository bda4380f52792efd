package nl.bytesoflife.deltaoutline.geometry;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Samples Bézier curves and elliptical arcs into line-segment points.
 * Every function returns {@code segments + 1} points; the first and last are
 * the given endpoints, copied rather than recomputed.
 */
public final class CurveFlattener {

    private CurveFlattener() {
    }

    public static List<Coordinate> cubic(Coordinate p0, Coordinate p1, Coordinate p2, Coordinate p3,
                                         int segments) {
        checkSegments(segments);
        List<Coordinate> points = new ArrayList<>(segments + 1);
        points.add(new Coordinate(p0.x, p0.y));
        for (int i = 1; i < segments; i++) {
            double t = (double) i / segments;
            double mt = 1 - t;
            double a = mt * mt * mt;
            double b = 3 * mt * mt * t;
            double c = 3 * mt * t * t;
            double d = t * t * t;
            points.add(new Coordinate(
                    a * p0.x + b * p1.x + c * p2.x + d * p3.x,
                    a * p0.y + b * p1.y + c * p2.y + d * p3.y));
        }
        points.add(new Coordinate(p3.x, p3.y));
        return points;
    }

    public static List<Coordinate> quadratic(Coordinate p0, Coordinate p1, Coordinate p2, int segments) {
        checkSegments(segments);
        List<Coordinate> points = new ArrayList<>(segments + 1);
        points.add(new Coordinate(p0.x, p0.y));
        for (int i = 1; i < segments; i++) {
            double t = (double) i / segments;
            double mt = 1 - t;
            double a = mt * mt;
            double b = 2 * mt * t;
            double c = t * t;
            points.add(new Coordinate(
                    a * p0.x + b * p1.x + c * p2.x,
                    a * p0.y + b * p1.y + c * p2.y));
        }
        points.add(new Coordinate(p2.x, p2.y));
        return points;
    }

    /**
     * Flattens an SVG elliptical arc using the endpoint-to-center conversion
     * (SVG 1.1 implementation notes, F.6.5 and F.6.6).
     *
     * @param xAxisRotation rotation of the ellipse x-axis in degrees
     */
    public static FlattenResult arc(Coordinate start, double rx, double ry, double xAxisRotation,
                                    boolean largeArc, boolean sweep, Coordinate end, int segments) {
        checkSegments(segments);
        if (rx == 0 || ry == 0) {
            return new FlattenResult.Degenerate(List.of(copy(start), copy(end)), "zero radius");
        }
        if (start.x == end.x && start.y == end.y) {
            return new FlattenResult.Degenerate(List.of(copy(start), copy(end)), "zero length");
        }

        rx = Math.abs(rx);
        ry = Math.abs(ry);
        double phi = Math.toRadians(xAxisRotation % 360.0);
        double cosPhi = Math.cos(phi);
        double sinPhi = Math.sin(phi);

        // Midpoint of the chord in the ellipse's local frame
        double dx = (start.x - end.x) / 2;
        double dy = (start.y - end.y) / 2;
        double x1p = cosPhi * dx + sinPhi * dy;
        double y1p = -sinPhi * dx + cosPhi * dy;

        // Radii too small to span the chord are scaled up uniformly
        double lambda = (x1p * x1p) / (rx * rx) + (y1p * y1p) / (ry * ry);
        if (lambda > 1) {
            double s = Math.sqrt(lambda);
            rx *= s;
            ry *= s;
        }

        double rx2 = rx * rx;
        double ry2 = ry * ry;
        double num = rx2 * ry2 - rx2 * y1p * y1p - ry2 * x1p * x1p;
        double den = rx2 * y1p * y1p + ry2 * x1p * x1p;
        double coef = Math.sqrt(Math.max(0, num / den));
        if (largeArc == sweep) {
            coef = -coef;
        }
        double cxp = coef * (rx * y1p / ry);
        double cyp = coef * -(ry * x1p / rx);

        double cx = cosPhi * cxp - sinPhi * cyp + (start.x + end.x) / 2;
        double cy = sinPhi * cxp + cosPhi * cyp + (start.y + end.y) / 2;

        double ux = (x1p - cxp) / rx;
        double uy = (y1p - cyp) / ry;
        double vx = (-x1p - cxp) / rx;
        double vy = (-y1p - cyp) / ry;
        double theta1 = angleBetween(1, 0, ux, uy);
        double delta = angleBetween(ux, uy, vx, vy);
        if (!sweep && delta > 0) {
            delta -= 2 * Math.PI;
        } else if (sweep && delta < 0) {
            delta += 2 * Math.PI;
        }

        List<Coordinate> points = new ArrayList<>(segments + 1);
        points.add(copy(start));
        for (int i = 1; i < segments; i++) {
            double theta = theta1 + delta * i / segments;
            double ex = rx * Math.cos(theta);
            double ey = ry * Math.sin(theta);
            points.add(new Coordinate(
                    cosPhi * ex - sinPhi * ey + cx,
                    sinPhi * ex + cosPhi * ey + cy));
        }
        points.add(copy(end));
        return new FlattenResult.Sampled(points);
    }

    /**
     * Signed angle in radians from vector u to vector v, in (-pi, pi].
     */
    static double angleBetween(double ux, double uy, double vx, double vy) {
        return Math.atan2(ux * vy - uy * vx, ux * vx + uy * vy);
    }

    private static Coordinate copy(Coordinate c) {
        return new Coordinate(c.x, c.y);
    }

    private static void checkSegments(int segments) {
        if (segments < 1) {
            throw new IllegalArgumentException("Segment count must be at least 1: " + segments);
        }
    }
}
