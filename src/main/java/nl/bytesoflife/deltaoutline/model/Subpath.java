package nl.bytesoflife.deltaoutline.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One continuous pen stroke: an ordered list of points in reading order.
 */
public final class Subpath {

    private final List<Coordinate> points;

    public Subpath(List<Coordinate> points) {
        List<Coordinate> copy = new ArrayList<>(points.size());
        for (Coordinate c : points) {
            copy.add(new Coordinate(c.x, c.y));
        }
        this.points = Collections.unmodifiableList(copy);
    }

    public static Subpath of(double... xy) {
        if (xy.length % 2 != 0) {
            throw new IllegalArgumentException("Expected coordinate pairs, got " + xy.length + " values");
        }
        List<Coordinate> coords = new ArrayList<>(xy.length / 2);
        for (int i = 0; i < xy.length; i += 2) {
            coords.add(new Coordinate(xy[i], xy[i + 1]));
        }
        return new Subpath(coords);
    }

    public List<Coordinate> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Coordinate first() {
        return points.get(0);
    }

    public Coordinate last() {
        return points.get(points.size() - 1);
    }

    public Envelope getEnvelope() {
        Envelope env = new Envelope();
        for (Coordinate c : points) {
            env.expandToInclude(c);
        }
        return env;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subpath other)) return false;
        if (points.size() != other.points.size()) return false;
        for (int i = 0; i < points.size(); i++) {
            Coordinate a = points.get(i);
            Coordinate b = other.points.get(i);
            if (Double.compare(a.x, b.x) != 0 || Double.compare(a.y, b.y) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Coordinate c : points) {
            h = 31 * h + Double.hashCode(c.x);
            h = 31 * h + Double.hashCode(c.y);
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Subpath[");
        for (int i = 0; i < points.size(); i++) {
            if (i > 0) sb.append(' ');
            Coordinate c = points.get(i);
            sb.append(c.x).append(',').append(c.y);
        }
        return sb.append(']').toString();
    }
}
