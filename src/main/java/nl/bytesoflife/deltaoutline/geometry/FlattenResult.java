package nl.bytesoflife.deltaoutline.geometry;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Outcome of flattening a curve segment.
 * {@link Degenerate} carries the straight-line fallback used when the curve
 * cannot be sampled (zero radius, zero length).
 */
public sealed interface FlattenResult permits FlattenResult.Sampled, FlattenResult.Degenerate {

    List<Coordinate> points();

    default boolean isDegenerate() {
        return this instanceof Degenerate;
    }

    record Sampled(List<Coordinate> points) implements FlattenResult {
        public Sampled {
            points = List.copyOf(points);
        }
    }

    record Degenerate(List<Coordinate> points, String reason) implements FlattenResult {
        public Degenerate {
            points = List.copyOf(points);
        }
    }
}
