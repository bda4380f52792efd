package nl.bytesoflife.deltaoutline.extrude;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Boundary toward a solid-modeling engine.
 *
 * @param <S> the engine's solid type
 */
public interface ProfileExtruder<S> {

    /**
     * Extrudes a closed polygon (closure implied, the first point is not repeated).
     */
    S extrude(List<Coordinate> polygon, double depth);

    S union(S base, S solid);

    S subtract(S base, S solid);
}
