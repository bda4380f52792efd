package nl.bytesoflife.deltaoutline.geometry;

import nl.bytesoflife.deltaoutline.model.Subpath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * A normalized subpath with its containment depth and resulting role.
 *
 * @param sourceIndex position of the subpath in the resolver's input list
 */
public record NestedSubpath(Subpath subpath, Envelope bounds, double area, int level, Role role,
                            int sourceIndex) {

    public NestedSubpath {
        bounds = new Envelope(bounds);
    }

    @Override
    public Envelope bounds() {
        return new Envelope(bounds);
    }

    public List<Coordinate> polygon() {
        return subpath.getPoints();
    }

    public boolean isFill() {
        return role == Role.FILL;
    }

    public boolean isHole() {
        return role == Role.HOLE;
    }
}
