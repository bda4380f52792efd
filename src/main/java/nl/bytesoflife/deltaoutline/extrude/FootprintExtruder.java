package nl.bytesoflife.deltaoutline.extrude;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.util.GeometryFixer;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-dimensional stand-in for a solid modeler: the "solid" is the footprint polygon,
 * composed with JTS overlay operations. Useful for previews and area checks.
 * The extrusion depth is kept as user data on each extruded footprint.
 */
public class FootprintExtruder implements ProfileExtruder<Geometry> {

    private final GeometryFactory factory;

    public FootprintExtruder() {
        this(new GeometryFactory());
    }

    public FootprintExtruder(GeometryFactory factory) {
        this.factory = factory;
    }

    @Override
    public Geometry extrude(List<Coordinate> polygon, double depth) {
        if (polygon.size() < 3) return null;

        List<Coordinate> ring = new ArrayList<>(polygon.size() + 1);
        for (Coordinate c : polygon) {
            ring.add(new Coordinate(c.x, c.y));
        }
        Coordinate first = ring.get(0);
        Coordinate last = ring.get(ring.size() - 1);
        if (first.x != last.x || first.y != last.y) {
            ring.add(new Coordinate(first.x, first.y));
        }
        // Polyline input may still be too short once closed
        if (ring.size() < 4) return null;

        Geometry footprint = factory.createPolygon(ring.toArray(new Coordinate[0]));
        if (!footprint.isValid()) {
            footprint = GeometryFixer.fix(footprint);
        }
        footprint.setUserData(depth);
        return footprint;
    }

    @Override
    public Geometry union(Geometry base, Geometry solid) {
        return base.union(solid);
    }

    @Override
    public Geometry subtract(Geometry base, Geometry solid) {
        return base.difference(solid);
    }
}
