package nl.bytesoflife.deltaoutline.extrude;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FootprintExtruderTest {

    private final FootprintExtruder extruder = new FootprintExtruder();

    @Test
    void openRingIsClosed() {
        Geometry footprint = extruder.extrude(List.of(
                new Coordinate(0, 0), new Coordinate(10, 0), new Coordinate(10, 10), new Coordinate(0, 10)), 2);

        assertNotNull(footprint);
        assertTrue(footprint.isValid());
        assertEquals(100.0, footprint.getArea(), 1e-9);
        assertEquals(2.0, footprint.getUserData());
    }

    @Test
    void alreadyClosedRingIsAccepted() {
        Geometry footprint = extruder.extrude(List.of(
                new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(4, 4), new Coordinate(0, 0)), 1);
        assertEquals(8.0, footprint.getArea(), 1e-9);
    }

    @Test
    void tooFewPointsYieldNothing() {
        assertNull(extruder.extrude(List.of(new Coordinate(0, 0), new Coordinate(1, 1)), 1));
        assertNull(extruder.extrude(List.of(
                new Coordinate(0, 0), new Coordinate(1, 1), new Coordinate(0, 0)), 1));
    }

    @Test
    void selfIntersectingOutlineIsRepaired() {
        Geometry footprint = extruder.extrude(List.of(
                new Coordinate(0, 0), new Coordinate(10, 10), new Coordinate(10, 0), new Coordinate(0, 10)), 1);

        assertTrue(footprint.isValid());
        assertEquals(50.0, footprint.getArea(), 1e-9);
        assertEquals(1.0, footprint.getUserData());
    }

    @Test
    void unionAndSubtract() {
        Geometry a = extruder.extrude(square(0, 0, 10), 1);
        Geometry b = extruder.extrude(square(5, 0, 10), 1);

        assertEquals(150.0, extruder.union(a, b).getArea(), 1e-9);
        assertEquals(50.0, extruder.subtract(a, b).getArea(), 1e-9);
    }

    private static List<Coordinate> square(double x, double y, double size) {
        return List.of(new Coordinate(x, y), new Coordinate(x + size, y),
                new Coordinate(x + size, y + size), new Coordinate(x, y + size));
    }
}
