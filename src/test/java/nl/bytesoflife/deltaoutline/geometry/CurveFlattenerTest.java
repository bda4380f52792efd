package nl.bytesoflife.deltaoutline.geometry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CurveFlattenerTest {

    static Stream<Arguments> cubicControlPoints() {
        return Stream.of(
                Arguments.of(new Coordinate(0, 0), new Coordinate(0, 10), new Coordinate(10, 10), new Coordinate(10, 0)),
                Arguments.of(new Coordinate(0.1, 0.2), new Coordinate(0.7, -3.3), new Coordinate(1e-7, 5), new Coordinate(0.3, 0.3)),
                Arguments.of(new Coordinate(-1e6, 3.14159), new Coordinate(2.5, 2.5), new Coordinate(1e6, -1e6), new Coordinate(123.456, -0.001)),
                Arguments.of(new Coordinate(1, 1), new Coordinate(1, 1), new Coordinate(1, 1), new Coordinate(1, 1))
        );
    }

    @ParameterizedTest
    @MethodSource("cubicControlPoints")
    void cubicEndpointsAreExact(Coordinate p0, Coordinate p1, Coordinate p2, Coordinate p3) {
        for (int segments : new int[]{1, 2, 7, 10, 64}) {
            List<Coordinate> points = CurveFlattener.cubic(p0, p1, p2, p3, segments);
            assertEquals(segments + 1, points.size());
            assertEquals(p0.x, points.get(0).x);
            assertEquals(p0.y, points.get(0).y);
            assertEquals(p3.x, points.get(segments).x);
            assertEquals(p3.y, points.get(segments).y);
        }
    }

    @Test
    void cubicMidpoint() {
        List<Coordinate> points = CurveFlattener.cubic(
                new Coordinate(0, 0), new Coordinate(0, 10), new Coordinate(10, 10), new Coordinate(10, 0), 2);
        assertEquals(5.0, points.get(1).x, 1e-12);
        assertEquals(7.5, points.get(1).y, 1e-12);
    }

    @Test
    void quadraticEndpointsAndMidpoint() {
        Coordinate p0 = new Coordinate(0.3, -0.7);
        Coordinate p2 = new Coordinate(40.1, 2.9);
        List<Coordinate> points = CurveFlattener.quadratic(p0, new Coordinate(20, 20), p2, 10);
        assertEquals(11, points.size());
        assertEquals(p0.x, points.get(0).x);
        assertEquals(p0.y, points.get(0).y);
        assertEquals(p2.x, points.get(10).x);
        assertEquals(p2.y, points.get(10).y);

        List<Coordinate> simple = CurveFlattener.quadratic(
                new Coordinate(0, 0), new Coordinate(10, 10), new Coordinate(20, 0), 2);
        assertEquals(new Coordinate(10, 5), simple.get(1));
    }

    @Test
    void flatteningReturnsCopies() {
        Coordinate p0 = new Coordinate(0, 0);
        List<Coordinate> points = CurveFlattener.quadratic(p0, new Coordinate(1, 1), new Coordinate(2, 0), 4);
        points.get(0).x = 99;
        assertEquals(0.0, p0.x);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void segmentCountMustBePositive(int segments) {
        Coordinate p = new Coordinate(0, 0);
        assertThrows(IllegalArgumentException.class, () -> CurveFlattener.cubic(p, p, p, p, segments));
        assertThrows(IllegalArgumentException.class, () -> CurveFlattener.quadratic(p, p, p, segments));
        assertThrows(IllegalArgumentException.class,
                () -> CurveFlattener.arc(p, 1, 1, 0, false, false, new Coordinate(1, 0), segments));
    }

    @Test
    void zeroRadiusArcIsDegenerateLine() {
        Coordinate start = new Coordinate(1, 2);
        Coordinate end = new Coordinate(30, 40);

        FlattenResult rxZero = CurveFlattener.arc(start, 0, 10, 0, false, true, end, 20);
        FlattenResult ryZero = CurveFlattener.arc(start, 10, 0, 45, true, false, end, 20);

        for (FlattenResult result : List.of(rxZero, ryZero)) {
            assertTrue(result.isDegenerate());
            assertEquals(List.of(start, end), result.points());
            for (Coordinate c : result.points()) {
                assertFalse(Double.isNaN(c.x) || Double.isNaN(c.y));
            }
        }
    }

    @Test
    void zeroLengthArcIsDegenerate() {
        Coordinate p = new Coordinate(5, 5);
        FlattenResult result = CurveFlattener.arc(p, 10, 10, 0, false, true, p, 20);
        assertInstanceOf(FlattenResult.Degenerate.class, result);
        assertEquals(2, result.points().size());
    }

    @Test
    void arcEndpointsAreExact() {
        Coordinate start = new Coordinate(3.3, 1.1);
        Coordinate end = new Coordinate(17.9, -4.2);
        FlattenResult result = CurveFlattener.arc(start, 12, 7, 30, true, false, end, 20);
        assertInstanceOf(FlattenResult.Sampled.class, result);
        List<Coordinate> points = result.points();
        assertEquals(21, points.size());
        assertEquals(start, points.get(0));
        assertEquals(end, points.get(20));
    }

    @Test
    void tooSmallRadiiAreScaledUp() {
        FlattenResult result = CurveFlattener.arc(
                new Coordinate(0, 0), 1, 1, 0, false, true, new Coordinate(20, 0), 16);
        Coordinate center = new Coordinate(10, 0);
        for (Coordinate c : result.points()) {
            assertEquals(10.0, c.distance(center), 1e-9);
        }
    }

    @Test
    void largeArcFlagSelectsLongWayRound() {
        Coordinate start = new Coordinate(0, 0);
        Coordinate end = new Coordinate(10, 0);

        double smallBulge = maxAbsY(CurveFlattener.arc(start, 10, 10, 0, false, true, end, 32).points());
        double largeBulge = maxAbsY(CurveFlattener.arc(start, 10, 10, 0, true, true, end, 32).points());

        // Sagitta of the short arc is 10 - sqrt(75), of the long one 10 + sqrt(75)
        assertEquals(10 - Math.sqrt(75), smallBulge, 0.05);
        assertEquals(10 + Math.sqrt(75), largeBulge, 0.05);
    }

    @Test
    void rotatedEllipticalArcStaysOnEllipse() {
        // Major axis (rx=20) rotated to vertical; the chord spans it exactly
        FlattenResult result = CurveFlattener.arc(
                new Coordinate(0, 0), 20, 10, 90, false, true, new Coordinate(0, 40), 20);
        for (Coordinate c : result.points()) {
            double dx = c.x;
            double dy = c.y - 20;
            double localX = dy;
            double localY = -dx;
            double value = (localX * localX) / 400 + (localY * localY) / 100;
            assertEquals(1.0, value, 1e-6);
        }
    }

    @Test
    void signedAngleBetweenVectors() {
        assertEquals(Math.PI / 2, CurveFlattener.angleBetween(1, 0, 0, 1), 1e-12);
        assertEquals(-Math.PI / 2, CurveFlattener.angleBetween(0, 1, 1, 0), 1e-12);
        assertEquals(0.0, CurveFlattener.angleBetween(2, 0, 5, 0), 1e-12);
    }

    private static double maxAbsY(List<Coordinate> points) {
        double max = 0;
        for (Coordinate c : points) {
            max = Math.max(max, Math.abs(c.y));
        }
        return max;
    }
}
