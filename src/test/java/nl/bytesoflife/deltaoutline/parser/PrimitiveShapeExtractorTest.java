package nl.bytesoflife.deltaoutline.parser;

import nl.bytesoflife.deltaoutline.model.PrimitiveShape;
import nl.bytesoflife.deltaoutline.model.Subpath;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrimitiveShapeExtractorTest {

    private final PrimitiveShapeExtractor extractor = new PrimitiveShapeExtractor();

    @Test
    void rectangle() {
        Subpath rect = extractor.extract(new PrimitiveShape.Rect(1, 2, 3, 4));
        assertEquals(Subpath.of(1, 2, 4, 2, 4, 6, 1, 6, 1, 2), rect);
    }

    @Test
    void emptyRectangleHasNoOutline() {
        assertNull(extractor.extract(new PrimitiveShape.Rect(0, 0, 0, 10)));
        assertNull(extractor.extract(new PrimitiveShape.Rect(0, 0, 10, -1)));
    }

    @Test
    void circleSamplesLieOnCircle() {
        Subpath circle = extractor.extract(new PrimitiveShape.Circle(10, 20, 5));

        assertEquals(PrimitiveShapeExtractor.DEFAULT_ELLIPSE_SAMPLES + 1, circle.size());
        assertEquals(circle.first(), circle.last());
        Coordinate center = new Coordinate(10, 20);
        for (Coordinate c : circle.getPoints()) {
            assertEquals(5.0, c.distance(center), 1e-9);
        }
    }

    @Test
    void ellipseQuarterPoint() {
        Subpath ellipse = extractor.extract(new PrimitiveShape.Ellipse(0, 0, 10, 5));

        // Sample 9 of 36 sits at 90 degrees
        Coordinate quarter = ellipse.getPoints().get(9);
        assertEquals(0.0, quarter.x, 1e-9);
        assertEquals(5.0, quarter.y, 1e-9);
        assertEquals(new Coordinate(10, 0), ellipse.first());
    }

    @Test
    void customSampleCount() {
        Subpath circle = new PrimitiveShapeExtractor(8).extract(new PrimitiveShape.Circle(0, 0, 1));
        assertEquals(9, circle.size());
    }

    @Test
    void sampleCountBelowThreeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PrimitiveShapeExtractor(2));
    }

    @Test
    void zeroRadiusHasNoOutline() {
        assertNull(extractor.extract(new PrimitiveShape.Circle(5, 5, 0)));
        assertNull(extractor.extract(new PrimitiveShape.Ellipse(5, 5, 3, 0)));
    }

    @Test
    void polygonIsClosed() {
        Subpath polygon = extractor.extract(new PrimitiveShape.Polygon("0,0 10,0 10,10"));
        assertEquals(Subpath.of(0, 0, 10, 0, 10, 10, 0, 0), polygon);
    }

    @Test
    void polylineStaysOpen() {
        Subpath polyline = extractor.extract(new PrimitiveShape.Polyline("0,0 10,0 10,10"));
        assertEquals(Subpath.of(0, 0, 10, 0, 10, 10), polyline);
    }

    @Test
    void danglingCoordinateIsIgnored() {
        Subpath polyline = extractor.extract(new PrimitiveShape.Polyline("0 0 10 0 10 10 7"));
        assertEquals(3, polyline.size());
    }

    @Test
    void signsSeparateNumbers() {
        Subpath polyline = extractor.extract(new PrimitiveShape.Polyline("10-5 20-5"));
        assertEquals(Subpath.of(10, -5, 20, -5), polyline);
    }

    @Test
    void emptyPointListHasNoOutline() {
        assertNull(extractor.extract(new PrimitiveShape.Polygon("")));
        assertNull(extractor.extract(new PrimitiveShape.Polyline("   ")));
    }

    @Test
    void listExtractionSkipsShapesWithoutOutline() {
        List<Subpath> subpaths = extractor.extract(Arrays.asList(
                new PrimitiveShape.Rect(0, 0, 10, 10),
                new PrimitiveShape.Circle(0, 0, 0),
                new PrimitiveShape.Polygon("1 1 2 2 3 1")));

        assertEquals(2, subpaths.size());
        assertEquals(5, subpaths.get(0).size());
        assertEquals(4, subpaths.get(1).size());
    }
}
