package nl.bytesoflife.deltaoutline.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    void viewBoxParsing() {
        assertEquals(new ViewBox(0, 0, 100, 50), ViewBox.parse("0 0 100 50"));
        assertEquals(new ViewBox(-5, 2.5, 10, 20), ViewBox.parse(" -5, 2.5 ,10,20 "));
        assertNull(ViewBox.parse("0 0 100"));
        assertNull(ViewBox.parse(""));
        assertNull(ViewBox.parse(null));
    }

    @Test
    void viewBoxCenterAndExtent() {
        ViewBox box = new ViewBox(10, 20, 200, 100);
        assertEquals(110.0, box.centerX());
        assertEquals(70.0, box.centerY());
        assertEquals(200.0, box.maxExtent());
    }

    @ParameterizedTest
    @CsvSource({
            "raised, RAISED",
            "Engraved, ENGRAVED",
            "' cutout ', CUTOUT",
            "embossed, RAISED"
    })
    void extrusionStyleFromName(String name, ExtrusionStyle expected) {
        assertEquals(expected, ExtrusionStyle.fromName(name));
    }

    @Test
    void extrusionStyleDefaultsToRaised() {
        assertEquals(ExtrusionStyle.RAISED, ExtrusionStyle.fromName(null));
    }

    @Test
    void subpathRequiresPairs() {
        assertThrows(IllegalArgumentException.class, () -> Subpath.of(1, 2, 3));
    }

    @Test
    void subpathCopiesItsPoints() {
        List<Coordinate> points = new ArrayList<>(List.of(new Coordinate(0, 0), new Coordinate(1, 1)));
        Subpath subpath = new Subpath(points);

        points.get(0).x = 42;
        points.add(new Coordinate(2, 2));

        assertEquals(2, subpath.size());
        assertEquals(0.0, subpath.first().x);
        assertThrows(UnsupportedOperationException.class, () -> subpath.getPoints().clear());
    }

    @Test
    void subpathEnvelope() {
        Subpath subpath = Subpath.of(3, -1, 7, 4, -2, 0);
        assertEquals(new Envelope(-2, 7, -1, 4), subpath.getEnvelope());
        assertEquals(new Coordinate(-2, 0), subpath.last());
    }

    @Test
    void elementDefaults() {
        OutlineElement element = new OutlineElement("Logo");
        assertEquals(1.0, element.getScale());
        assertEquals(2.0, element.getDepth());
        assertEquals(20.0, element.getTargetSize());
        assertEquals(ExtrusionStyle.RAISED, element.getStyle());
        assertEquals(0.0, element.getRotation());
    }

    @Test
    void elementValidatesSizes() {
        OutlineElement element = new OutlineElement("Logo");
        assertThrows(IllegalArgumentException.class, () -> element.setScale(0));
        assertThrows(IllegalArgumentException.class, () -> element.setDepth(-1));
        assertThrows(IllegalArgumentException.class, () -> element.setTargetSize(0));
        assertEquals(ExtrusionStyle.RAISED, element.setStyle(null).getStyle());
    }

    @Test
    void sourceWithViewBox() {
        OutlineSource source = OutlineSource.ofPaths(100, 100, "M0 0").withViewBox(new ViewBox(0, 0, 50, 50));
        assertEquals(50.0, source.viewBox().width());
        assertEquals(List.of("M0 0"), source.pathData());
    }
}
