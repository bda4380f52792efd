package nl.bytesoflife.deltaoutline.model;

import java.util.List;
import java.util.Objects;

/**
 * Raw geometric content of one element before interpretation.
 */
public record OutlineSource(String name, List<String> pathData, List<PrimitiveShape> shapes,
                            double width, double height, ViewBox viewBox) {

    public OutlineSource {
        pathData = List.copyOf(pathData);
        shapes = List.copyOf(shapes);
        Objects.requireNonNull(viewBox, "viewBox");
    }

    public static OutlineSource ofPaths(double width, double height, String... pathData) {
        return new OutlineSource("Outline", List.of(pathData), List.of(),
                width, height, ViewBox.ofSize(width, height));
    }

    public OutlineSource withShapes(List<PrimitiveShape> shapes) {
        return new OutlineSource(name, pathData, shapes, width, height, viewBox);
    }

    public OutlineSource withViewBox(ViewBox viewBox) {
        return new OutlineSource(name, pathData, shapes, width, height, viewBox);
    }
}
