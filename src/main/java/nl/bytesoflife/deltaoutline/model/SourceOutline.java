package nl.bytesoflife.deltaoutline.model;

import java.util.List;
import java.util.Objects;

/**
 * All subpaths of one imported element together with its declared size and viewBox.
 */
public record SourceOutline(List<Subpath> subpaths, double width, double height, ViewBox viewBox) {

    public SourceOutline {
        subpaths = List.copyOf(subpaths);
        Objects.requireNonNull(viewBox, "viewBox");
    }

    public SourceOutline(List<Subpath> subpaths, double width, double height) {
        this(subpaths, width, height, ViewBox.ofSize(width, height));
    }

    public boolean isEmpty() {
        return subpaths.isEmpty();
    }
}
