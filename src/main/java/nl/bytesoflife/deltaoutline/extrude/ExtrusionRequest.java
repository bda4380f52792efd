package nl.bytesoflife.deltaoutline.extrude;

import nl.bytesoflife.deltaoutline.geometry.NestedSubpath;
import nl.bytesoflife.deltaoutline.model.ExtrusionStyle;

import java.util.List;
import java.util.Objects;

/**
 * Role-tagged profiles handed to a solid modeler, with the extrusion depth and placement style.
 */
public record ExtrusionRequest(List<NestedSubpath> profiles, double depth, ExtrusionStyle style) {

    public ExtrusionRequest {
        profiles = List.copyOf(profiles);
        Objects.requireNonNull(style, "style");
        if (depth <= 0) {
            throw new IllegalArgumentException("Depth must be positive: " + depth);
        }
    }

    public List<NestedSubpath> fills() {
        return profiles.stream().filter(NestedSubpath::isFill).toList();
    }

    public List<NestedSubpath> holes() {
        return profiles.stream().filter(NestedSubpath::isHole).toList();
    }
}
