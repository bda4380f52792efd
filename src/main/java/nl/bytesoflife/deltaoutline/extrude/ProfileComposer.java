package nl.bytesoflife.deltaoutline.extrude;

import nl.bytesoflife.deltaoutline.geometry.NestedSubpath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Drives a {@link ProfileExtruder} over a request.
 * Profiles are applied level by level, outermost first: fills are unioned into the
 * result and holes subtracted from it, so an island inside a hole survives.
 */
public class ProfileComposer {

    /**
     * Returns the composed solid, or null when the request contains no fill.
     */
    public <S> S compose(ExtrusionRequest request, ProfileExtruder<S> extruder) {
        List<NestedSubpath> ordered = new ArrayList<>(request.profiles());
        ordered.sort(Comparator.comparingInt(NestedSubpath::level));

        S result = null;
        for (NestedSubpath profile : ordered) {
            if (profile.isHole() && result == null) {
                // Nothing to cut from yet
                continue;
            }
            S solid = extruder.extrude(profile.polygon(), request.depth());
            if (solid == null) {
                continue;
            }
            if (profile.isFill()) {
                result = result == null ? solid : extruder.union(result, solid);
            } else {
                result = extruder.subtract(result, solid);
            }
        }
        return result;
    }
}
