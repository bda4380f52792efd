package nl.bytesoflife.deltaoutline.geometry;

import nl.bytesoflife.deltaoutline.model.Subpath;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns nesting levels and fill/hole roles by bounding-box containment.
 *
 * This approximates the even-odd fill rule for simple nested outlines. Self-intersecting
 * or partially overlapping subpaths are not resolved by true winding.
 */
public class NestingResolver {

    private static final Logger log = LoggerFactory.getLogger(NestingResolver.class);

    /**
     * Returns the subpaths ordered by bounding-box area, largest first, each tagged
     * with its level and role.
     */
    public List<NestedSubpath> resolve(List<Subpath> subpaths) {
        List<Candidate> candidates = new ArrayList<>(subpaths.size());
        for (int i = 0; i < subpaths.size(); i++) {
            Subpath subpath = subpaths.get(i);
            Envelope env = subpath.getEnvelope();
            candidates.add(new Candidate(i, subpath, env, env.getArea()));
        }
        // List.sort is stable: equal areas keep their input order
        candidates.sort(Comparator.comparingDouble(Candidate::area).reversed());

        List<NestedSubpath> placed = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            int level = 0;
            // Walk back from the smallest placed box so the tightest container is the parent
            for (int j = placed.size() - 1; j >= 0; j--) {
                NestedSubpath outer = placed.get(j);
                if (covers(outer.bounds(), candidate.envelope())) {
                    level = outer.level() + 1;
                    log.trace("Subpath {} nested in subpath {} at level {}",
                            candidate.index(), outer.sourceIndex(), level);
                    break;
                }
            }
            placed.add(new NestedSubpath(candidate.subpath(), candidate.envelope(), candidate.area(),
                    level, Role.forLevel(level), candidate.index()));
        }
        return placed;
    }

    static boolean covers(Envelope outer, Envelope inner) {
        return outer.getMinX() <= inner.getMinX()
                && outer.getMinY() <= inner.getMinY()
                && outer.getMaxX() >= inner.getMaxX()
                && outer.getMaxY() >= inner.getMaxY();
    }

    private record Candidate(int index, Subpath subpath, Envelope envelope, double area) {}
}
