package nl.bytesoflife.deltaoutline.geometry;

import nl.bytesoflife.deltaoutline.model.SourceOutline;
import nl.bytesoflife.deltaoutline.model.Subpath;
import nl.bytesoflife.deltaoutline.model.ViewBox;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps source coordinates into the target frame and cleans up the point lists.
 *
 * The larger viewBox extent is scaled to the target size (aspect ratio preserved),
 * the viewBox center moves to the origin and the Y axis is flipped so that it grows upward.
 * Near-duplicate consecutive points and a duplicated closing point are removed; subpaths
 * left with fewer than three points are discarded.
 */
public class OutlineNormalizer {

    private static final Logger log = LoggerFactory.getLogger(OutlineNormalizer.class);

    public static final double DEFAULT_EPSILON = 0.001;

    private final double epsilon;

    public OutlineNormalizer() {
        this(DEFAULT_EPSILON);
    }

    public OutlineNormalizer(double epsilon) {
        if (epsilon < 0) {
            throw new IllegalArgumentException("Epsilon must not be negative: " + epsilon);
        }
        this.epsilon = epsilon;
    }

    public List<Subpath> normalize(SourceOutline outline, double targetSize) {
        return normalize(outline, targetSize, 1.0);
    }

    public List<Subpath> normalize(SourceOutline outline, double targetSize, double userScale) {
        if (targetSize <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + targetSize);
        }
        ViewBox viewBox = outline.viewBox();
        double extent = viewBox.maxExtent();
        if (!(extent > 0)) {
            log.debug("ViewBox {} has no extent, nothing to normalize", viewBox);
            return List.of();
        }

        double scale = targetSize / extent * userScale;
        double centerX = viewBox.centerX();
        double centerY = viewBox.centerY();

        List<Subpath> result = new ArrayList<>();
        for (int i = 0; i < outline.subpaths().size(); i++) {
            Subpath subpath = outline.subpaths().get(i);
            List<Coordinate> transformed = new ArrayList<>(subpath.size());
            for (Coordinate c : subpath.getPoints()) {
                transformed.add(new Coordinate(
                        (c.x - centerX) * scale,
                        -(c.y - centerY) * scale));
            }

            List<Coordinate> cleaned = clean(transformed);
            if (cleaned == null) {
                log.debug("Discarded subpath {} ({} points) after cleanup", i, subpath.size());
                continue;
            }
            result.add(new Subpath(cleaned));
        }
        return result;
    }

    /**
     * Removes near-duplicate consecutive points and the duplicated closing point.
     * Returns null when what remains cannot form a polygon.
     */
    List<Coordinate> clean(List<Coordinate> points) {
        List<Coordinate> deduped = new ArrayList<>(points.size());
        for (Coordinate c : points) {
            if (deduped.isEmpty() || deduped.get(deduped.size() - 1).distance(c) >= epsilon) {
                deduped.add(c);
            }
        }

        if (deduped.size() > 1 && deduped.get(0).distance(deduped.get(deduped.size() - 1)) < epsilon) {
            if (deduped.size() <= 3) {
                // A closed loop of three points has only two distinct vertices
                return null;
            }
            deduped.remove(deduped.size() - 1);
        }

        return deduped.size() < 3 ? null : deduped;
    }

    public double getEpsilon() {
        return epsilon;
    }
}
