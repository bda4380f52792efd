package nl.bytesoflife.deltaoutline.parser;

import nl.bytesoflife.deltaoutline.model.Subpath;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output accumulator for one path-data string: the subpath being drawn and
 * those already finished.
 */
public final class SubpathCollector {

    private final List<Subpath> completed = new ArrayList<>();
    private List<Coordinate> open = new ArrayList<>();

    public void begin(Coordinate start) {
        finish();
        open.add(start);
    }

    /** Starts a subpath at {@code at} when a drawing command arrives with none open. */
    public void ensureOpen(Coordinate at) {
        if (open.isEmpty()) {
            open.add(at);
        }
    }

    public void add(Coordinate point) {
        open.add(point);
    }

    /** Appends curve samples, skipping the first one which repeats the current point. */
    public void addSamples(List<Coordinate> samples) {
        for (int i = 1; i < samples.size(); i++) {
            open.add(samples.get(i));
        }
    }

    public boolean isOpen() {
        return !open.isEmpty();
    }

    public Coordinate lastPoint() {
        return open.isEmpty() ? null : open.get(open.size() - 1);
    }

    public void finish() {
        if (!open.isEmpty()) {
            completed.add(new Subpath(open));
            open = new ArrayList<>();
        }
    }

    public List<Subpath> subpaths() {
        return Collections.unmodifiableList(completed);
    }
}
