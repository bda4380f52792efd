package nl.bytesoflife.deltaoutline.parser;

import org.locationtech.jts.geom.Coordinate;

/**
 * Cursor state between two path commands. Each command produces a new state.
 * Coordinates are copied on the way in and out, so a state never shares points
 * with its caller.
 *
 * @param lastControl last control point of the previous curve command, or null
 * @param lastCommand family of the previous command, or null before the first one
 */
public record ParseState(Coordinate current, Coordinate subpathStart,
                         Coordinate lastControl, PathCommand lastCommand) {

    public ParseState {
        current = copy(current);
        subpathStart = copy(subpathStart);
        lastControl = copy(lastControl);
    }

    public static ParseState initial() {
        return new ParseState(new Coordinate(0, 0), new Coordinate(0, 0), null, null);
    }

    @Override
    public Coordinate current() {
        return copy(current);
    }

    @Override
    public Coordinate subpathStart() {
        return copy(subpathStart);
    }

    @Override
    public Coordinate lastControl() {
        return copy(lastControl);
    }

    public ParseState movedTo(Coordinate point) {
        return new ParseState(point, point, null, PathCommand.MOVE_TO);
    }

    public ParseState lineTo(Coordinate point, PathCommand command) {
        return new ParseState(point, subpathStart, null, command);
    }

    public ParseState curveTo(Coordinate point, Coordinate control, PathCommand command) {
        return new ParseState(point, subpathStart, control, command);
    }

    public ParseState closed() {
        return new ParseState(subpathStart, subpathStart, null, PathCommand.CLOSE_PATH);
    }

    /**
     * Control point mirrored about the current point, used by S and T.
     * Falls back to the current point when the previous command was not of the same family.
     */
    public Coordinate reflectedControl(boolean cubic) {
        boolean chained = lastCommand != null && lastControl != null
                && (cubic ? lastCommand.isCubic() : lastCommand.isQuadratic());
        if (!chained) {
            return copy(current);
        }
        return new Coordinate(2 * current.x - lastControl.x, 2 * current.y - lastControl.y);
    }

    private static Coordinate copy(Coordinate c) {
        return c == null ? null : new Coordinate(c.x, c.y);
    }
}
