package nl.bytesoflife.deltaoutline.importer;

import java.util.Locale;

/**
 * A path that could not be interpreted.
 *
 * @param pathIndex index of the path-data string within its source
 * @param position  character offset of the offending fragment
 */
public record ImportIssue(int pathIndex, String fragment, int position, String message) {

    @Override
    public String toString() {
        return String.format(Locale.US, "path #%d at %d: %s", pathIndex, position, message);
    }
}
