package nl.bytesoflife.deltaoutline.parser;

/**
 * Path data that no command can account for, such as numbers before the first
 * command letter or after a closepath.
 */
public class PathGrammarException extends RuntimeException {

    private final String fragment;
    private final int position;

    public PathGrammarException(String message, String fragment, int position) {
        super(message + " at position " + position + ": '" + fragment + "'");
        this.fragment = fragment;
        this.position = position;
    }

    public String getFragment() {
        return fragment;
    }

    public int getPosition() {
        return position;
    }
}
