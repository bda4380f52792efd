package nl.bytesoflife.deltaoutline.parser;

/**
 * Path-data command families. Upper and lower case letters share a family and
 * differ only in whether coordinates are absolute or relative to the current point.
 */
public enum PathCommand {
    MOVE_TO('M', 2),
    LINE_TO('L', 2),
    HORIZONTAL_LINE_TO('H', 1),
    VERTICAL_LINE_TO('V', 1),
    CUBIC_TO('C', 6),
    SMOOTH_CUBIC_TO('S', 4),
    QUADRATIC_TO('Q', 4),
    SMOOTH_QUADRATIC_TO('T', 2),
    ARC_TO('A', 7),
    CLOSE_PATH('Z', 0);

    private final char letter;
    private final int argumentCount;

    PathCommand(char letter, int argumentCount) {
        this.letter = letter;
        this.argumentCount = argumentCount;
    }

    public char getLetter() {
        return letter;
    }

    public int getArgumentCount() {
        return argumentCount;
    }

    public boolean isCubic() {
        return this == CUBIC_TO || this == SMOOTH_CUBIC_TO;
    }

    public boolean isQuadratic() {
        return this == QUADRATIC_TO || this == SMOOTH_QUADRATIC_TO;
    }

    public static PathCommand fromLetter(char letter) {
        return switch (Character.toUpperCase(letter)) {
            case 'M' -> MOVE_TO;
            case 'L' -> LINE_TO;
            case 'H' -> HORIZONTAL_LINE_TO;
            case 'V' -> VERTICAL_LINE_TO;
            case 'C' -> CUBIC_TO;
            case 'S' -> SMOOTH_CUBIC_TO;
            case 'Q' -> QUADRATIC_TO;
            case 'T' -> SMOOTH_QUADRATIC_TO;
            case 'A' -> ARC_TO;
            case 'Z' -> CLOSE_PATH;
            default -> throw new IllegalArgumentException("Unknown path command: " + letter);
        };
    }
}
