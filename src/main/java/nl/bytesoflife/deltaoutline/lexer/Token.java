package nl.bytesoflife.deltaoutline.lexer;

/**
 * A single path-data token: one command letter or one numeric literal.
 *
 * @param position character offset of the token in the tokenized string
 */
public record Token(TokenType type, String text, double value, int position) {

    public static Token command(char letter, int position) {
        return new Token(TokenType.COMMAND, String.valueOf(letter), Double.NaN, position);
    }

    public static Token number(String text, int position) {
        return new Token(TokenType.NUMBER, text, Double.parseDouble(text), position);
    }

    public boolean isCommand() {
        return type == TokenType.COMMAND;
    }

    public boolean isNumber() {
        return type == TokenType.NUMBER;
    }

    public char letter() {
        if (type != TokenType.COMMAND) {
            throw new IllegalStateException("Not a command token: " + text);
        }
        return text.charAt(0);
    }

    @Override
    public String toString() {
        return text;
    }
}
