package nl.bytesoflife.deltaoutline.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer for SVG path data.
 * Splits a {@code d} attribute into command letters and numeric literals.
 */
public class PathTokenizer {

    private static final String COMMAND_LETTERS = "MmLlHhVvCcSsQqTtAaZz";

    // Greedy on the integer part, a single decimal point, optional exponent.
    // "1.5.5" stops after "1.5" and the next match starts at ".5".
    private static final Pattern NUMBER = Pattern.compile(
        "[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?"
    );

    public List<Token> tokenize(String content) {
        List<Token> tokens = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return tokens;
        }

        Matcher matcher = NUMBER.matcher(content);
        int pos = 0;
        while (pos < content.length()) {
            char c = content.charAt(pos);

            if (COMMAND_LETTERS.indexOf(c) >= 0) {
                tokens.add(Token.command(c, pos));
                pos++;
                continue;
            }

            if (c == '+' || c == '-' || c == '.' || Character.isDigit(c)) {
                matcher.region(pos, content.length());
                if (matcher.lookingAt()) {
                    tokens.add(Token.number(matcher.group(), pos));
                    pos = matcher.end();
                    continue;
                }
            }

            // Whitespace, commas and anything unrecognized
            pos++;
        }

        return tokens;
    }

    /**
     * Reads only the numeric literals of a string, ignoring command letters.
     * Used for attribute lists such as {@code points} and {@code viewBox}.
     */
    public List<Double> numbers(String content) {
        List<Double> values = new ArrayList<>();
        for (Token token : tokenize(content)) {
            if (token.isNumber()) {
                values.add(token.value());
            }
        }
        return values;
    }
}
