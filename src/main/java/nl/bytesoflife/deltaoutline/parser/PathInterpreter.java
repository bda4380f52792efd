package nl.bytesoflife.deltaoutline.parser;

import nl.bytesoflife.deltaoutline.geometry.CurveFlattener;
import nl.bytesoflife.deltaoutline.geometry.FlattenResult;
import nl.bytesoflife.deltaoutline.geometry.FlatteningBudget;
import nl.bytesoflife.deltaoutline.lexer.PathTokenizer;
import nl.bytesoflife.deltaoutline.lexer.Token;
import nl.bytesoflife.deltaoutline.model.Subpath;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Interprets SVG path data into flattened subpaths.
 * Supports M, L, H, V, C, S, Q, T, A and Z (and their lowercase relatives).
 */
public class PathInterpreter {

    private static final Logger log = LoggerFactory.getLogger(PathInterpreter.class);

    private static final double[] NO_ARGS = new double[0];

    private final PathTokenizer tokenizer = new PathTokenizer();
    private final FlatteningBudget budget;

    public PathInterpreter() {
        this(FlatteningBudget.DEFAULT);
    }

    public PathInterpreter(FlatteningBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    public List<Subpath> interpret(String pathData) {
        return interpret(tokenizer.tokenize(pathData));
    }

    public List<Subpath> interpret(List<Token> tokens) {
        SubpathCollector out = new SubpathCollector();
        ParseState state = ParseState.initial();

        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (!token.isCommand()) {
                throw new PathGrammarException("Numeric data without a command",
                        fragment(tokens, i), token.position());
            }
            char letter = token.letter();
            PathCommand command = PathCommand.fromLetter(letter);
            boolean relative = Character.isLowerCase(letter);
            i++;

            if (command == PathCommand.CLOSE_PATH) {
                state = apply(state, command, relative, NO_ARGS, out);
                if (i < tokens.size() && tokens.get(i).isNumber()) {
                    throw new PathGrammarException("Closepath takes no arguments",
                            fragment(tokens, i), tokens.get(i).position());
                }
                continue;
            }

            int argc = command.getArgumentCount();
            int end = skipNumbers(tokens, i);
            List<Token> numbers = tokens.subList(i, end);
            if (command == PathCommand.ARC_TO) {
                numbers = splitArcFlags(numbers);
            }
            i = end;

            int groups = numbers.size() / argc;
            for (int g = 0; g < groups; g++) {
                double[] args = new double[argc];
                for (int a = 0; a < argc; a++) {
                    args[a] = numbers.get(g * argc + a).value();
                }
                // Pairs after the first moveto pair are implicit lineto
                PathCommand effective = command == PathCommand.MOVE_TO && g > 0
                        ? PathCommand.LINE_TO : command;
                state = apply(state, effective, relative, args, out);
            }
            int dropped = numbers.size() - groups * argc;
            if (dropped > 0) {
                log.debug("Dropping {} trailing argument(s) of '{}' at position {}",
                        dropped, letter, numbers.get(groups * argc).position());
            }
        }

        out.finish();
        return out.subpaths();
    }

    /**
     * Executes one command with one argument group and returns the resulting state.
     * Points are written to {@code out}.
     */
    public ParseState apply(ParseState state, PathCommand command, boolean relative,
                            double[] args, SubpathCollector out) {
        Coordinate cur = state.current();

        switch (command) {
            case MOVE_TO -> {
                Coordinate p = point(cur, relative, args[0], args[1]);
                out.begin(p);
                return state.movedTo(p);
            }
            case LINE_TO -> {
                Coordinate p = point(cur, relative, args[0], args[1]);
                out.ensureOpen(cur);
                out.add(p);
                return state.lineTo(p, command);
            }
            case HORIZONTAL_LINE_TO -> {
                Coordinate p = new Coordinate(relative ? cur.x + args[0] : args[0], cur.y);
                out.ensureOpen(cur);
                out.add(p);
                return state.lineTo(p, command);
            }
            case VERTICAL_LINE_TO -> {
                Coordinate p = new Coordinate(cur.x, relative ? cur.y + args[0] : args[0]);
                out.ensureOpen(cur);
                out.add(p);
                return state.lineTo(p, command);
            }
            case CUBIC_TO -> {
                Coordinate c1 = point(cur, relative, args[0], args[1]);
                Coordinate c2 = point(cur, relative, args[2], args[3]);
                Coordinate p = point(cur, relative, args[4], args[5]);
                appendCurve(out, cur, CurveFlattener.cubic(cur, c1, c2, p, budget.cubicSegments()));
                return state.curveTo(p, c2, command);
            }
            case SMOOTH_CUBIC_TO -> {
                Coordinate c1 = state.reflectedControl(true);
                Coordinate c2 = point(cur, relative, args[0], args[1]);
                Coordinate p = point(cur, relative, args[2], args[3]);
                appendCurve(out, cur, CurveFlattener.cubic(cur, c1, c2, p, budget.cubicSegments()));
                return state.curveTo(p, c2, command);
            }
            case QUADRATIC_TO -> {
                Coordinate c = point(cur, relative, args[0], args[1]);
                Coordinate p = point(cur, relative, args[2], args[3]);
                appendCurve(out, cur, CurveFlattener.quadratic(cur, c, p, budget.quadraticSegments()));
                return state.curveTo(p, c, command);
            }
            case SMOOTH_QUADRATIC_TO -> {
                Coordinate c = state.reflectedControl(false);
                Coordinate p = point(cur, relative, args[0], args[1]);
                appendCurve(out, cur, CurveFlattener.quadratic(cur, c, p, budget.quadraticSegments()));
                return state.curveTo(p, c, command);
            }
            case ARC_TO -> {
                Coordinate p = point(cur, relative, args[5], args[6]);
                FlattenResult result = CurveFlattener.arc(cur, args[0], args[1], args[2],
                        args[3] != 0, args[4] != 0, p, budget.arcSegments());
                if (result instanceof FlattenResult.Degenerate degenerate) {
                    log.debug("Arc to ({}, {}) replaced by a straight line: {}", p.x, p.y, degenerate.reason());
                }
                appendCurve(out, cur, result.points());
                return state.lineTo(p, command);
            }
            case CLOSE_PATH -> {
                if (out.isOpen()) {
                    Coordinate last = out.lastPoint();
                    Coordinate start = state.subpathStart();
                    if (last.x != start.x || last.y != start.y) {
                        out.add(start);
                    }
                    out.finish();
                }
                return state.closed();
            }
            default -> throw new IllegalStateException("Unhandled command " + command);
        }
    }

    private void appendCurve(SubpathCollector out, Coordinate current, List<Coordinate> samples) {
        out.ensureOpen(current);
        out.addSamples(samples);
    }

    private static Coordinate point(Coordinate current, boolean relative, double x, double y) {
        return relative ? new Coordinate(current.x + x, current.y + y) : new Coordinate(x, y);
    }

    /**
     * Arc flags are single characters and may be written without separators
     * ({@code a5 5 0 0010 0}). Splits such literals so that every flag slot
     * holds one digit.
     */
    private static List<Token> splitArcFlags(List<Token> numbers) {
        List<Token> result = new ArrayList<>(numbers.size() + 2);
        Deque<Token> pending = new ArrayDeque<>(numbers);
        while (!pending.isEmpty()) {
            Token token = pending.poll();
            int slot = result.size() % 7;
            boolean flagSlot = slot == 3 || slot == 4;
            String text = token.text();
            if (flagSlot && text.length() > 1 && (text.charAt(0) == '0' || text.charAt(0) == '1')) {
                result.add(Token.number(text.substring(0, 1), token.position()));
                pending.push(remainder(text.substring(1), token.position() + 1));
                continue;
            }
            if (flagSlot && token.value() != 0 && token.value() != 1) {
                log.debug("Arc flag '{}' at position {} is neither 0 nor 1", text, token.position());
            }
            result.add(token);
        }
        return result;
    }

    private static Token remainder(String text, int position) {
        try {
            return Token.number(text, position);
        } catch (NumberFormatException e) {
            throw new PathGrammarException("Malformed arc flags", text, position);
        }
    }

    private static int skipNumbers(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).isNumber()) {
            i++;
        }
        return i;
    }

    private static String fragment(List<Token> tokens, int from) {
        StringBuilder sb = new StringBuilder();
        int end = skipNumbers(tokens, from);
        for (int i = from; i < end; i++) {
            if (i > from) sb.append(' ');
            sb.append(tokens.get(i).text());
        }
        return sb.toString();
    }
}
