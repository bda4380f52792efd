package nl.bytesoflife.deltaoutline.model;

import nl.bytesoflife.deltaoutline.lexer.PathTokenizer;

import java.util.List;

/**
 * The source document's declared coordinate rectangle.
 */
public record ViewBox(double minX, double minY, double width, double height) {

    public static ViewBox ofSize(double width, double height) {
        return new ViewBox(0, 0, width, height);
    }

    /**
     * Parses a {@code viewBox} attribute ("min-x min-y width height", whitespace
     * and/or comma separated). Returns null when fewer than four numbers are present.
     */
    public static ViewBox parse(String value) {
        if (value == null || value.isBlank()) return null;
        List<Double> numbers = new PathTokenizer().numbers(value);
        if (numbers.size() < 4) return null;
        return new ViewBox(numbers.get(0), numbers.get(1), numbers.get(2), numbers.get(3));
    }

    public double centerX() {
        return minX + width / 2;
    }

    public double centerY() {
        return minY + height / 2;
    }

    public double maxExtent() {
        return Math.max(width, height);
    }
}
