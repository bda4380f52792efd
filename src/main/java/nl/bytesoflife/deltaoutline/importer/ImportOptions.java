package nl.bytesoflife.deltaoutline.importer;

import nl.bytesoflife.deltaoutline.geometry.FlatteningBudget;
import nl.bytesoflife.deltaoutline.geometry.OutlineNormalizer;
import nl.bytesoflife.deltaoutline.model.OutlineElement;
import nl.bytesoflife.deltaoutline.parser.PrimitiveShapeExtractor;

/**
 * Tunables for one import. All setters validate and return {@code this}.
 */
public class ImportOptions {

    private double targetSize = 20.0;
    private double userScale = 1.0;
    private double epsilon = OutlineNormalizer.DEFAULT_EPSILON;
    private int cubicSegments = FlatteningBudget.DEFAULT.cubicSegments();
    private int quadraticSegments = FlatteningBudget.DEFAULT.quadraticSegments();
    private int arcSegments = FlatteningBudget.DEFAULT.arcSegments();
    private int ellipseSamples = PrimitiveShapeExtractor.DEFAULT_ELLIPSE_SAMPLES;

    public static ImportOptions defaults() {
        return new ImportOptions();
    }

    /**
     * Options sized for an element: its target size and user scale.
     */
    public static ImportOptions forElement(OutlineElement element) {
        return new ImportOptions()
                .setTargetSize(element.getTargetSize())
                .setUserScale(element.getScale());
    }

    public double getTargetSize() {
        return targetSize;
    }

    /** Length the larger viewBox extent maps to. */
    public ImportOptions setTargetSize(double targetSize) {
        requirePositive("targetSize", targetSize);
        this.targetSize = targetSize;
        return this;
    }

    public double getUserScale() {
        return userScale;
    }

    public ImportOptions setUserScale(double userScale) {
        requirePositive("userScale", userScale);
        this.userScale = userScale;
        return this;
    }

    public double getEpsilon() {
        return epsilon;
    }

    /** Distance below which consecutive points are merged, in target units. */
    public ImportOptions setEpsilon(double epsilon) {
        if (epsilon < 0) {
            throw new IllegalArgumentException("epsilon must not be negative: " + epsilon);
        }
        this.epsilon = epsilon;
        return this;
    }

    public int getCubicSegments() {
        return cubicSegments;
    }

    public ImportOptions setCubicSegments(int cubicSegments) {
        requirePositive("cubicSegments", cubicSegments);
        this.cubicSegments = cubicSegments;
        return this;
    }

    public int getQuadraticSegments() {
        return quadraticSegments;
    }

    public ImportOptions setQuadraticSegments(int quadraticSegments) {
        requirePositive("quadraticSegments", quadraticSegments);
        this.quadraticSegments = quadraticSegments;
        return this;
    }

    public int getArcSegments() {
        return arcSegments;
    }

    public ImportOptions setArcSegments(int arcSegments) {
        requirePositive("arcSegments", arcSegments);
        this.arcSegments = arcSegments;
        return this;
    }

    public int getEllipseSamples() {
        return ellipseSamples;
    }

    public ImportOptions setEllipseSamples(int ellipseSamples) {
        if (ellipseSamples < 3) {
            throw new IllegalArgumentException("ellipseSamples must be at least 3: " + ellipseSamples);
        }
        this.ellipseSamples = ellipseSamples;
        return this;
    }

    public FlatteningBudget toFlatteningBudget() {
        return new FlatteningBudget(cubicSegments, quadraticSegments, arcSegments);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    @Override
    public String toString() {
        return "ImportOptions{targetSize=" + targetSize + ", userScale=" + userScale +
                ", epsilon=" + epsilon + ", segments=" + cubicSegments + "/" + quadraticSegments +
                "/" + arcSegments + ", ellipseSamples=" + ellipseSamples + "}";
    }
}
