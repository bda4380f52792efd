package nl.bytesoflife.deltaoutline.geometry;

/**
 * Fixed number of line segments used per curve family.
 */
public record FlatteningBudget(int cubicSegments, int quadraticSegments, int arcSegments) {

    public static final FlatteningBudget DEFAULT = new FlatteningBudget(10, 10, 20);

    public FlatteningBudget {
        if (cubicSegments < 1 || quadraticSegments < 1 || arcSegments < 1) {
            throw new IllegalArgumentException(String.format(
                    "Segment counts must be at least 1 (cubic=%d, quadratic=%d, arc=%d)",
                    cubicSegments, quadraticSegments, arcSegments));
        }
    }
}
