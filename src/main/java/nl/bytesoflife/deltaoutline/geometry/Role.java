package nl.bytesoflife.deltaoutline.geometry;

/**
 * Role of a subpath in the composed outline.
 * FILL adds material, HOLE removes material.
 */
public enum Role {
    FILL,
    HOLE;

    public static Role forLevel(int level) {
        return level % 2 == 0 ? FILL : HOLE;
    }
}
