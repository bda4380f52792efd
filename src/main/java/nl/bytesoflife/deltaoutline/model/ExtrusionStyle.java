package nl.bytesoflife.deltaoutline.model;

/**
 * How an extruded outline is placed on the host model.
 * Travels with the profiles as a hint for the solid modeler; not interpreted here.
 */
public enum ExtrusionStyle {
    RAISED,
    ENGRAVED,
    CUTOUT;

    public static ExtrusionStyle fromName(String name) {
        if (name == null) return RAISED;
        return switch (name.trim().toLowerCase()) {
            case "engraved" -> ENGRAVED;
            case "cutout" -> CUTOUT;
            default -> RAISED;
        };
    }
}
