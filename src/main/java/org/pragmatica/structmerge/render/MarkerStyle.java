package org.pragmatica.structmerge.render;

/**
 * Appearance of conflict marker blocks.
 *
 * @param size      number of marker characters on each marker line
 * @param diff3     whether the base content is shown between the left and right content
 * @param leftName  label of the left revision
 * @param baseName  label of the base revision
 * @param rightName label of the right revision
 */
public record MarkerStyle(int size, boolean diff3, String leftName, String baseName, String rightName) {
    public static final MarkerStyle DEFAULT = new MarkerStyle(7, true, "LEFT", "BASE", "RIGHT");

    public MarkerStyle {
        if (size < 1) {
            throw new IllegalArgumentException("Marker size must be positive, got " + size);
        }
    }

    public String leftMarker() {
        return labelled('<', leftName);
    }

    public String baseMarker() {
        return labelled('|', baseName);
    }

    public String separatorMarker() {
        return String.valueOf('=').repeat(size);
    }

    public String rightMarker() {
        return labelled('>', rightName);
    }

    private String labelled(char marker, String name) {
        var line = String.valueOf(marker).repeat(size);
        return name.isEmpty() ? line : line + " " + name;
    }
}
