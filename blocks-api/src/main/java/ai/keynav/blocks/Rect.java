package ai.keynav.blocks;

/** Axis-aligned rectangle in workspace coordinates, used for the visible viewport. */
public record Rect(double top, double bottom, double left, double right) {
    public boolean contains(double x, double y) {
        return x >= left && x <= right && y >= top && y <= bottom;
    }

    public Coordinate center() {
        return new Coordinate(left + (right - left) / 2, top + (bottom - top) / 2);
    }
}
