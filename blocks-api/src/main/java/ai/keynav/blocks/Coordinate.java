package ai.keynav.blocks;

/** A point in workspace coordinates. */
public record Coordinate(double x, double y) {
    public static final Coordinate ORIGIN = new Coordinate(0, 0);

    public Coordinate translate(double dx, double dy) {
        return new Coordinate(x + dx, y + dy);
    }
}
