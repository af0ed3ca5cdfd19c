package ai.keynav.blocks;

/** A node that has a position on the workspace surface and may be moved. */
public interface Draggable extends FocusableNode {
    boolean isMovable();

    /** Whether the node itself allows moving, ignoring the state of its workspace. */
    default boolean isOwnMovable() {
        return isMovable();
    }

    Coordinate getRelativeToSurfaceXY();
}
