package ai.keynav.blocks;

/** A node that can be removed from its workspace. */
public interface Deletable extends FocusableNode {
    /** Whether the node may be deleted right now, taking the workspace's read-only state into account. */
    boolean isDeletable();

    /** Whether the node itself allows deletion, ignoring the state of its workspace. */
    default boolean isOwnDeletable() {
        return isDeletable();
    }

    void dispose();
}
