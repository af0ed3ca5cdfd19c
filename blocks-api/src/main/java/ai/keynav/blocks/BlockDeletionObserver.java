package ai.keynav.blocks;

/**
 * Brackets a deletion on the workspace. One of the {@code preDelete} overloads runs before the block or comment is
 * detached, {@link #postDelete} after it (and, for a block, its children) is disposed.
 */
public interface BlockDeletionObserver {
    void preDelete(Block deletedBlock);

    void preDelete(WorkspaceComment deletedComment);

    void postDelete();
}
