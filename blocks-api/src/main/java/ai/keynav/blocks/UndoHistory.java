package ai.keynav.blocks;

/** Replays the workspace's edit history. */
@FunctionalInterface
public interface UndoHistory {
    UndoHistory NONE = redo -> {};

    void undo(boolean redo);
}
