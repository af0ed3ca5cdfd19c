package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

/** Clipboard payload. Knows how to recreate the copied node in a workspace. */
public interface CopyData {
    /**
     * Recreates the copied node.
     *
     * @param location where to place the new node; null lets the payload pick a spot near the original
     * @return the pasted node, or null if nothing could be pasted
     */
    @Nullable
    FocusableNode pasteInto(Workspace workspace, @Nullable Coordinate location);
}
