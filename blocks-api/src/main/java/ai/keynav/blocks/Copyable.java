package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

/** A node that can be captured onto the clipboard. */
public interface Copyable extends FocusableNode {
    /** Snapshot of this node suitable for pasting later, or null if nothing can be captured. */
    @Nullable
    CopyData toCopyData();
}
