package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

/** Single source of truth for which node currently has keyboard focus. */
public interface FocusHolder {
    @Nullable
    FocusableNode getFocusedNode();

    /** Focuses the node. {@link #getFocusedNode()} returns it as soon as this call returns. */
    void focusNode(FocusableNode node);

    /** True while an exclusive edit session (for example an open field editor) owns keyboard input. */
    boolean isEphemeralFocusTaken();
}
