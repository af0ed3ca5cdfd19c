package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

/**
 * Structural view of a workspace used for keyboard navigation. Implementations never wrap around: the first and
 * last child of a parent have no previous and next sibling respectively.
 */
public interface NodeNavigator {
    @Nullable
    FocusableNode getFirstChild(FocusableNode node);

    @Nullable
    FocusableNode getNextSibling(FocusableNode node);

    @Nullable
    FocusableNode getPreviousSibling(FocusableNode node);

    @Nullable
    FocusableNode getParent(FocusableNode node);
}
