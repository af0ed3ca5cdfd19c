package ai.keynav.shortcuts;

import ai.keynav.blocks.FocusableNode;
import org.jetbrains.annotations.Nullable;

/** What a shortcut acts on: the node focused when the key was pressed. */
public record ShortcutScope(@Nullable FocusableNode focusedNode) {}
