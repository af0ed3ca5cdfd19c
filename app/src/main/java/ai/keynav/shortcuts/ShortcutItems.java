package ai.keynav.shortcuts;

import static org.checkerframework.checker.nullness.util.NullnessUtil.castNonNull;

import ai.keynav.blocks.Announcer;
import ai.keynav.blocks.Block;
import ai.keynav.blocks.Clipboard;
import ai.keynav.blocks.Copyable;
import ai.keynav.blocks.CopyabilityAware;
import ai.keynav.blocks.Deletable;
import ai.keynav.blocks.Draggable;
import ai.keynav.blocks.FocusHolder;
import ai.keynav.blocks.FocusableNode;
import ai.keynav.blocks.Workspace;
import ai.keynav.navigation.LineCursor;
import ai.keynav.shortcuts.KeyChord.Modifier;
import java.awt.event.KeyEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** The default editing and navigation shortcuts. */
public class ShortcutItems {
    private static final Logger logger = LogManager.getLogger(ShortcutItems.class);

    private final FocusHolder focusHolder;
    private final Clipboard clipboard;
    private final Announcer announcer;
    private final Function<Workspace, LineCursor> cursors;

    public ShortcutItems(
            FocusHolder focusHolder,
            Clipboard clipboard,
            Announcer announcer,
            Function<Workspace, LineCursor> cursors) {
        this.focusHolder = focusHolder;
        this.clipboard = clipboard;
        this.announcer = announcer;
        this.cursors = cursors;
    }

    public void registerDefaults(ShortcutRegistry registry) {
        registry.register(escape());
        registry.register(delete());
        registry.register(copy());
        registry.register(cut());
        registry.register(paste());
        registry.register(undo());
        registry.register(redo());
        registry.register(readFullBlockSummary());
        registry.register(readBlockParentSummary());
        registry.register(jumpTopOfStack());
        registry.register(jumpBottomOfStack());
        registry.register(jumpBlockStart());
        registry.register(jumpBlockEnd());
        registry.register(jumpFirstBlock());
        registry.register(jumpLastBlock());
        registry.register(navigate(ShortcutNames.NEXT, KeyEvent.VK_DOWN, LineCursor::next));
        registry.register(navigate(ShortcutNames.PREVIOUS, KeyEvent.VK_UP, LineCursor::prev));
        registry.register(navigate(ShortcutNames.IN, KeyEvent.VK_RIGHT, LineCursor::in));
        registry.register(navigate(ShortcutNames.OUT, KeyEvent.VK_LEFT, LineCursor::out));
    }

    // ---------- capability checks ----------

    /**
     * A node is copyable when it can be copied, deleted and dragged. Nodes that know better say so through
     * {@link CopyabilityAware}; for the rest their own flags decide, ignoring whether the workspace is read-only.
     */
    static boolean isCopyable(@Nullable FocusableNode node) {
        if (!(node instanceof Copyable)
                || !(node instanceof Deletable deletable)
                || !(node instanceof Draggable draggable)) {
            return false;
        }
        if (node instanceof CopyabilityAware aware) {
            return aware.isCopyable();
        }
        return deletable.isOwnDeletable() && draggable.isOwnMovable();
    }

    static boolean isCuttable(@Nullable FocusableNode node) {
        return isCopyable(node) && node instanceof Deletable deletable && deletable.isDeletable();
    }

    private boolean isIdle(Workspace workspace) {
        return !workspace.isDragging() && !focusHolder.isEphemeralFocusTaken();
    }

    private boolean focusedNodeHasBlockParent(Workspace workspace) {
        return isIdle(workspace)
                && focusHolder.getFocusedNode() != null
                && cursors.apply(workspace).getSourceBlock() != null;
    }

    private static @Nullable Workspace copyTarget(Workspace workspace) {
        return workspace.isFlyout() ? workspace.getTargetWorkspace() : workspace;
    }

    // ---------- editing ----------

    KeyboardShortcut escape() {
        return KeyboardShortcut.builder(ShortcutNames.ESCAPE)
                .keys(KeyChord.of(KeyEvent.VK_ESCAPE))
                .precondition((workspace, scope) -> !workspace.isReadOnly())
                .callback((workspace, press, shortcut, scope) -> {
                    workspace.hideChaff();
                    return true;
                })
                .build();
    }

    KeyboardShortcut delete() {
        return KeyboardShortcut.builder(ShortcutNames.DELETE)
                .keys(KeyChord.of(KeyEvent.VK_DELETE), KeyChord.of(KeyEvent.VK_BACK_SPACE))
                .precondition((workspace, scope) -> !workspace.isReadOnly()
                        && scope.focusedNode() instanceof Deletable deletable
                        && deletable.isDeletable()
                        && isIdle(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    // before deleting, so a failure below cannot let the key fall through to the host
                    press.preventDefault();
                    var focused = scope.focusedNode();
                    if (focused instanceof Block block) {
                        block.checkAndDelete();
                    } else if (focused instanceof Deletable deletable && deletable.isDeletable()) {
                        deletable.dispose();
                    }
                    return true;
                })
                .build();
    }

    KeyboardShortcut copy() {
        return KeyboardShortcut.builder(ShortcutNames.COPY)
                .keys(KeyChord.of(KeyEvent.VK_C, Modifier.CONTROL), KeyChord.of(KeyEvent.VK_C, Modifier.META))
                .precondition((workspace, scope) -> {
                    var target = copyTarget(workspace);
                    return scope.focusedNode() != null
                            && target != null
                            && !target.isDragging()
                            && !focusHolder.isEphemeralFocusTaken()
                            && isCopyable(scope.focusedNode());
                })
                .callback((workspace, press, shortcut, scope) -> {
                    press.preventDefault();
                    var focused = scope.focusedNode();
                    var target = copyTarget(workspace);
                    if (!isCopyable(focused) || target == null) {
                        return false;
                    }
                    if (!focused.getWorkspace().isFlyout()) {
                        target.hideChaff();
                    }
                    var coords = focused instanceof Draggable draggable && focused.getWorkspace() == target
                            ? draggable.getRelativeToSurfaceXY()
                            : null;
                    return clipboard.copy((Copyable) focused, coords) != null;
                })
                .build();
    }

    KeyboardShortcut cut() {
        return KeyboardShortcut.builder(ShortcutNames.CUT)
                .keys(KeyChord.of(KeyEvent.VK_X, Modifier.CONTROL), KeyChord.of(KeyEvent.VK_X, Modifier.META))
                .precondition((workspace, scope) -> scope.focusedNode() != null
                        && !workspace.isReadOnly()
                        && isIdle(workspace)
                        && isCuttable(scope.focusedNode()))
                .callback((workspace, press, shortcut, scope) -> {
                    var focused = scope.focusedNode();
                    if (!isCuttable(focused)) {
                        return false;
                    }
                    var coords = focused instanceof Draggable draggable ? draggable.getRelativeToSurfaceXY() : null;
                    var copyData = clipboard.copy((Copyable) focused, coords);
                    if (focused instanceof Block block) {
                        block.checkAndDelete();
                    } else {
                        ((Deletable) focused).dispose();
                    }
                    return copyData != null;
                })
                .build();
    }

    /** Pastes into the workspace the clipboard content came from, whichever workspace has focus. */
    KeyboardShortcut paste() {
        return KeyboardShortcut.builder(ShortcutNames.PASTE)
                .keys(KeyChord.of(KeyEvent.VK_V, Modifier.CONTROL), KeyChord.of(KeyEvent.VK_V, Modifier.META))
                .precondition((workspace, scope) -> {
                    var copyWorkspace = clipboard.getLastCopiedWorkspace();
                    if (copyWorkspace == null || !copyWorkspace.isRendered()) {
                        return false;
                    }
                    var target = copyTarget(copyWorkspace);
                    return clipboard.getLastCopiedData() != null
                            && target != null
                            && !target.isReadOnly()
                            && !target.isDragging()
                            && !focusHolder.isEphemeralFocusTaken();
                })
                .callback((workspace, press, shortcut, scope) -> {
                    var copyData = clipboard.getLastCopiedData();
                    var copyWorkspace = clipboard.getLastCopiedWorkspace();
                    if (copyData == null || copyWorkspace == null) {
                        return false;
                    }
                    var target = copyTarget(copyWorkspace);
                    if (target == null || target.isReadOnly()) {
                        return false;
                    }
                    FocusableNode pasted;
                    var pointer = press.pointerLocation();
                    var copyCoords = clipboard.getLastCopiedLocation();
                    var viewport = target.getViewMetrics();
                    if (pointer != null) {
                        pasted = clipboard.paste(copyData, target, pointer);
                    } else if (copyCoords == null || viewport.contains(copyCoords.x(), copyCoords.y())) {
                        pasted = clipboard.paste(copyData, target);
                    } else {
                        pasted = clipboard.paste(copyData, target, viewport.center());
                    }
                    if (pasted == null) {
                        return false;
                    }
                    focusHolder.focusNode(pasted);
                    return true;
                })
                .build();
    }

    KeyboardShortcut undo() {
        return KeyboardShortcut.builder(ShortcutNames.UNDO)
                .keys(KeyChord.of(KeyEvent.VK_Z, Modifier.CONTROL), KeyChord.of(KeyEvent.VK_Z, Modifier.META))
                .precondition((workspace, scope) -> !workspace.isReadOnly() && isIdle(workspace))
                .callback((workspace, press, shortcut, scope) -> replayHistory(workspace, press, false))
                .build();
    }

    KeyboardShortcut redo() {
        return KeyboardShortcut.builder(ShortcutNames.REDO)
                .keys(
                        KeyChord.of(KeyEvent.VK_Z, Modifier.CONTROL, Modifier.SHIFT),
                        KeyChord.of(KeyEvent.VK_Z, Modifier.META, Modifier.SHIFT),
                        // Ctrl+Y only; Cmd+Y is not redo on macOS
                        KeyChord.of(KeyEvent.VK_Y, Modifier.CONTROL))
                .precondition((workspace, scope) -> !workspace.isReadOnly() && isIdle(workspace))
                .callback((workspace, press, shortcut, scope) -> replayHistory(workspace, press, true))
                .build();
    }

    private static boolean replayHistory(Workspace workspace, KeyPress press, boolean redo) {
        workspace.hideChaff();
        workspace.undo(redo);
        press.preventDefault();
        return true;
    }

    // ---------- screen reader summaries ----------

    KeyboardShortcut readFullBlockSummary() {
        return KeyboardShortcut.builder(ShortcutNames.READ_FULL_BLOCK_SUMMARY)
                .keys(KeyChord.of(KeyEvent.VK_I))
                .precondition((workspace, scope) -> focusedNodeHasBlockParent(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var block = cursors.apply(workspace).getSourceBlock();
                    if (block == null) {
                        return false;
                    }
                    announcer.announce("Current block: " + block.computeLabel(true));
                    press.preventDefault();
                    return true;
                })
                .build();
    }

    KeyboardShortcut readBlockParentSummary() {
        return KeyboardShortcut.builder(ShortcutNames.READ_BLOCK_PARENT_SUMMARY)
                .keys(KeyChord.of(KeyEvent.VK_I, Modifier.SHIFT))
                .precondition((workspace, scope) -> focusedNodeHasBlockParent(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var block = cursors.apply(workspace).getSourceBlock();
                    if (block == null) {
                        return false;
                    }
                    announcer.announce(parentSummary(block));
                    press.preventDefault();
                    return true;
                })
                .build();
    }

    static String parentSummary(Block selected) {
        var parts = new ArrayList<String>();
        // value blocks are read as part of the block they plug into, so start from the outermost one
        var start = selected;
        while (isPluggedIn(start)) {
            start = castNonNull(start.getParent());
        }
        if (start != selected) {
            parts.add(start.computeLabel(false));
        }
        for (var parent = start.getParent(); parent != null; parent = parent.getParent()) {
            parts.add(parent.computeLabel(false));
        }
        if (parts.isEmpty()) {
            return "Current block has no parent";
        }
        Collections.reverse(parts);
        if (!isPluggedIn(selected)) {
            parts.add("Current block: " + selected.computeLabel(false));
        }
        return "Parent blocks: " + String.join(",", parts);
    }

    private static boolean isPluggedIn(Block block) {
        var output = block.getOutputConnection();
        return output != null && output.isConnected();
    }

    // ---------- jumps ----------

    private boolean canJumpWithinBlock(Workspace workspace) {
        return !workspace.isFlyout() && focusedNodeHasBlockParent(workspace);
    }

    KeyboardShortcut jumpBlockStart() {
        return KeyboardShortcut.builder(ShortcutNames.JUMP_BLOCK_START)
                .keys(KeyChord.of(KeyEvent.VK_HOME))
                .precondition((workspace, scope) -> canJumpWithinBlock(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var block = cursors.apply(workspace).getSourceBlock();
                    if (block == null) {
                        return false;
                    }
                    focusHolder.focusNode(block);
                    return true;
                })
                .build();
    }

    KeyboardShortcut jumpBlockEnd() {
        return KeyboardShortcut.builder(ShortcutNames.JUMP_BLOCK_END)
                .keys(KeyChord.of(KeyEvent.VK_END))
                .precondition((workspace, scope) -> canJumpWithinBlock(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var block = cursors.apply(workspace).getSourceBlock();
                    if (block == null || block.getInputList().isEmpty()) {
                        return false;
                    }
                    var inputs = block.getInputList();
                    var connection = inputs.get(inputs.size() - 1).getConnection();
                    if (connection == null) {
                        return false;
                    }
                    focusHolder.focusNode(connection);
                    return true;
                })
                .build();
    }

    KeyboardShortcut jumpTopOfStack() {
        return KeyboardShortcut.builder(ShortcutNames.JUMP_TOP_STACK)
                .keys(KeyChord.of(KeyEvent.VK_PAGE_UP))
                .precondition((workspace, scope) -> canJumpWithinBlock(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var block = cursors.apply(workspace).getSourceBlock();
                    if (block == null) {
                        return false;
                    }
                    focusHolder.focusNode(block.getRootBlock());
                    return true;
                })
                .build();
    }

    /** Focuses the last descendant of the last block in the root stack. */
    KeyboardShortcut jumpBottomOfStack() {
        return KeyboardShortcut.builder(ShortcutNames.JUMP_BOTTOM_STACK)
                .keys(KeyChord.of(KeyEvent.VK_PAGE_DOWN))
                .precondition((workspace, scope) -> canJumpWithinBlock(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var block = cursors.apply(workspace).getSourceBlock();
                    if (block == null) {
                        return false;
                    }
                    var lastConnection = block.getRootBlock().lastConnectionInStack();
                    if (lastConnection == null) {
                        return false;
                    }
                    var descendants = lastConnection.getSourceBlock().getDescendants();
                    focusHolder.focusNode(descendants.get(descendants.size() - 1));
                    return true;
                })
                .build();
    }

    KeyboardShortcut jumpFirstBlock() {
        return KeyboardShortcut.builder(ShortcutNames.JUMP_FIRST_BLOCK)
                .keys(
                        KeyChord.of(KeyEvent.VK_HOME, Modifier.CONTROL),
                        KeyChord.of(KeyEvent.VK_HOME, Modifier.META))
                .precondition((workspace, scope) -> isIdle(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var topBlocks = workspace.getTopBlocks();
                    if (topBlocks.isEmpty()) {
                        return false;
                    }
                    focusHolder.focusNode(topBlocks.get(0));
                    return true;
                })
                .build();
    }

    KeyboardShortcut jumpLastBlock() {
        return KeyboardShortcut.builder(ShortcutNames.JUMP_LAST_BLOCK)
                .keys(
                        KeyChord.of(KeyEvent.VK_END, Modifier.CONTROL),
                        KeyChord.of(KeyEvent.VK_END, Modifier.META))
                .precondition((workspace, scope) -> isIdle(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var allBlocks = workspace.getAllBlocks();
                    if (allBlocks.isEmpty()) {
                        return false;
                    }
                    focusHolder.focusNode(allBlocks.get(allBlocks.size() - 1));
                    return true;
                })
                .build();
    }

    // ---------- cursor movement ----------

    KeyboardShortcut navigate(String name, int keyCode, Function<LineCursor, @Nullable FocusableNode> move) {
        return KeyboardShortcut.builder(name)
                .keys(KeyChord.of(keyCode))
                .precondition((workspace, scope) -> scope.focusedNode() != null && isIdle(workspace))
                .callback((workspace, press, shortcut, scope) -> {
                    var moved = move.apply(cursors.apply(workspace));
                    if (moved == null) {
                        logger.debug("{}: no node to move to", name);
                    }
                    press.preventDefault();
                    return true;
                })
                .build();
    }
}
