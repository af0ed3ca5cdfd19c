package ai.keynav.blocks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Editing surface holding top-level block stacks and comments. The order of {@link #getTopItems()} is the document
 * order used by keyboard navigation.
 *
 * <p>Not thread-safe; all access is expected from the UI thread.
 */
public class Workspace implements FocusableNode {
    private static final Logger logger = LogManager.getLogger(Workspace.class);

    private final String id;
    private final @Nullable Workspace targetWorkspace;
    private final List<FocusableNode> topItems = new ArrayList<>();
    private final Map<String, Block> blocksById = new LinkedHashMap<>();
    private final List<Runnable> chaffListeners = new ArrayList<>();
    private int idCounter;

    private boolean readOnly;
    private boolean dragging;
    private boolean rendered = true;
    private UndoHistory undoHistory = UndoHistory.NONE;
    private AudioFeedback audio = AudioFeedback.SILENT;
    private @Nullable BlockDeletionObserver deletionObserver;
    private Rect viewMetrics = new Rect(0, 600, 0, 800);

    public Workspace(String id) {
        this(id, null);
    }

    private Workspace(String id, @Nullable Workspace targetWorkspace) {
        this.id = id;
        this.targetWorkspace = targetWorkspace;
    }

    /** Creates a palette workspace whose blocks are meant to be dragged into {@code target}. */
    public static Workspace flyout(String id, Workspace target) {
        var flyout = new Workspace(id, target);
        flyout.readOnly = true;
        return flyout;
    }

    @Override
    public String getFocusableId() {
        return id;
    }

    @Override
    public Workspace getWorkspace() {
        return this;
    }

    // ---------- content ----------

    public Block newBlock(String type) {
        String blockId;
        do {
            blockId = type + "_" + ++idCounter;
        } while (blocksById.containsKey(blockId));
        return newBlock(type, blockId);
    }

    /** @throws IllegalArgumentException if a live block with this id already exists */
    public Block newBlock(String type, String blockId) {
        var existing = blocksById.get(blockId);
        if (existing != null && !existing.isDisposed()) {
            throw new IllegalArgumentException("Duplicate block id " + blockId);
        }
        var block = new Block(this, blockId, type);
        blocksById.put(blockId, block);
        topItems.add(block);
        return block;
    }

    public WorkspaceComment newComment(String text) {
        var comment = new WorkspaceComment(this, "comment_" + ++idCounter, text);
        topItems.add(comment);
        return comment;
    }

    public List<FocusableNode> getTopItems() {
        return Collections.unmodifiableList(topItems);
    }

    public List<Block> getTopBlocks() {
        return topItems.stream()
                .filter(Block.class::isInstance)
                .map(Block.class::cast)
                .collect(Collectors.toList());
    }

    /** Every live block, top stacks in document order and each stack in pre-order. */
    public List<Block> getAllBlocks() {
        var result = new ArrayList<Block>();
        for (var top : getTopBlocks()) {
            result.addAll(top.getDescendants());
        }
        return result;
    }

    public @Nullable Block getBlockById(String blockId) {
        var block = blocksById.get(blockId);
        return block == null || block.isDisposed() ? null : block;
    }

    void addTopItem(FocusableNode item) {
        if (!containsTopItem(item)) {
            topItems.add(item);
        }
    }

    void removeTopItem(FocusableNode item) {
        int index = indexOfTopItem(item);
        if (index >= 0) {
            topItems.remove(index);
        }
    }

    /** Identity-based index of a top item, or -1. */
    int indexOfTopItem(FocusableNode item) {
        for (int i = 0; i < topItems.size(); i++) {
            if (topItems.get(i) == item) {
                return i;
            }
        }
        return -1;
    }

    void moveTopItem(FocusableNode item, int index) {
        removeTopItem(item);
        if (index < 0 || index > topItems.size()) {
            topItems.add(item);
        } else {
            topItems.add(index, item);
        }
    }

    private boolean containsTopItem(FocusableNode item) {
        return indexOfTopItem(item) >= 0;
    }

    public NodeNavigator getNavigator() {
        return new BlockTreeNavigator(this);
    }

    // ---------- state ----------

    public boolean isReadOnly() {
        return readOnly;
    }

    public void setReadOnly(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public boolean isDragging() {
        return dragging;
    }

    public void setDragging(boolean dragging) {
        this.dragging = dragging;
    }

    public boolean isRendered() {
        return rendered;
    }

    public void setRendered(boolean rendered) {
        this.rendered = rendered;
    }

    public boolean isFlyout() {
        return targetWorkspace != null;
    }

    /** For a flyout, the workspace it feeds; null otherwise. */
    public @Nullable Workspace getTargetWorkspace() {
        return targetWorkspace;
    }

    /** Closes transient UI such as context menus, tooltips and open flyouts. */
    public void hideChaff() {
        chaffListeners.forEach(Runnable::run);
    }

    public void addChaffListener(Runnable listener) {
        chaffListeners.add(listener);
    }

    public void undo(boolean redo) {
        logger.debug("{} on workspace {}", redo ? "Redo" : "Undo", id);
        undoHistory.undo(redo);
    }

    public void setUndoHistory(UndoHistory undoHistory) {
        this.undoHistory = undoHistory;
    }

    public AudioFeedback getAudio() {
        return audio;
    }

    public void setAudio(AudioFeedback audio) {
        this.audio = audio;
    }

    public @Nullable BlockDeletionObserver getDeletionObserver() {
        return deletionObserver;
    }

    public void setDeletionObserver(@Nullable BlockDeletionObserver deletionObserver) {
        this.deletionObserver = deletionObserver;
    }

    /** Visible part of the surface, in workspace coordinates. */
    public Rect getViewMetrics() {
        return viewMetrics;
    }

    public void setViewMetrics(Rect viewMetrics) {
        this.viewMetrics = viewMetrics;
    }

    @Override
    public String toString() {
        return "Workspace[" + id + "]";
    }
}
