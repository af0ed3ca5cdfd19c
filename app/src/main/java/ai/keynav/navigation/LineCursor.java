package ai.keynav.navigation;

import ai.keynav.blocks.Block;
import ai.keynav.blocks.BlockDeletionObserver;
import ai.keynav.blocks.FocusHolder;
import ai.keynav.blocks.FocusableNode;
import ai.keynav.blocks.Nodes;
import ai.keynav.blocks.Workspace;
import ai.keynav.blocks.WorkspaceComment;
import ai.keynav.exception.CursorStateException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Cursor that moves through a workspace as if its blocks were lines of code. {@link #next()} and {@link #prev()}
 * move between lines, {@link #in()} and {@link #out()} step through every node including fields and inputs.
 *
 * <p>The cursor keeps no position of its own: the focused node of the {@link FocusHolder} is the current position.
 * It also observes deletions so that focus lands somewhere sensible when the focused block or comment disappears.
 */
public class LineCursor implements BlockDeletionObserver {
    private static final Logger logger = LogManager.getLogger(LineCursor.class);

    static final int BASE_TONE_HZ = 400;
    static final int TONE_STEP_HZ = 40;

    private final Workspace workspace;
    private final FocusHolder focusHolder;
    private final NodeTraversal traversal;
    private boolean navigationLoops = true;
    private RecoveryState recovery = new RecoveryState.Idle();

    /** Deletion bookkeeping: between preDelete and postDelete the cursor holds the places it may fall back to. */
    sealed interface RecoveryState permits RecoveryState.Idle, RecoveryState.Pending {
        record Idle() implements RecoveryState {}

        record Pending(List<FocusableNode> candidates) implements RecoveryState {}
    }

    public LineCursor(Workspace workspace, FocusHolder focusHolder) {
        this.workspace = workspace;
        this.focusHolder = focusHolder;
        this.traversal = new NodeTraversal(workspace.getNavigator(), workspace);
    }

    public @Nullable FocusableNode next() {
        return move(NavigationDirection.NEXT);
    }

    public @Nullable FocusableNode prev() {
        return move(NavigationDirection.PREVIOUS);
    }

    public @Nullable FocusableNode in() {
        return move(NavigationDirection.IN);
    }

    public @Nullable FocusableNode out() {
        return move(NavigationDirection.OUT);
    }

    private @Nullable FocusableNode move(NavigationDirection direction) {
        var curNode = getCurNode();
        if (curNode == null) {
            return null;
        }
        var newNode = find(curNode, direction, navigationLoops);
        if (newNode != null) {
            setCurNode(newNode);
        }
        logger.debug(
                "{} from {} -> {}",
                direction,
                curNode.getFocusableId(),
                newNode == null ? null : newNode.getFocusableId());
        return newNode;
    }

    private @Nullable FocusableNode find(FocusableNode from, NavigationDirection direction, boolean loop) {
        Predicate<FocusableNode> isValid = LineAdmissibility.forDirection(direction, from);
        return direction.isForward()
                ? traversal.getNextNode(from, isValid, loop)
                : traversal.getPreviousNode(from, isValid, loop);
    }

    /** True when moving in and moving to the next line would land on the same node. */
    public boolean atEndOfLine() {
        var curNode = getCurNode();
        if (curNode == null) {
            return false;
        }
        var inNode = find(curNode, NavigationDirection.IN, navigationLoops);
        var nextNode = find(curNode, NavigationDirection.NEXT, navigationLoops);
        return inNode == nextNode;
    }

    public @Nullable FocusableNode getNextNode(
            @Nullable FocusableNode node, Predicate<FocusableNode> isValid, boolean loop) {
        return traversal.getNextNode(node, isValid, loop);
    }

    public @Nullable FocusableNode getPreviousNode(
            @Nullable FocusableNode node, Predicate<FocusableNode> isValid, boolean loop) {
        return traversal.getPreviousNode(node, isValid, loop);
    }

    public @Nullable FocusableNode getFirstNode() {
        return traversal.getFirstNode();
    }

    public @Nullable FocusableNode getLastNode() {
        return traversal.getLastNode();
    }

    public @Nullable FocusableNode getCurNode() {
        return focusHolder.getFocusedNode();
    }

    /** Focuses {@code newNode}, beeping when the move changes nesting depth. */
    public void setCurNode(FocusableNode newNode) {
        var oldBlock = getSourceBlock();
        var newBlock = Nodes.sourceBlockOf(newNode);
        if (oldBlock != null && newBlock != null && oldBlock.getNestingLevel() != newBlock.getNestingLevel()) {
            int tone = BASE_TONE_HZ + TONE_STEP_HZ * newBlock.getNestingLevel();
            try {
                newBlock.getWorkspace().getAudio().beep(tone);
            } catch (RuntimeException e) {
                logger.warn("Nesting beep failed: {}", e.getMessage());
            }
        }
        focusHolder.focusNode(newNode);
    }

    /** Block owning the current node; null for comments, the workspace, or no focus. */
    public @Nullable Block getSourceBlock() {
        return Nodes.sourceBlockOf(getCurNode());
    }

    public boolean getNavigationLoops() {
        return navigationLoops;
    }

    public void setNavigationLoops(boolean loops) {
        this.navigationLoops = loops;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    /**
     * Records where focus may go once {@code deletedBlock} is gone, in order of preference: the current node, the
     * connection the block hangs from, the block below it, its parent, the workspace.
     */
    @Override
    public void preDelete(Block deletedBlock) {
        var candidates = new ArrayList<FocusableNode>();
        var curNode = getCurNode();
        if (curNode != null) {
            candidates.add(curNode);
        }
        var parentConnection = deletedBlock.getPreviousConnection() != null
                ? deletedBlock.getPreviousConnection().getTargetConnection()
                : null;
        if (parentConnection == null && deletedBlock.getOutputConnection() != null) {
            parentConnection = deletedBlock.getOutputConnection().getTargetConnection();
        }
        if (parentConnection != null) {
            candidates.add(parentConnection);
        }
        var nextBlock = deletedBlock.getNextBlock();
        if (nextBlock != null) {
            candidates.add(nextBlock);
        }
        var parentBlock = deletedBlock.getParent();
        if (parentBlock != null) {
            candidates.add(parentBlock);
        }
        candidates.add(workspace);
        startRecovery(deletedBlock.getId(), candidates);
    }

    /**
     * Records where focus may go once {@code deletedComment} is gone: the current node, the top-level item after the
     * comment, the one before it, the workspace.
     */
    @Override
    public void preDelete(WorkspaceComment deletedComment) {
        var candidates = new ArrayList<FocusableNode>();
        var curNode = getCurNode();
        if (curNode != null) {
            candidates.add(curNode);
        }
        var topItems = workspace.getTopItems();
        int index = -1;
        for (int i = 0; i < topItems.size(); i++) {
            if (topItems.get(i) == deletedComment) {
                index = i;
                break;
            }
        }
        if (index >= 0 && index + 1 < topItems.size()) {
            candidates.add(topItems.get(index + 1));
        }
        if (index > 0) {
            candidates.add(topItems.get(index - 1));
        }
        candidates.add(workspace);
        startRecovery(deletedComment.getFocusableId(), candidates);
    }

    private void startRecovery(String deletedId, List<FocusableNode> candidates) {
        if (recovery instanceof RecoveryState.Pending) {
            logger.warn(
                    "preDelete({}) while a previous deletion is pending; replacing recovery candidates", deletedId);
        }
        recovery = new RecoveryState.Pending(List.copyOf(candidates));
    }

    /**
     * Focuses the first recorded candidate that survived the deletion.
     *
     * @throws CursorStateException if no deletion is pending or no candidate survived
     */
    @Override
    public void postDelete() {
        var state = recovery;
        recovery = new RecoveryState.Idle();
        if (!(state instanceof RecoveryState.Pending pending)) {
            logger.error("postDelete called without a matching preDelete on {}", workspace.getFocusableId());
            throw new CursorStateException("postDelete called without preDelete");
        }
        for (var node : pending.candidates()) {
            if (survived(node)) {
                setCurNode(node);
                return;
            }
        }
        logger.error("No surviving focus candidate after deletion on {}", workspace.getFocusableId());
        throw new CursorStateException("No valid node to focus after deletion");
    }

    private static boolean survived(FocusableNode node) {
        if (node instanceof WorkspaceComment comment) {
            return !comment.isDisposed();
        }
        var owner = Nodes.sourceBlockOf(node);
        return owner == null || !owner.isDisposed();
    }

    boolean isRecoveryPending() {
        return recovery instanceof RecoveryState.Pending;
    }
}
