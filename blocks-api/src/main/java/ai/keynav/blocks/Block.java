package ai.keynav.blocks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A block of the visual program. Blocks are chained into stacks through previous/next connections and nested
 * through value and statement inputs.
 *
 * <p>Document relations follow the connections: {@link #getParent()} is the block on the other side of this block's
 * previous or output connection, so for the second block of a stack the parent is the block above it.
 */
public class Block implements Deletable, Draggable, Copyable {
    private static final Logger logger = LogManager.getLogger(Block.class);

    private final Workspace workspace;
    private final String id;
    private final String type;
    private final List<Input> inputs = new ArrayList<>();

    private @Nullable Connection previousConnection;
    private @Nullable Connection nextConnection;
    private @Nullable Connection outputConnection;

    private boolean inputsInline;
    private boolean ownDeletable = true;
    private boolean ownMovable = true;
    private boolean disposed;
    private Coordinate position = Coordinate.ORIGIN;

    Block(Workspace workspace, String id, String type) {
        this.workspace = workspace;
        this.id = id;
        this.type = type;
    }

    // ---------- structure ----------

    public Input appendValueInput(String name) {
        return appendInput(name, InputType.VALUE);
    }

    public Input appendStatementInput(String name) {
        return appendInput(name, InputType.STATEMENT);
    }

    public Input appendDummyInput(String name) {
        return appendInput(name, InputType.DUMMY);
    }

    private Input appendInput(String name, InputType inputType) {
        var input = new Input(name, inputType, this);
        inputs.add(input);
        return input;
    }

    public Block setPreviousStatement(boolean enabled) {
        if (enabled && outputConnection != null) {
            throw new IllegalStateException(
                    "Block %s cannot have both a previous and an output connection".formatted(id));
        }
        previousConnection = updateConnection(previousConnection, enabled, ConnectionType.PREVIOUS_STATEMENT);
        return this;
    }

    public Block setNextStatement(boolean enabled) {
        nextConnection = updateConnection(nextConnection, enabled, ConnectionType.NEXT_STATEMENT);
        return this;
    }

    public Block setOutput(boolean enabled) {
        if (enabled && previousConnection != null) {
            throw new IllegalStateException(
                    "Block %s cannot have both a previous and an output connection".formatted(id));
        }
        outputConnection = updateConnection(outputConnection, enabled, ConnectionType.OUTPUT_VALUE);
        return this;
    }

    private @Nullable Connection updateConnection(
            @Nullable Connection existing, boolean enabled, ConnectionType connectionType) {
        if (enabled) {
            return existing != null ? existing : new Connection(this, connectionType, null);
        }
        if (existing != null) {
            existing.disconnect();
        }
        return null;
    }

    public Block setInputsInline(boolean inline) {
        this.inputsInline = inline;
        return this;
    }

    public boolean getInputsInline() {
        return inputsInline;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    @Override
    public String getFocusableId() {
        return id;
    }

    @Override
    public Workspace getWorkspace() {
        return workspace;
    }

    public List<Input> getInputList() {
        return Collections.unmodifiableList(inputs);
    }

    public @Nullable Input getInput(String name) {
        return inputs.stream().filter(i -> i.getName().equals(name)).findFirst().orElse(null);
    }

    public @Nullable Field getField(String name) {
        for (var input : inputs) {
            for (var field : input.getFields()) {
                if (field.getName().equals(name)) {
                    return field;
                }
            }
        }
        return null;
    }

    public int getStatementInputCount() {
        return (int) inputs.stream().filter(i -> i.getType() == InputType.STATEMENT).count();
    }

    public @Nullable Connection getPreviousConnection() {
        return previousConnection;
    }

    public @Nullable Connection getNextConnection() {
        return nextConnection;
    }

    public @Nullable Connection getOutputConnection() {
        return outputConnection;
    }

    // ---------- relations ----------

    /** The block this one is attached to through its previous or output connection. */
    public @Nullable Block getParent() {
        if (previousConnection != null && previousConnection.isConnected()) {
            return previousConnection.targetBlock();
        }
        if (outputConnection != null && outputConnection.isConnected()) {
            return outputConnection.targetBlock();
        }
        return null;
    }

    /** The nearest parent that contains this block in one of its inputs, skipping blocks that merely precede it. */
    public @Nullable Block getSurroundParent() {
        Block block = this;
        Block previous;
        do {
            previous = block;
            block = block.getParent();
            if (block == null) {
                return null;
            }
        } while (block.getNextBlock() == previous);
        return block;
    }

    public @Nullable Block getNextBlock() {
        return nextConnection == null ? null : nextConnection.targetBlock();
    }

    /** Top of the whole parent chain, i.e. the first block of the top-level stack containing this block. */
    public Block getRootBlock() {
        Block block = this;
        Block parent;
        while ((parent = block.getParent()) != null) {
            block = parent;
        }
        return block;
    }

    /** Number of blocks that contain this one in an input. */
    public int getNestingLevel() {
        int level = 0;
        for (var surround = getSurroundParent(); surround != null; surround = surround.getSurroundParent()) {
            level++;
        }
        return level;
    }

    public boolean isTopLevel() {
        return getParent() == null;
    }

    /** Blocks attached to this block's inputs in input order, followed by the next block. */
    public List<Block> getChildren() {
        var children = new ArrayList<Block>();
        for (var input : inputs) {
            var connection = input.getConnection();
            var child = connection == null ? null : connection.targetBlock();
            if (child != null) {
                children.add(child);
            }
        }
        var next = getNextBlock();
        if (next != null) {
            children.add(next);
        }
        return children;
    }

    /** This block and everything attached below it, in document (pre-)order. */
    public List<Block> getDescendants() {
        var result = new ArrayList<Block>();
        collectDescendants(this, result);
        return result;
    }

    private static void collectDescendants(Block block, List<Block> into) {
        into.add(block);
        for (var child : block.getChildren()) {
            collectDescendants(child, into);
        }
    }

    /**
     * Walks the stack starting at this block and returns the last next connection, i.e. the one with nothing
     * attached. Returns null when the last block of the stack has no next connection.
     */
    public @Nullable Connection lastConnectionInStack() {
        var connection = nextConnection;
        while (connection != null) {
            var nextBlock = connection.targetBlock();
            if (nextBlock == null) {
                return connection;
            }
            connection = nextBlock.nextConnection;
        }
        return null;
    }

    // ---------- capabilities ----------

    @Override
    public boolean isDeletable() {
        return ownDeletable && !disposed && !workspace.isReadOnly();
    }

    @Override
    public boolean isOwnDeletable() {
        return ownDeletable;
    }

    public void setDeletable(boolean deletable) {
        this.ownDeletable = deletable;
    }

    @Override
    public boolean isMovable() {
        return ownMovable && !disposed && !workspace.isReadOnly();
    }

    @Override
    public boolean isOwnMovable() {
        return ownMovable;
    }

    public void setMovable(boolean movable) {
        this.ownMovable = movable;
    }

    /** Position of the stack this block belongs to; nested blocks report their root's position. */
    @Override
    public Coordinate getRelativeToSurfaceXY() {
        return isTopLevel() ? position : getRootBlock().position;
    }

    public void moveTo(Coordinate newPosition) {
        this.position = newPosition;
    }

    @Override
    public @Nullable CopyData toCopyData() {
        if (disposed) {
            return null;
        }
        return new BlockCopyData(BlockState.capture(this, false), getRelativeToSurfaceXY());
    }

    /** Short human-readable description used for screen-reader announcements. */
    public String computeLabel(boolean verbose) {
        var parts = new ArrayList<String>();
        parts.add(type);
        for (var input : inputs) {
            for (var field : input.getFields()) {
                parts.add(field.getValue());
            }
            if (verbose && input.getType() == InputType.VALUE) {
                var connection = input.getConnection();
                var child = connection == null ? null : connection.targetBlock();
                parts.add(child == null ? "empty" : "(" + child.computeLabel(true) + ")");
            }
        }
        return String.join(" ", parts);
    }

    // ---------- disposal ----------

    public boolean isDisposed() {
        return disposed;
    }

    /** Deletes the block the way a user-initiated delete does: hides chaff and heals the stack. */
    public void checkAndDelete() {
        if (disposed) {
            return;
        }
        workspace.hideChaff();
        dispose(true);
    }

    @Override
    public void dispose() {
        dispose(false);
    }

    /**
     * Removes this block and every block attached to its inputs. With {@code healStack} the block below this one
     * is reattached to the block above; without it the rest of the stack is disposed too.
     */
    public void dispose(boolean healStack) {
        if (disposed) {
            return;
        }
        var observer = workspace.getDeletionObserver();
        if (observer != null) {
            observer.preDelete(this);
        }
        unplug(healStack);
        disposeTree();
        logger.debug("Disposed block {} (healStack={})", id, healStack);
        if (observer != null) {
            observer.postDelete();
        }
    }

    private void unplug(boolean healStack) {
        if (outputConnection != null && outputConnection.isConnected()) {
            outputConnection.disconnect();
            return;
        }
        var next = healStack ? getNextBlock() : null;
        if (previousConnection != null && previousConnection.isConnected()) {
            var parentConnection = previousConnection.getTargetConnection();
            if (next != null && nextConnection != null) {
                nextConnection.disconnect();
            }
            previousConnection.disconnect();
            if (next != null && parentConnection != null && next.previousConnection != null) {
                parentConnection.connect(next.previousConnection);
            }
        } else if (next != null && nextConnection != null) {
            int index = workspace.indexOfTopItem(this);
            nextConnection.disconnect();
            workspace.moveTopItem(next, index);
        }
    }

    private void disposeTree() {
        for (var child : getChildren()) {
            child.disposeTree();
        }
        workspace.removeTopItem(this);
        disposed = true;
        for (var input : inputs) {
            if (input.getConnection() != null) {
                input.getConnection().sever();
            }
        }
        if (previousConnection != null) {
            previousConnection.sever();
        }
        if (nextConnection != null) {
            nextConnection.sever();
        }
        if (outputConnection != null) {
            outputConnection.sever();
        }
    }

    @Override
    public String toString() {
        return "Block[" + id + ":" + type + "]";
    }
}
