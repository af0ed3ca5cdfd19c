package ai.keynav.blocks;

import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Typed attachment point on a block. Previous and output connections sit on the block being attached; next and
 * input connections receive it.
 */
public final class Connection implements FocusableNode {
    private static final Logger logger = LogManager.getLogger(Connection.class);

    private final Block sourceBlock;
    private final ConnectionType type;
    private final @Nullable Input parentInput;
    private @Nullable Connection targetConnection;

    Connection(Block sourceBlock, ConnectionType type, @Nullable Input parentInput) {
        this.sourceBlock = sourceBlock;
        this.type = type;
        this.parentInput = parentInput;
    }

    @Override
    public String getFocusableId() {
        var suffix = parentInput != null ? parentInput.getName() : type.name().toLowerCase(Locale.ROOT);
        return sourceBlock.getId() + "#" + suffix;
    }

    @Override
    public Workspace getWorkspace() {
        return sourceBlock.getWorkspace();
    }

    public Block getSourceBlock() {
        return sourceBlock;
    }

    public ConnectionType getType() {
        return type;
    }

    /** The input this connection belongs to; null for previous, next and output connections. */
    public @Nullable Input getParentInput() {
        return parentInput;
    }

    public @Nullable Connection getTargetConnection() {
        return targetConnection;
    }

    public @Nullable Block targetBlock() {
        return targetConnection == null ? null : targetConnection.getSourceBlock();
    }

    public boolean isConnected() {
        return targetConnection != null;
    }

    /**
     * Attaches this connection to a free connection of the opposite type. The attached block stops being a top-level
     * item of its workspace.
     *
     * @throws IllegalArgumentException if the types are incompatible or the blocks live in different workspaces
     * @throws IllegalStateException if either side is occupied, disposed, or the link would create a cycle
     */
    public void connect(Connection other) {
        if (other.type != type.opposite()) {
            throw new IllegalArgumentException("Cannot connect %s to %s".formatted(type, other.type));
        }
        if (getWorkspace() != other.getWorkspace()) {
            throw new IllegalArgumentException("Cannot connect blocks from different workspaces");
        }
        if (isConnected() || other.isConnected()) {
            throw new IllegalStateException("Connection already in use: %s -> %s"
                    .formatted(getFocusableId(), other.getFocusableId()));
        }
        if (sourceBlock.isDisposed() || other.sourceBlock.isDisposed()) {
            throw new IllegalStateException("Cannot connect a disposed block");
        }
        var child = type.isChildSide() ? this : other;
        var parent = child == this ? other : this;
        for (var block = parent.sourceBlock; block != null; block = block.getParent()) {
            if (block == child.sourceBlock) {
                throw new IllegalStateException("Connecting %s would create a cycle".formatted(getFocusableId()));
            }
        }
        targetConnection = other;
        other.targetConnection = this;
        child.getWorkspace().removeTopItem(child.sourceBlock);
        logger.trace("Connected {} to {}", child.getFocusableId(), parent.getFocusableId());
    }

    /** Breaks the link, if any. The detached block becomes a top-level item of its workspace. */
    public void disconnect() {
        var target = targetConnection;
        if (target == null) {
            return;
        }
        var child = type.isChildSide() ? this : target;
        targetConnection = null;
        target.targetConnection = null;
        var orphan = child.getSourceBlock();
        if (!orphan.isDisposed()) {
            orphan.getWorkspace().addTopItem(orphan);
        }
    }

    /** Clears both ends of the link without any top-level bookkeeping; used while disposing. */
    void sever() {
        var target = targetConnection;
        if (target != null) {
            target.targetConnection = null;
            targetConnection = null;
        }
    }

    @Override
    public String toString() {
        return "Connection[" + getFocusableId() + "]";
    }
}
