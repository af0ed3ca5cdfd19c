package ai.keynav.blocks;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * {@link NodeNavigator} over a {@link Workspace}. Children of the workspace are its top stacks flattened in stack
 * order plus comments; children of a block are, per visible input, its fields followed by the attached block (value
 * input), the attached stack (statement input) or the empty connection, then the block's own free next connection.
 */
public final class BlockTreeNavigator implements NodeNavigator {
    private final Workspace workspace;

    public BlockTreeNavigator(Workspace workspace) {
        this.workspace = workspace;
    }

    @Override
    public @Nullable FocusableNode getFirstChild(FocusableNode node) {
        var children = childrenOf(node);
        return children.isEmpty() ? null : children.get(0);
    }

    @Override
    public @Nullable FocusableNode getNextSibling(FocusableNode node) {
        var parent = getParent(node);
        if (parent == null) {
            return null;
        }
        var siblings = childrenOf(parent);
        int slot = slotOf(node, siblings);
        if (slot < 0) {
            return null;
        }
        int index = indexOf(siblings, node) >= 0 ? slot + 1 : slot;
        return index < siblings.size() ? siblings.get(index) : null;
    }

    @Override
    public @Nullable FocusableNode getPreviousSibling(FocusableNode node) {
        var parent = getParent(node);
        if (parent == null) {
            return null;
        }
        var siblings = childrenOf(parent);
        int slot = slotOf(node, siblings);
        return slot > 0 ? siblings.get(slot - 1) : null;
    }

    @Override
    public @Nullable FocusableNode getParent(FocusableNode node) {
        if (node instanceof Workspace) {
            return null;
        }
        if (node instanceof Block block) {
            var surround = block.getSurroundParent();
            return surround != null ? surround : workspace;
        }
        if (node instanceof Connection connection) {
            return connection.getSourceBlock();
        }
        if (node instanceof Field field) {
            return field.getSourceBlock();
        }
        return workspace;
    }

    /**
     * Position of {@code node} in its parent's sequence: its index when listed, otherwise the index it would be
     * inserted at. Returns -1 for nodes that have no defined position.
     */
    private static int slotOf(FocusableNode node, List<FocusableNode> siblings) {
        int index = indexOf(siblings, node);
        if (index >= 0) {
            return index;
        }
        if (!(node instanceof Connection connection)) {
            return -1;
        }
        return switch (connection.getType()) {
            case PREVIOUS_STATEMENT, OUTPUT_VALUE -> 0;
            case NEXT_STATEMENT, INPUT_VALUE -> {
                if (connection.getParentInput() == null) {
                    yield siblings.size();
                }
                var target = connection.targetBlock();
                yield target == null ? -1 : indexOf(siblings, target);
            }
        };
    }

    private static int indexOf(List<FocusableNode> nodes, FocusableNode node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    private List<FocusableNode> childrenOf(FocusableNode node) {
        var children = new ArrayList<FocusableNode>();
        if (node instanceof Workspace ws) {
            for (var item : ws.getTopItems()) {
                if (item instanceof Block top) {
                    addStack(top, children);
                } else {
                    children.add(item);
                }
            }
        } else if (node instanceof Block block) {
            for (var input : block.getInputList()) {
                if (!input.isVisible()) {
                    continue;
                }
                children.addAll(input.getFields());
                var connection = input.getConnection();
                if (connection == null) {
                    continue;
                }
                var target = connection.targetBlock();
                if (target == null) {
                    children.add(connection);
                } else if (input.getType() == InputType.STATEMENT) {
                    addStack(target, children);
                } else {
                    children.add(target);
                }
            }
            var next = block.getNextConnection();
            if (next != null && !next.isConnected()) {
                children.add(next);
            }
        }
        return children;
    }

    private static void addStack(Block first, List<FocusableNode> into) {
        for (Block block = first; block != null; block = block.getNextBlock()) {
            into.add(block);
        }
    }
}
