package ai.keynav.navigation;

import ai.keynav.blocks.Block;
import ai.keynav.blocks.Connection;
import ai.keynav.blocks.ConnectionType;
import ai.keynav.blocks.FocusableNode;
import ai.keynav.blocks.Nodes;
import ai.keynav.blocks.WorkspaceComment;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * Decides which nodes a line cursor may stop on. NEXT and PREVIOUS treat the program like lines of text: they stop
 * on statement blocks, comments and statement-level connections, and skip value blocks that render on the same row
 * as the block holding them. IN and OUT stop everywhere.
 */
public final class LineAdmissibility {
    private LineAdmissibility() {}

    /** Predicate for moves in {@code direction} starting from {@code currentNode}. */
    public static Predicate<FocusableNode> forDirection(
            NavigationDirection direction, @Nullable FocusableNode currentNode) {
        return switch (direction) {
            case IN, OUT -> candidate -> true;
            case NEXT, PREVIOUS -> candidate -> isLineNode(direction, currentNode, candidate);
        };
    }

    static boolean isLineNode(
            NavigationDirection direction, @Nullable FocusableNode currentNode, @Nullable FocusableNode candidate) {
        if (candidate == null) {
            return false;
        }
        if (isStatementLevel(candidate)) {
            return true;
        }

        if (direction == NavigationDirection.PREVIOUS) {
            // a block's own next connection steps back onto its block, not into the block's last input
            if (currentNode instanceof Connection current
                    && current.getType() == ConnectionType.NEXT_STATEMENT
                    && current.getParentInput() == null
                    && candidate != current.getSourceBlock()) {
                return false;
            }
            if (candidate instanceof Block block && block.getOutputConnection() != null) {
                var target = block.getOutputConnection().getTargetConnection();
                if (target != null) {
                    var parentInput = target.getParentInput();
                    if (parentInput == null
                            || parentInput.getSourceBlock().getStatementInputCount() == 0
                            || parentInput.getSourceBlock().getInputList().get(0) == parentInput) {
                        return false;
                    }
                }
            }
        }

        var currentBlock = Nodes.sourceBlockOf(currentNode);
        if (candidate instanceof Block block && currentBlock != null) {
            var holder = block.getOutputConnection() == null
                    ? null
                    : block.getOutputConnection().targetBlock();
            if (holder != null && holder.getInputsInline()) {
                return false;
            }
            var candidateParents = parentsOf(block);
            if (currentBlock == currentNode && candidateParents.contains(currentBlock)) {
                return false;
            }
            var shared = parentsOf(currentBlock);
            shared.retainAll(candidateParents);
            return shared.isEmpty() || shared.stream().anyMatch(b -> !b.getInputsInline());
        }
        return false;
    }

    private static boolean isStatementLevel(FocusableNode candidate) {
        if (candidate instanceof Block block) {
            return block.getOutputConnection() == null || block.getOutputConnection().targetBlock() == null;
        }
        if (candidate instanceof WorkspaceComment) {
            return true;
        }
        if (candidate instanceof Connection connection) {
            if (connection.getType() == ConnectionType.NEXT_STATEMENT) {
                return true;
            }
            var source = connection.getSourceBlock();
            return connection.getType() == ConnectionType.INPUT_VALUE
                    && source.getStatementInputCount() > 0
                    && source.getInputList().get(0) != connection.getParentInput();
        }
        return false;
    }

    private static Set<Block> parentsOf(Block block) {
        Set<Block> parents = Collections.newSetFromMap(new IdentityHashMap<>());
        var parent = block.getParent();
        while (parent != null && parents.add(parent)) {
            parent = parent.getParent();
        }
        return parents;
    }
}
