package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

public final class Nodes {
    private Nodes() {}

    /** The block a node belongs to: the block itself, or the owner of a field or connection. */
    public static @Nullable Block sourceBlockOf(@Nullable FocusableNode node) {
        if (node instanceof Block block) {
            return block;
        }
        if (node instanceof Connection connection) {
            return connection.getSourceBlock();
        }
        if (node instanceof Field field) {
            return field.getSourceBlock();
        }
        return null;
    }
}
