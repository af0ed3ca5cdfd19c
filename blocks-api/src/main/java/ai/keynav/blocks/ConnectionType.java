package ai.keynav.blocks;

public enum ConnectionType {
    /** Top of a statement block; plugs into a next connection or a statement input. */
    PREVIOUS_STATEMENT,
    /** Bottom of a statement block, and the connection of every statement input. */
    NEXT_STATEMENT,
    /** Connection of a value input. */
    INPUT_VALUE,
    /** Left edge of a value block; plugs into a value input. */
    OUTPUT_VALUE;

    /** The type a connection of this type can be attached to. */
    public ConnectionType opposite() {
        return switch (this) {
            case PREVIOUS_STATEMENT -> NEXT_STATEMENT;
            case NEXT_STATEMENT -> PREVIOUS_STATEMENT;
            case INPUT_VALUE -> OUTPUT_VALUE;
            case OUTPUT_VALUE -> INPUT_VALUE;
        };
    }

    /** True for the connection type that sits on the block being attached, rather than the block receiving it. */
    public boolean isChildSide() {
        return this == PREVIOUS_STATEMENT || this == OUTPUT_VALUE;
    }
}
