package ai.keynav.shortcuts;

/** Names of the default shortcuts; also the suffix of their {@code keybinding.*} configuration keys. */
public final class ShortcutNames {
    private ShortcutNames() {}

    public static final String ESCAPE = "escape";
    public static final String DELETE = "delete";
    public static final String COPY = "copy";
    public static final String CUT = "cut";
    public static final String PASTE = "paste";
    public static final String UNDO = "undo";
    public static final String REDO = "redo";
    public static final String READ_FULL_BLOCK_SUMMARY = "read_full_block_summary";
    public static final String READ_BLOCK_PARENT_SUMMARY = "read_block_parent_summary";
    public static final String JUMP_TOP_STACK = "jump_to_top_of_stack";
    public static final String JUMP_BOTTOM_STACK = "jump_to_bottom_of_stack";
    public static final String JUMP_BLOCK_START = "jump_to_block_start";
    public static final String JUMP_BLOCK_END = "jump_to_block_end";
    public static final String JUMP_FIRST_BLOCK = "jump_to_first_block";
    public static final String JUMP_LAST_BLOCK = "jump_to_last_block";
    public static final String NEXT = "next";
    public static final String PREVIOUS = "previous";
    public static final String IN = "in";
    public static final String OUT = "out";
}
