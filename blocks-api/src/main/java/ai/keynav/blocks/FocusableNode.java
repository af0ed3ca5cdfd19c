package ai.keynav.blocks;

/**
 * Anything that can hold keyboard focus in a workspace: blocks, connections, fields, workspace comments and the
 * workspace itself.
 */
public interface FocusableNode {
    /** Stable identifier, unique within the owning workspace. */
    String getFocusableId();

    Workspace getWorkspace();
}
