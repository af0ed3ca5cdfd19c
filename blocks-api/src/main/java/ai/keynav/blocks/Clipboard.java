package ai.keynav.blocks;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Holds the most recent copy along with the workspace and position it was copied from. */
public class Clipboard {
    private static final Logger logger = LogManager.getLogger(Clipboard.class);

    private @Nullable CopyData copyData;
    private @Nullable Workspace copyWorkspace;
    private @Nullable Coordinate copyCoords;

    /**
     * Captures {@code node}. Returns the captured data, or null when the node produced nothing, in which case the
     * previous clipboard contents are kept.
     */
    public @Nullable CopyData copy(Copyable node, @Nullable Coordinate coords) {
        var data = node.toCopyData();
        if (data == null) {
            logger.debug("Nothing to copy from {}", node.getFocusableId());
            return null;
        }
        copyData = data;
        copyWorkspace = node.getWorkspace();
        copyCoords = coords;
        return data;
    }

    public @Nullable FocusableNode paste(CopyData data, Workspace workspace) {
        return paste(data, workspace, null);
    }

    public @Nullable FocusableNode paste(CopyData data, Workspace workspace, @Nullable Coordinate coords) {
        if (workspace.isReadOnly()) {
            logger.warn("Refusing to paste into read-only workspace {}", workspace.getFocusableId());
            return null;
        }
        return data.pasteInto(workspace, coords);
    }

    public @Nullable CopyData getLastCopiedData() {
        return copyData;
    }

    public @Nullable Workspace getLastCopiedWorkspace() {
        return copyWorkspace;
    }

    public @Nullable Coordinate getLastCopiedLocation() {
        return copyCoords;
    }

    public void clear() {
        copyData = null;
        copyWorkspace = null;
        copyCoords = null;
    }
}
