package ai.keynav.blocks;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Default {@link FocusHolder}: remembers the focused node and tracks exclusive edit sessions. */
public class FocusManager implements FocusHolder {
    private static final Logger logger = LogManager.getLogger(FocusManager.class);

    private @Nullable FocusableNode focusedNode;
    private boolean ephemeralFocusTaken;

    @Override
    public @Nullable FocusableNode getFocusedNode() {
        return focusedNode;
    }

    @Override
    public void focusNode(FocusableNode node) {
        logger.trace("Focus -> {}", node.getFocusableId());
        focusedNode = node;
    }

    @Override
    public boolean isEphemeralFocusTaken() {
        return ephemeralFocusTaken;
    }

    /**
     * Starts an exclusive edit session. Closing the returned handle ends it.
     *
     * @throws IllegalStateException if a session is already open
     */
    public AutoCloseable takeEphemeralFocus() {
        if (ephemeralFocusTaken) {
            throw new IllegalStateException("Ephemeral focus already taken");
        }
        ephemeralFocusTaken = true;
        return () -> ephemeralFocusTaken = false;
    }
}
