package ai.keynav.exception;

/** Thrown when the line cursor is driven through an impossible state, e.g. post-delete without pre-delete. */
public class CursorStateException extends RuntimeException {
    public CursorStateException(String message) {
        super(message);
    }
}
