package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

/** A free-floating text note on the workspace surface. Always a top-level item. */
public class WorkspaceComment implements Deletable, Draggable, Copyable {
    private final Workspace workspace;
    private final String id;
    private String text;
    private Coordinate position = Coordinate.ORIGIN;
    private boolean ownDeletable = true;
    private boolean ownMovable = true;
    private boolean disposed;

    WorkspaceComment(Workspace workspace, String id, String text) {
        this.workspace = workspace;
        this.id = id;
        this.text = text;
    }

    @Override
    public String getFocusableId() {
        return id;
    }

    @Override
    public Workspace getWorkspace() {
        return workspace;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Override
    public boolean isDeletable() {
        return ownDeletable && !disposed && !workspace.isReadOnly();
    }

    @Override
    public boolean isOwnDeletable() {
        return ownDeletable;
    }

    public void setDeletable(boolean deletable) {
        this.ownDeletable = deletable;
    }

    @Override
    public boolean isMovable() {
        return ownMovable && !disposed && !workspace.isReadOnly();
    }

    @Override
    public boolean isOwnMovable() {
        return ownMovable;
    }

    public void setMovable(boolean movable) {
        this.ownMovable = movable;
    }

    @Override
    public Coordinate getRelativeToSurfaceXY() {
        return position;
    }

    public void moveTo(Coordinate newPosition) {
        this.position = newPosition;
    }

    @Override
    public @Nullable CopyData toCopyData() {
        return disposed ? null : new CommentCopyData(text, position);
    }

    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        var observer = workspace.getDeletionObserver();
        if (observer != null) {
            observer.preDelete(this);
        }
        workspace.removeTopItem(this);
        disposed = true;
        if (observer != null) {
            observer.postDelete();
        }
    }

    @Override
    public String toString() {
        return "WorkspaceComment[" + id + "]";
    }
}
