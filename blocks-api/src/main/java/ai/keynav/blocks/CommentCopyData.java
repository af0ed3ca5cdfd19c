package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

/** Clipboard payload for a workspace comment. */
public record CommentCopyData(String text, Coordinate origin) implements CopyData {
    @Override
    public @Nullable FocusableNode pasteInto(Workspace workspace, @Nullable Coordinate location) {
        var comment = workspace.newComment(text);
        var offset = BlockCopyData.PASTE_OFFSET;
        comment.moveTo(location != null ? location : origin.translate(offset, offset));
        return comment;
    }
}
