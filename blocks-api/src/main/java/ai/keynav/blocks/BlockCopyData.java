package ai.keynav.blocks;

import org.jetbrains.annotations.Nullable;

/** Clipboard payload for a block and its nested children. */
public record BlockCopyData(BlockState state, Coordinate origin) implements CopyData {
    static final double PASTE_OFFSET = 20;

    /** Pastes at {@code location}, or near the original position, offset until no top block occupies the spot. */
    @Override
    public @Nullable FocusableNode pasteInto(Workspace workspace, @Nullable Coordinate location) {
        var position = location;
        if (position == null) {
            position = origin;
            while (isOccupied(workspace, position)) {
                position = position.translate(PASTE_OFFSET, PASTE_OFFSET);
            }
        }
        var block = state.rebuild(workspace);
        block.moveTo(position);
        return block;
    }

    private static boolean isOccupied(Workspace workspace, Coordinate position) {
        return workspace.getTopBlocks().stream().anyMatch(b -> b.getRelativeToSurfaceXY().equals(position));
    }
}
