package ai.keynav.blocks;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Immutable snapshot of a block and everything nested in it, used for copy and paste. */
public record BlockState(
        String type,
        boolean inputsInline,
        boolean deletable,
        boolean movable,
        boolean hasPrevious,
        boolean hasNext,
        boolean hasOutput,
        List<InputState> inputs,
        @Nullable BlockState next) {

    public record InputState(
            String name, InputType type, boolean visible, List<FieldState> fields, @Nullable BlockState child) {}

    public record FieldState(String name, String value) {}

    /**
     * Captures {@code block}. Nested blocks are always captured, including whole statement stacks; the block's own
     * successor in its stack only when {@code includeNext} is set.
     */
    public static BlockState capture(Block block, boolean includeNext) {
        var inputs = new ArrayList<InputState>();
        for (var input : block.getInputList()) {
            var fields = input.getFields().stream()
                    .map(f -> new FieldState(f.getName(), f.getValue()))
                    .toList();
            var connection = input.getConnection();
            var target = connection == null ? null : connection.targetBlock();
            var child = target == null ? null : capture(target, true);
            inputs.add(new InputState(input.getName(), input.getType(), input.isVisible(), fields, child));
        }
        var nextBlock = includeNext ? block.getNextBlock() : null;
        return new BlockState(
                block.getType(),
                block.getInputsInline(),
                block.isOwnDeletable(),
                block.isOwnMovable(),
                block.getPreviousConnection() != null,
                block.getNextConnection() != null,
                block.getOutputConnection() != null,
                List.copyOf(inputs),
                nextBlock == null ? null : capture(nextBlock, true));
    }

    /** Recreates the snapshot in {@code workspace} with fresh ids. The returned block is a top-level item. */
    public Block rebuild(Workspace workspace) {
        var block = workspace.newBlock(type);
        block.setPreviousStatement(hasPrevious)
                .setNextStatement(hasNext)
                .setOutput(hasOutput)
                .setInputsInline(inputsInline);
        block.setDeletable(deletable);
        block.setMovable(movable);
        for (var inputState : inputs) {
            var input = switch (inputState.type()) {
                case VALUE -> block.appendValueInput(inputState.name());
                case STATEMENT -> block.appendStatementInput(inputState.name());
                case DUMMY -> block.appendDummyInput(inputState.name());
            };
            input.setVisible(inputState.visible());
            inputState.fields().forEach(f -> input.appendField(f.name(), f.value()));
            var childState = inputState.child();
            var connection = input.getConnection();
            if (childState != null && connection != null) {
                var child = childState.rebuild(workspace);
                var childConnection = inputState.type() == InputType.VALUE
                        ? child.getOutputConnection()
                        : child.getPreviousConnection();
                if (childConnection != null) {
                    connection.connect(childConnection);
                }
            }
        }
        var nextConnection = block.getNextConnection();
        if (next != null && nextConnection != null) {
            var previous = next.rebuild(workspace).getPreviousConnection();
            if (previous != null) {
                nextConnection.connect(previous);
            }
        }
        return block;
    }
}
