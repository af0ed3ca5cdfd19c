package ai.keynav.blocks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A row of fields on a block, optionally ending in a value or statement connection. */
public final class Input {
    private final String name;
    private final InputType type;
    private final Block sourceBlock;
    private final List<Field> fields = new ArrayList<>();
    private final @Nullable Connection connection;
    private boolean visible = true;

    Input(String name, InputType type, Block sourceBlock) {
        this.name = name;
        this.type = type;
        this.sourceBlock = sourceBlock;
        this.connection = switch (type) {
            case VALUE -> new Connection(sourceBlock, ConnectionType.INPUT_VALUE, this);
            case STATEMENT -> new Connection(sourceBlock, ConnectionType.NEXT_STATEMENT, this);
            case DUMMY -> null;
        };
    }

    public Input appendField(String fieldName, String value) {
        fields.add(new Field(fieldName, value, this));
        return this;
    }

    public String getName() {
        return name;
    }

    public InputType getType() {
        return type;
    }

    public Block getSourceBlock() {
        return sourceBlock;
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public @Nullable Connection getConnection() {
        return connection;
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    @Override
    public String toString() {
        return "Input[" + sourceBlock.getId() + "." + name + "]";
    }
}
