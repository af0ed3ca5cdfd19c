package ai.keynav.blocks;

/** An editable value shown on a block (text, number, dropdown...). */
public final class Field implements FocusableNode {
    private final String name;
    private final Input parentInput;
    private String value;

    Field(String name, String value, Input parentInput) {
        this.name = name;
        this.value = value;
        this.parentInput = parentInput;
    }

    @Override
    public String getFocusableId() {
        return getSourceBlock().getId() + "." + name;
    }

    @Override
    public Workspace getWorkspace() {
        return getSourceBlock().getWorkspace();
    }

    public Block getSourceBlock() {
        return parentInput.getSourceBlock();
    }

    public Input getParentInput() {
        return parentInput;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "Field[" + getFocusableId() + "=" + value + "]";
    }
}
