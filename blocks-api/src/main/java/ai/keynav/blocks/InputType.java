package ai.keynav.blocks;

public enum InputType {
    VALUE,
    STATEMENT,
    /** Holds fields only, no connection. */
    DUMMY
}
