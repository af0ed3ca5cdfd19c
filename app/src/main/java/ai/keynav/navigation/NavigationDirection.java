package ai.keynav.navigation;

/** Direction of travel of a cursor move. */
public enum NavigationDirection {
    NEXT,
    PREVIOUS,
    IN,
    OUT;

    /** True for directions that walk the pre-order forward. */
    public boolean isForward() {
        return this == NEXT || this == IN;
    }
}
