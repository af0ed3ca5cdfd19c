package ai.keynav.shortcuts;

import ai.keynav.blocks.Coordinate;
import org.jetbrains.annotations.Nullable;

/**
 * A key event being dispatched. Carries a pointer location when a context-menu item replays a shortcut, so paste
 * can drop content where the menu was opened.
 */
public final class KeyPress {
    private final KeyChord chord;
    private final @Nullable Coordinate pointerLocation;
    private boolean defaultPrevented;

    public KeyPress(KeyChord chord) {
        this(chord, null);
    }

    public KeyPress(KeyChord chord, @Nullable Coordinate pointerLocation) {
        this.chord = chord;
        this.pointerLocation = pointerLocation;
    }

    public static KeyPress of(int keyCode, KeyChord.Modifier... modifiers) {
        return new KeyPress(KeyChord.of(keyCode, modifiers));
    }

    public KeyChord chord() {
        return chord;
    }

    public @Nullable Coordinate pointerLocation() {
        return pointerLocation;
    }

    /** Asks the event source to skip its own handling of this key. */
    public void preventDefault() {
        defaultPrevented = true;
    }

    public boolean isDefaultPrevented() {
        return defaultPrevented;
    }

    @Override
    public String toString() {
        return "KeyPress[" + chord + (pointerLocation == null ? "" : " @" + pointerLocation) + "]";
    }
}
