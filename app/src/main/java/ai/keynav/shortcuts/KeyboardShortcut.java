package ai.keynav.shortcuts;

import ai.keynav.blocks.Workspace;
import java.util.ArrayList;
import java.util.List;

/** A named command: the chords that trigger it, when it may run, and what it does. */
public final class KeyboardShortcut {
    /** Decides whether the shortcut may run. Must not change any state. */
    @FunctionalInterface
    public interface Precondition {
        boolean test(Workspace workspace, ShortcutScope scope);
    }

    /** Performs the command; returns true when the key was handled. */
    @FunctionalInterface
    public interface Callback {
        boolean run(Workspace workspace, KeyPress press, KeyboardShortcut shortcut, ShortcutScope scope);
    }

    private final String name;
    private final List<KeyChord> keys;
    private final Precondition precondition;
    private final Callback callback;
    private final boolean allowCollision;

    private KeyboardShortcut(Builder builder) {
        this.name = builder.name;
        this.keys = List.copyOf(builder.keys);
        this.precondition = builder.precondition;
        this.callback = builder.callback;
        this.allowCollision = builder.allowCollision;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<KeyChord> keys() {
        return keys;
    }

    public Precondition precondition() {
        return precondition;
    }

    public Callback callback() {
        return callback;
    }

    public boolean allowCollision() {
        return allowCollision;
    }

    @Override
    public String toString() {
        return "KeyboardShortcut[" + name + " " + keys + "]";
    }

    public static final class Builder {
        private final String name;
        private final List<KeyChord> keys = new ArrayList<>();
        private Precondition precondition = (workspace, scope) -> true;
        private Callback callback = (workspace, press, shortcut, scope) -> false;
        private boolean allowCollision;

        private Builder(String name) {
            if (name.isBlank()) {
                throw new IllegalArgumentException("Shortcut name must not be blank");
            }
            this.name = name;
        }

        public Builder keys(KeyChord... chords) {
            keys.addAll(List.of(chords));
            return this;
        }

        public Builder precondition(Precondition precondition) {
            this.precondition = precondition;
            return this;
        }

        public Builder callback(Callback callback) {
            this.callback = callback;
            return this;
        }

        public Builder allowCollision(boolean allowCollision) {
            this.allowCollision = allowCollision;
            return this;
        }

        public KeyboardShortcut build() {
            return new KeyboardShortcut(this);
        }
    }
}
