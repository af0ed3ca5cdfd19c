package ai.keynav.shortcuts;

import com.google.common.base.Splitter;
import java.awt.event.InputEvent;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A key plus held modifiers. Key codes are AWT virtual key codes ({@code KeyEvent.VK_*}). The serialized form lists
 * modifiers in {@link Modifier} order followed by the key code, e.g. {@code Shift+Control+90}.
 */
public record KeyChord(int keyCode, Set<Modifier> modifiers) {
    private static final Splitter PLUS = Splitter.on('+').trimResults().omitEmptyStrings();

    public enum Modifier {
        SHIFT("Shift", InputEvent.SHIFT_DOWN_MASK),
        CONTROL("Control", InputEvent.CTRL_DOWN_MASK),
        ALT("Alt", InputEvent.ALT_DOWN_MASK),
        META("Meta", InputEvent.META_DOWN_MASK);

        private final String displayName;
        private final int downMask;

        Modifier(String displayName, int downMask) {
            this.displayName = displayName;
            this.downMask = downMask;
        }

        public String displayName() {
            return displayName;
        }

        public int downMask() {
            return downMask;
        }

        static Modifier fromName(String name) {
            for (var modifier : values()) {
                if (modifier.displayName.equalsIgnoreCase(name)) {
                    return modifier;
                }
            }
            throw new IllegalArgumentException("Unknown modifier: " + name);
        }
    }

    public KeyChord {
        modifiers = modifiers.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Modifier.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
    }

    public static KeyChord of(int keyCode, Modifier... modifiers) {
        return new KeyChord(keyCode, Set.copyOf(Arrays.asList(modifiers)));
    }

    /** Builds a chord from an AWT key code and extended modifier mask ({@code InputEvent.getModifiersEx()}). */
    public static KeyChord fromAwt(int keyCode, int modifiersEx) {
        var modifiers = EnumSet.noneOf(Modifier.class);
        for (var modifier : Modifier.values()) {
            if ((modifiersEx & modifier.downMask) != 0) {
                modifiers.add(modifier);
            }
        }
        return new KeyChord(keyCode, modifiers);
    }

    public int toAwtModifiers() {
        int mask = 0;
        for (var modifier : modifiers) {
            mask |= modifier.downMask;
        }
        return mask;
    }

    public String serialize() {
        if (modifiers.isEmpty()) {
            return Integer.toString(keyCode);
        }
        return modifiers.stream().map(Modifier::displayName).collect(Collectors.joining("+")) + "+" + keyCode;
    }

    /**
     * Parses the serialized form. Modifier names are case-insensitive and may appear in any order.
     *
     * @throws IllegalArgumentException if the text is empty, names an unknown modifier or has no numeric key code
     */
    public static KeyChord parse(String text) {
        var parts = PLUS.splitToList(text);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Empty key chord");
        }
        var keyPart = parts.get(parts.size() - 1);
        int keyCode;
        try {
            keyCode = Integer.parseInt(keyPart);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid key code '%s' in chord '%s'".formatted(keyPart, text), e);
        }
        var modifiers = EnumSet.noneOf(Modifier.class);
        for (var name : parts.subList(0, parts.size() - 1)) {
            modifiers.add(Modifier.fromName(name));
        }
        return new KeyChord(keyCode, modifiers);
    }

    @Override
    public String toString() {
        return serialize();
    }
}
