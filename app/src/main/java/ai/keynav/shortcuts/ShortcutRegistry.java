package ai.keynav.shortcuts;

import ai.keynav.blocks.Workspace;
import ai.keynav.util.KeybindingSettings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shortcuts by name plus the chord-to-names key map used for dispatch. When several shortcuts share a chord, the most
 * recently mapped one is tried first.
 *
 * <p>One registry belongs to one {@code KeyboardNavigation}; nothing here is static.
 */
public class ShortcutRegistry {
    private static final Logger logger = LogManager.getLogger(ShortcutRegistry.class);

    private final Map<String, KeyboardShortcut> shortcuts = new LinkedHashMap<>();
    private final Map<KeyChord, List<String>> keyMap = new LinkedHashMap<>();

    public void register(KeyboardShortcut shortcut) {
        register(shortcut, false);
    }

    /**
     * Registers {@code shortcut} and maps its chords.
     *
     * @param allowOverrides replace an existing shortcut of the same name, dropping its chord mappings
     * @throws IllegalArgumentException if the name is taken and overrides are not allowed, or a chord collides
     */
    public void register(KeyboardShortcut shortcut, boolean allowOverrides) {
        var name = shortcut.name();
        if (shortcuts.containsKey(name)) {
            if (!allowOverrides) {
                throw new IllegalArgumentException("Shortcut named \"%s\" already exists.".formatted(name));
            }
            removeAllKeyMappings(name);
        }
        shortcuts.put(name, shortcut);
        for (var chord : shortcut.keys()) {
            addKeyMapping(chord, name, shortcut.allowCollision());
        }
    }

    /** Removes the shortcut and its chord mappings. Returns false when no such shortcut exists. */
    public boolean unregister(String name) {
        if (shortcuts.remove(name) == null) {
            logger.warn("Keyboard shortcut named \"{}\" not found.", name);
            return false;
        }
        removeAllKeyMappings(name);
        return true;
    }

    /**
     * Maps {@code chord} to the shortcut {@code name}, ahead of any shortcut already mapped to it.
     *
     * @throws IllegalArgumentException if the chord is already mapped and {@code allowCollision} is false
     */
    public void addKeyMapping(KeyChord chord, String name, boolean allowCollision) {
        var names = keyMap.get(chord);
        if (names != null && !names.isEmpty() && !allowCollision) {
            throw new IllegalArgumentException("Shortcut named \"%s\" collides with shortcuts \"%s\""
                    .formatted(name, String.join(", ", names)));
        }
        keyMap.computeIfAbsent(chord, k -> new ArrayList<>()).add(0, name);
    }

    public boolean removeKeyMapping(KeyChord chord, String name) {
        var names = keyMap.get(chord);
        if (names == null || !names.remove(name)) {
            logger.warn("No keyboard shortcut named \"{}\" registered with key {}", name, chord);
            return false;
        }
        if (names.isEmpty()) {
            keyMap.remove(chord);
        }
        return true;
    }

    public void removeAllKeyMappings(String name) {
        var iterator = keyMap.entrySet().iterator();
        while (iterator.hasNext()) {
            var names = iterator.next().getValue();
            names.remove(name);
            if (names.isEmpty()) {
                iterator.remove();
            }
        }
    }

    /** Replaces the whole key map. Names in {@code newKeyMap} are kept in the given priority order. */
    public void setKeyMap(Map<KeyChord, List<String>> newKeyMap) {
        keyMap.clear();
        newKeyMap.forEach((chord, names) -> {
            if (!names.isEmpty()) {
                keyMap.put(chord, new ArrayList<>(names));
            }
        });
    }

    public Map<KeyChord, List<String>> getKeyMap() {
        var copy = new LinkedHashMap<KeyChord, List<String>>();
        keyMap.forEach((chord, names) -> copy.put(chord, List.copyOf(names)));
        return Collections.unmodifiableMap(copy);
    }

    public Map<String, KeyboardShortcut> getRegistry() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(shortcuts));
    }

    public List<String> getShortcutNamesByKey(KeyChord chord) {
        var names = keyMap.get(chord);
        return names == null ? List.of() : List.copyOf(names);
    }

    public List<KeyChord> getKeysByShortcutName(String name) {
        var keys = new ArrayList<KeyChord>();
        keyMap.forEach((chord, names) -> {
            if (names.contains(name)) {
                keys.add(chord);
            }
        });
        return keys;
    }

    /**
     * Runs the first shortcut mapped to the pressed chord whose precondition holds.
     *
     * @return the callback's result, or false when no shortcut was admitted
     */
    public boolean onKeyDown(Workspace workspace, KeyPress press, ShortcutScope scope) {
        var names = keyMap.get(press.chord());
        if (names == null) {
            return false;
        }
        for (var name : List.copyOf(names)) {
            var shortcut = shortcuts.get(name);
            if (shortcut == null) {
                logger.debug("Key map entry {} -> {} has no registered shortcut", press.chord(), name);
                continue;
            }
            if (!shortcut.precondition().test(workspace, scope)) {
                continue;
            }
            boolean handled = shortcut.callback().run(workspace, press, shortcut, scope);
            logger.debug("Shortcut {} ran for {} (handled={})", name, press.chord(), handled);
            return handled;
        }
        return false;
    }

    /** Remaps every registered shortcut that has configured chords; configured chords may collide. */
    public void applyOverrides(KeybindingSettings settings) {
        for (var name : List.copyOf(shortcuts.keySet())) {
            settings.getKeybindings(name).ifPresent(chords -> {
                removeAllKeyMappings(name);
                for (var chord : chords) {
                    addKeyMapping(chord, name, true);
                }
                logger.debug("Keybinding override for {}: {}", name, chords);
            });
        }
    }
}
