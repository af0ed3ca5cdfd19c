package ai.keynav.util;

import ai.keynav.shortcuts.KeyChord;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * User keyboard settings, stored in {@code keynav.properties}.
 *
 * <p>Keys: {@code keybinding.<shortcut name>} = {@code ;}-separated serialized chords (e.g.
 * {@code Control+90;Meta+90}), {@code navigation.loops} = boolean. Unreadable files and malformed values fall back to
 * the built-in defaults.
 */
public final class KeybindingSettings {
    private static final Logger logger = LogManager.getLogger(KeybindingSettings.class);

    public static final String FILE_NAME = "keynav.properties";
    private static final String KEYBIND_PREFIX = "keybinding.";
    private static final String KEY_NAVIGATION_LOOPS = "navigation.loops";
    private static final Splitter CHORD_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();

    private final @Nullable Path file;
    private final Properties props;

    /** Settings backed by {@code file}; a missing file means defaults. */
    public KeybindingSettings(Path file) {
        this.file = file;
        this.props = load(file);
    }

    private KeybindingSettings() {
        this.file = null;
        this.props = new Properties();
    }

    /** Settings from the global config directory. */
    public static KeybindingSettings loadDefault() {
        return new KeybindingSettings(KeynavConfigPaths.getGlobalConfigDir().resolve(FILE_NAME));
    }

    /** Defaults only; changes are kept in memory and never written. */
    public static KeybindingSettings inMemory() {
        return new KeybindingSettings();
    }

    private static Properties load(Path file) {
        var props = new Properties();
        if (!Files.exists(file)) {
            return props;
        }
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to load keybinding settings from {}: {}", file, e.getMessage());
        }
        return props;
    }

    /** Configured chords for a shortcut, or empty when nothing usable is configured. */
    public synchronized Optional<List<KeyChord>> getKeybindings(String shortcutName) {
        var raw = props.getProperty(KEYBIND_PREFIX + shortcutName);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var chords = new ArrayList<KeyChord>();
        for (var part : CHORD_SPLITTER.split(raw)) {
            try {
                chords.add(KeyChord.parse(part));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring malformed key chord '{}' for {}: {}", part, shortcutName, e.getMessage());
            }
        }
        return chords.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(chords));
    }

    public synchronized void saveKeybindings(String shortcutName, List<KeyChord> chords) {
        var value = chords.stream().map(KeyChord::serialize).collect(Collectors.joining(";"));
        props.setProperty(KEYBIND_PREFIX + shortcutName, value);
        save();
    }

    public synchronized void clearKeybindings(String shortcutName) {
        if (props.remove(KEYBIND_PREFIX + shortcutName) != null) {
            save();
        }
    }

    public synchronized boolean isNavigationLoops() {
        var raw = props.getProperty(KEY_NAVIGATION_LOOPS);
        if (raw == null || raw.isBlank()) {
            return true;
        }
        return Boolean.parseBoolean(raw.trim());
    }

    public synchronized void setNavigationLoops(boolean loops) {
        props.setProperty(KEY_NAVIGATION_LOOPS, Boolean.toString(loops));
        save();
    }

    private void save() {
        if (file == null) {
            return;
        }
        try {
            AtomicWrites.atomicSaveProperties(file, props, "Keynav keyboard settings");
        } catch (IOException e) {
            logger.warn("Failed to save keybinding settings to {}: {}", file, e.getMessage());
        }
    }
}
