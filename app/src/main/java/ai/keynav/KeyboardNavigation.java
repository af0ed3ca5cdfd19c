package ai.keynav;

import ai.keynav.blocks.Announcer;
import ai.keynav.blocks.Clipboard;
import ai.keynav.blocks.FocusHolder;
import ai.keynav.blocks.Workspace;
import ai.keynav.navigation.LineCursor;
import ai.keynav.shortcuts.KeyPress;
import ai.keynav.shortcuts.ShortcutItems;
import ai.keynav.shortcuts.ShortcutRegistry;
import ai.keynav.shortcuts.ShortcutScope;
import ai.keynav.util.KeybindingSettings;
import java.util.IdentityHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for keyboard control of one editor: owns the shortcut registry, the clipboard and one {@link LineCursor}
 * per workspace. Each instance is independent of every other.
 */
public class KeyboardNavigation {
    private static final Logger logger = LogManager.getLogger(KeyboardNavigation.class);

    private final FocusHolder focusHolder;
    private final KeybindingSettings settings;
    private final Clipboard clipboard = new Clipboard();
    private final ShortcutRegistry registry = new ShortcutRegistry();
    private final Map<Workspace, LineCursor> cursors = new IdentityHashMap<>();

    public KeyboardNavigation(FocusHolder focusHolder, Announcer announcer, KeybindingSettings settings) {
        this.focusHolder = focusHolder;
        this.settings = settings;
        new ShortcutItems(focusHolder, clipboard, announcer, this::getCursor).registerDefaults(registry);
        registry.applyOverrides(settings);
    }

    /** The workspace's cursor, created on first use and registered as the workspace's deletion observer. */
    public LineCursor getCursor(Workspace workspace) {
        return cursors.computeIfAbsent(workspace, ws -> {
            var cursor = new LineCursor(ws, focusHolder);
            cursor.setNavigationLoops(settings.isNavigationLoops());
            ws.setDeletionObserver(cursor);
            logger.debug("Created cursor for workspace {}", ws.getFocusableId());
            return cursor;
        });
    }

    /** Dispatches a key press in {@code workspace}. Returns true when a shortcut handled it. */
    public boolean onKeyDown(Workspace workspace, KeyPress press) {
        getCursor(workspace);
        return registry.onKeyDown(workspace, press, new ShortcutScope(focusHolder.getFocusedNode()));
    }

    public ShortcutRegistry getRegistry() {
        return registry;
    }

    public Clipboard getClipboard() {
        return clipboard;
    }

    public FocusHolder getFocusHolder() {
        return focusHolder;
    }
}
