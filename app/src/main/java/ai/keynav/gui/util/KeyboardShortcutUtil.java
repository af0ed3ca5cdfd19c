package ai.keynav.gui.util;

import ai.keynav.KeyboardNavigation;
import ai.keynav.blocks.Workspace;
import ai.keynav.shortcuts.KeyChord;
import ai.keynav.shortcuts.KeyPress;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.event.KeyListener;
import java.util.function.Supplier;
import javax.swing.JComponent;
import javax.swing.KeyStroke;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Bridges Swing key events to {@link KeyboardNavigation}. */
public class KeyboardShortcutUtil {
    private static final Logger logger = LogManager.getLogger(KeyboardShortcutUtil.class);

    private KeyboardShortcutUtil() {}

    public static KeyChord toChord(KeyEvent event) {
        return KeyChord.fromAwt(event.getKeyCode(), event.getModifiersEx());
    }

    public static KeyChord toChord(KeyStroke keyStroke) {
        return KeyChord.fromAwt(keyStroke.getKeyCode(), keyStroke.getModifiers());
    }

    public static KeyStroke toKeyStroke(KeyChord chord) {
        return KeyStroke.getKeyStroke(chord.keyCode(), chord.toAwtModifiers());
    }

    /** Human-readable form such as {@code Control+Z}, for menus and help text. */
    public static String formatChord(KeyChord chord) {
        var sb = new StringBuilder();
        for (var modifier : chord.modifiers()) {
            sb.append(modifier.displayName()).append('+');
        }
        return sb.append(KeyEvent.getKeyText(chord.keyCode())).toString();
    }

    /**
     * Dispatches key presses on {@code component} through {@code navigation}. Events the navigation handles, or whose
     * default it prevents, are consumed.
     *
     * @param workspaceSupplier the workspace the component shows; null while none is shown
     * @return the installed listener, for later removal
     */
    public static KeyListener installKeyboardNavigation(
            JComponent component, KeyboardNavigation navigation, Supplier<@Nullable Workspace> workspaceSupplier) {
        var listener = new KeyAdapter() {
            @Override
            public void keyPressed(KeyEvent e) {
                var workspace = workspaceSupplier.get();
                if (workspace == null) {
                    return;
                }
                var press = new KeyPress(toChord(e));
                boolean handled = navigation.onKeyDown(workspace, press);
                if (handled || press.isDefaultPrevented()) {
                    logger.trace("Consumed {}", press);
                    e.consume();
                }
            }
        };
        component.addKeyListener(listener);
        return listener;
    }
}
