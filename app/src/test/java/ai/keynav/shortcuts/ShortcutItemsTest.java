package ai.keynav.shortcuts;

import static ai.keynav.testutil.TestPrograms.chain;
import static ai.keynav.testutil.TestPrograms.plugValue;
import static org.junit.jupiter.api.Assertions.*;

import ai.keynav.KeyboardNavigation;
import ai.keynav.blocks.Block;
import ai.keynav.blocks.Coordinate;
import ai.keynav.blocks.FocusManager;
import ai.keynav.blocks.Workspace;
import ai.keynav.shortcuts.KeyChord.Modifier;
import ai.keynav.testutil.RecordingAnnouncer;
import ai.keynav.testutil.RecordingHistory;
import ai.keynav.util.KeybindingSettings;
import java.awt.event.KeyEvent;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShortcutItemsTest {
    private FocusManager focus;
    private RecordingAnnouncer announcer;
    private KeyboardNavigation navigation;
    private Workspace ws;

    // first -> second -> third, with a value block plugged into second's ARG input
    private Block first;
    private Block second;
    private Block third;
    private Block val;

    @BeforeEach
    void setUp() {
        focus = new FocusManager();
        announcer = new RecordingAnnouncer();
        navigation = new KeyboardNavigation(focus, announcer, KeybindingSettings.inMemory());
        ws = new Workspace("ws");

        first = stmt("first", "S1");
        second = stmt("second", "S2");
        third = stmt("third", "S3");
        chain(first, second, third);
        val = ws.newBlock("val", "V").setOutput(true);
        plugValue(second, "ARG", val);
    }

    private Block stmt(String type, String id) {
        return ws.newBlock(type, id).setPreviousStatement(true).setNextStatement(true);
    }

    private boolean press(Workspace workspace, int keyCode, Modifier... modifiers) {
        return navigation.onKeyDown(workspace, KeyPress.of(keyCode, modifiers));
    }

    private boolean press(int keyCode, Modifier... modifiers) {
        return press(ws, keyCode, modifiers);
    }

    @Test
    void registersEveryDefaultShortcut() {
        var names = navigation.getRegistry().getRegistry().keySet();
        assertEquals(19, names.size());
        assertTrue(names.containsAll(List.of(
                ShortcutNames.ESCAPE,
                ShortcutNames.DELETE,
                ShortcutNames.COPY,
                ShortcutNames.CUT,
                ShortcutNames.PASTE,
                ShortcutNames.UNDO,
                ShortcutNames.REDO,
                ShortcutNames.NEXT,
                ShortcutNames.PREVIOUS,
                ShortcutNames.IN,
                ShortcutNames.OUT)));
    }

    // ---------- escape ----------

    @Test
    void escapeHidesChaff() {
        var hidden = new AtomicInteger();
        ws.addChaffListener(hidden::incrementAndGet);

        assertTrue(press(KeyEvent.VK_ESCAPE));
        assertEquals(1, hidden.get());

        ws.setReadOnly(true);
        assertFalse(press(KeyEvent.VK_ESCAPE));
        assertEquals(1, hidden.get());
    }

    // ---------- delete ----------

    @Test
    void deleteRemovesFocusedBlockAndRecoversFocus() {
        focus.focusNode(second);
        var keyPress = KeyPress.of(KeyEvent.VK_DELETE);

        assertTrue(navigation.onKeyDown(ws, keyPress));
        assertTrue(keyPress.isDefaultPrevented());
        assertTrue(second.isDisposed());
        assertTrue(val.isDisposed());
        assertSame(third, first.getNextBlock());
        assertSame(first.getNextConnection(), focus.getFocusedNode());
    }

    @Test
    void backspaceAlsoDeletes() {
        focus.focusNode(third);
        assertTrue(press(KeyEvent.VK_BACK_SPACE));
        assertTrue(third.isDisposed());
    }

    @Test
    void deleteRefusedForProtectedBlocks() {
        focus.focusNode(second);
        second.setDeletable(false);
        assertFalse(press(KeyEvent.VK_DELETE));

        second.setDeletable(true);
        ws.setReadOnly(true);
        assertFalse(press(KeyEvent.VK_DELETE));
        assertFalse(second.isDisposed());
    }

    @Test
    void deleteRefusedDuringEphemeralFocusOrDrag() throws Exception {
        focus.focusNode(second);
        try (var session = focus.takeEphemeralFocus()) {
            assertFalse(press(KeyEvent.VK_DELETE));
        }
        ws.setDragging(true);
        assertFalse(press(KeyEvent.VK_DELETE));
        assertFalse(second.isDisposed());
    }

    @Test
    void deleteRemovesFocusedComment() {
        var note = ws.newComment("note");
        var after = stmt("after", "B");
        var cursor = navigation.getCursor(ws);
        cursor.setNavigationLoops(false);
        focus.focusNode(note);

        assertTrue(press(KeyEvent.VK_DELETE));
        assertTrue(note.isDisposed());
        assertFalse(ws.getTopItems().contains(note));
        assertSame(after, focus.getFocusedNode());

        assertSame(third.getNextConnection(), cursor.prev());
        assertSame(after, cursor.next());
        assertSame(after.getNextConnection(), cursor.next());
    }

    @Test
    void deletingTheLastCommentFocusesThePrecedingItem() {
        var note = ws.newComment("note");
        focus.focusNode(note);

        assertTrue(press(KeyEvent.VK_DELETE));
        assertSame(first, focus.getFocusedNode());
    }

    @Test
    void cutCommentMovesFocusToTheFollowingItem() {
        var note = ws.newComment("note");
        var after = stmt("after", "B");
        focus.focusNode(note);

        assertTrue(press(KeyEvent.VK_X, Modifier.CONTROL));
        assertTrue(note.isDisposed());
        assertSame(after, focus.getFocusedNode());
    }

    // ---------- clipboard ----------

    @Test
    void copyThenPasteOffsetsFromOriginal() {
        focus.focusNode(first);
        assertTrue(press(KeyEvent.VK_C, Modifier.CONTROL));
        assertEquals(Coordinate.ORIGIN, navigation.getClipboard().getLastCopiedLocation());

        assertTrue(press(KeyEvent.VK_V, Modifier.META));
        var pasted = (Block) focus.getFocusedNode();
        assertNotSame(first, pasted);
        assertEquals("first", pasted.getType());
        assertEquals(new Coordinate(20, 20), pasted.getRelativeToSurfaceXY());
        assertNull(pasted.getNextBlock());
    }

    @Test
    void pasteAtPointerLocation() {
        focus.focusNode(first);
        press(KeyEvent.VK_C, Modifier.CONTROL);

        var keyPress = new KeyPress(KeyChord.of(KeyEvent.VK_V, Modifier.CONTROL), new Coordinate(100, 50));
        assertTrue(navigation.onKeyDown(ws, keyPress));
        assertEquals(new Coordinate(100, 50), ((Block) focus.getFocusedNode()).getRelativeToSurfaceXY());
    }

    @Test
    void pasteOutsideViewportLandsInCenter() {
        var lone = stmt("lone", "L");
        lone.moveTo(new Coordinate(1000, 1000));
        focus.focusNode(lone);
        press(KeyEvent.VK_C, Modifier.CONTROL);

        assertTrue(press(KeyEvent.VK_V, Modifier.CONTROL));
        assertEquals(new Coordinate(400, 300), ((Block) focus.getFocusedNode()).getRelativeToSurfaceXY());
    }

    @Test
    void copyFromFlyoutPastesIntoTargetWorkspace() {
        var flyout = Workspace.flyout("flyout", ws);
        var template = flyout.newBlock("template");
        focus.focusNode(template);

        assertTrue(press(flyout, KeyEvent.VK_C, Modifier.CONTROL));
        assertNull(navigation.getClipboard().getLastCopiedLocation());

        assertTrue(press(ws, KeyEvent.VK_V, Modifier.CONTROL));
        var pasted = (Block) focus.getFocusedNode();
        assertSame(ws, pasted.getWorkspace());
        assertEquals("template", pasted.getType());
        assertTrue(flyout.getTopBlocks().contains(template));
    }

    @Test
    void pasteRequiresClipboardContent() {
        focus.focusNode(first);
        assertFalse(press(KeyEvent.VK_V, Modifier.CONTROL));
    }

    @Test
    void pasteRefusedWhileTargetReadOnly() {
        focus.focusNode(first);
        press(KeyEvent.VK_C, Modifier.CONTROL);
        ws.setReadOnly(true);

        assertFalse(press(KeyEvent.VK_V, Modifier.CONTROL));
        assertSame(first, focus.getFocusedNode());
    }

    @Test
    void cutCopiesAndDeletes() {
        var lone = stmt("lone", "L");
        focus.focusNode(lone);

        assertTrue(press(KeyEvent.VK_X, Modifier.CONTROL));
        assertTrue(lone.isDisposed());
        assertNotNull(navigation.getClipboard().getLastCopiedData());
        assertSame(ws, focus.getFocusedNode());

        assertTrue(press(KeyEvent.VK_V, Modifier.CONTROL));
        assertEquals("lone", ((Block) focus.getFocusedNode()).getType());
    }

    @Test
    void cutRefusedInReadOnlyWorkspace() {
        focus.focusNode(third);
        ws.setReadOnly(true);
        assertFalse(press(KeyEvent.VK_X, Modifier.CONTROL));
        assertFalse(third.isDisposed());
    }

    @Test
    void copyabilityFollowsOwnFlags() {
        assertTrue(ShortcutItems.isCopyable(first));
        assertTrue(ShortcutItems.isCopyable(ws.newComment("c")));
        assertFalse(ShortcutItems.isCopyable(first.getNextConnection()));
        assertFalse(ShortcutItems.isCopyable(null));

        first.setMovable(false);
        assertFalse(ShortcutItems.isCopyable(first));

        ws.setReadOnly(true);
        assertTrue(ShortcutItems.isCopyable(third));
        assertFalse(ShortcutItems.isCuttable(third));
    }

    // ---------- history ----------

    @Test
    void undoAndRedoReplayHistory() {
        var history = new RecordingHistory();
        ws.setUndoHistory(history);

        assertTrue(press(KeyEvent.VK_Z, Modifier.CONTROL));
        assertTrue(press(KeyEvent.VK_Z, Modifier.META, Modifier.SHIFT));
        assertTrue(press(KeyEvent.VK_Y, Modifier.CONTROL));
        assertFalse(press(KeyEvent.VK_Y, Modifier.META));

        assertEquals(List.of(false, true, true), history.calls);
    }

    @Test
    void undoRefusedWhileDragging() {
        var history = new RecordingHistory();
        ws.setUndoHistory(history);
        ws.setDragging(true);

        assertFalse(press(KeyEvent.VK_Z, Modifier.CONTROL));
        assertTrue(history.calls.isEmpty());
    }

    // ---------- summaries ----------

    @Test
    void parentSummaryDescribesEnclosingBlocks() {
        assertEquals("Parent blocks: first,second", ShortcutItems.parentSummary(val));
        assertEquals("Current block has no parent", ShortcutItems.parentSummary(first));
        assertEquals("Parent blocks: first,Current block: second", ShortcutItems.parentSummary(second));
    }

    @Test
    void summaryShortcutsAnnounce() {
        focus.focusNode(second);
        assertTrue(press(KeyEvent.VK_I));
        assertEquals("Current block: second (val)", announcer.last());

        assertTrue(press(KeyEvent.VK_I, Modifier.SHIFT));
        assertEquals("Parent blocks: first,Current block: second", announcer.last());
    }

    @Test
    void summaryNeedsABlock() {
        focus.focusNode(ws);
        assertFalse(press(KeyEvent.VK_I));
        assertTrue(announcer.announcements.isEmpty());
    }

    // ---------- jumps ----------

    @Test
    void jumpsWithinStack() {
        focus.focusNode(val);
        assertTrue(press(KeyEvent.VK_PAGE_UP));
        assertSame(first, focus.getFocusedNode());

        assertTrue(press(KeyEvent.VK_PAGE_DOWN));
        assertSame(third, focus.getFocusedNode());
    }

    @Test
    void jumpsWithinBlock() {
        focus.focusNode(third.getNextConnection());
        assertTrue(press(KeyEvent.VK_HOME));
        assertSame(third, focus.getFocusedNode());

        focus.focusNode(second);
        assertTrue(press(KeyEvent.VK_END));
        assertSame(second.getInput("ARG").getConnection(), focus.getFocusedNode());

        focus.focusNode(third);
        assertFalse(press(KeyEvent.VK_END));
    }

    @Test
    void jumpsAcrossWorkspace() {
        var other = stmt("other", "T");
        focus.focusNode(val);

        assertTrue(press(KeyEvent.VK_END, Modifier.CONTROL));
        assertSame(other, focus.getFocusedNode());

        assertTrue(press(KeyEvent.VK_HOME, Modifier.META));
        assertSame(first, focus.getFocusedNode());
    }

    @Test
    void blockJumpsDisabledInFlyout() {
        var flyout = Workspace.flyout("flyout", ws);
        var template = flyout.newBlock("template");
        template.appendValueInput("IN");
        focus.focusNode(template);

        assertFalse(press(flyout, KeyEvent.VK_END));
        assertFalse(press(flyout, KeyEvent.VK_HOME));
        assertSame(template, focus.getFocusedNode());
    }

    // ---------- cursor movement ----------

    @Test
    void arrowKeysMoveTheCursor() {
        focus.focusNode(first);
        var down = KeyPress.of(KeyEvent.VK_DOWN);

        assertTrue(navigation.onKeyDown(ws, down));
        assertTrue(down.isDefaultPrevented());
        assertSame(second, focus.getFocusedNode());

        assertTrue(press(KeyEvent.VK_RIGHT));
        assertSame(val, focus.getFocusedNode());
        assertTrue(press(KeyEvent.VK_LEFT));
        assertSame(second, focus.getFocusedNode());
        assertTrue(press(KeyEvent.VK_UP));
        assertSame(first, focus.getFocusedNode());
    }

    @Test
    void arrowKeysNeedFocusAndIdleWorkspace() {
        assertFalse(press(KeyEvent.VK_DOWN));

        focus.focusNode(first);
        ws.setDragging(true);
        assertFalse(press(KeyEvent.VK_DOWN));
        assertSame(first, focus.getFocusedNode());
    }

    @Test
    void arrowKeyHandledEvenWithNowhereToGo() {
        navigation.getCursor(ws).setNavigationLoops(false);
        focus.focusNode(third.getNextConnection());

        assertTrue(press(KeyEvent.VK_DOWN));
        assertSame(third.getNextConnection(), focus.getFocusedNode());
    }
}
