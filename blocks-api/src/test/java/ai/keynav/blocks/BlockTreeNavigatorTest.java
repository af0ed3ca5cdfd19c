package ai.keynav.blocks;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BlockTreeNavigatorTest {
    private Workspace ws;
    private NodeNavigator nav;
    private Block s1;
    private Block s2;
    private Block s3;
    private WorkspaceComment note;

    @BeforeEach
    void setUp() {
        ws = new Workspace("ws");
        s1 = statement("S1");
        s2 = statement("S2");
        s3 = statement("S3");
        s1.getNextConnection().connect(s2.getPreviousConnection());
        s2.getNextConnection().connect(s3.getPreviousConnection());
        note = ws.newComment("note");
        nav = ws.getNavigator();
    }

    private Block statement(String id) {
        return ws.newBlock("stmt", id).setPreviousStatement(true).setNextStatement(true);
    }

    @Test
    void workspaceChildrenFlattenStacksThenComments() {
        assertSame(s1, nav.getFirstChild(ws));
        assertSame(s2, nav.getNextSibling(s1));
        assertSame(s3, nav.getNextSibling(s2));
        assertSame(note, nav.getNextSibling(s3));
        assertNull(nav.getNextSibling(note));
        assertNull(nav.getPreviousSibling(s1));
        assertSame(s3, nav.getPreviousSibling(note));
    }

    @Test
    void stackBlocksHaveWorkspaceAsParent() {
        assertSame(ws, nav.getParent(s1));
        assertSame(ws, nav.getParent(s2));
        assertSame(ws, nav.getParent(note));
        assertNull(nav.getParent(ws));
    }

    @Test
    void onlyFreeNextConnectionIsListed() {
        assertNull(nav.getFirstChild(s1), "connected next connection is not a child");
        assertSame(s3.getNextConnection(), nav.getFirstChild(s3));
        assertSame(s3, nav.getParent(s3.getNextConnection()));
    }

    @Test
    void connectedNextConnectionSitsAfterLastChild() {
        var connection = s1.getNextConnection();
        assertNull(nav.getNextSibling(connection));
        assertNull(nav.getPreviousSibling(connection));
    }

    @Test
    void blockChildrenFollowInputOrder() {
        var ctrl = ws.newBlock("if", "IF").setPreviousStatement(true).setNextStatement(true);
        ctrl.appendValueInput("COND").appendField("label", "if");
        ctrl.appendStatementInput("DO");
        var v = ws.newBlock("bool", "V").setOutput(true);
        var a = statement("A");
        var b = statement("B");
        ctrl.getInput("COND").getConnection().connect(v.getOutputConnection());
        a.getNextConnection().connect(b.getPreviousConnection());
        ctrl.getInput("DO").getConnection().connect(a.getPreviousConnection());

        var label = ctrl.getField("label");
        assertSame(label, nav.getFirstChild(ctrl));
        assertSame(v, nav.getNextSibling(label));
        assertSame(a, nav.getNextSibling(v));
        assertSame(b, nav.getNextSibling(a));
        assertSame(ctrl.getNextConnection(), nav.getNextSibling(b));
        assertSame(v, nav.getPreviousSibling(a));

        assertSame(ctrl, nav.getParent(v));
        assertSame(ctrl, nav.getParent(a));
        assertSame(ctrl, nav.getParent(b), "stack members share the surrounding block as parent");
        assertSame(ctrl, nav.getParent(label));
    }

    @Test
    void connectedInputConnectionSitsBeforeItsContent() {
        var ctrl = ws.newBlock("if", "IF").setPreviousStatement(true);
        ctrl.appendValueInput("COND").appendField("label", "if");
        var v = ws.newBlock("bool", "V").setOutput(true);
        var cond = ctrl.getInput("COND").getConnection();
        cond.connect(v.getOutputConnection());

        assertSame(v, nav.getNextSibling(cond));
        assertSame(ctrl.getField("label"), nav.getPreviousSibling(cond));
    }

    @Test
    void emptyInputConnectionIsListed() {
        var ctrl = ws.newBlock("if", "IF");
        ctrl.appendValueInput("COND");
        ctrl.appendStatementInput("DO");
        var cond = ctrl.getInput("COND").getConnection();
        var body = ctrl.getInput("DO").getConnection();

        assertSame(cond, nav.getFirstChild(ctrl));
        assertSame(body, nav.getNextSibling(cond));
        assertNull(nav.getNextSibling(body));
    }

    @Test
    void hiddenInputsAreSkipped() {
        var ctrl = ws.newBlock("if", "IF");
        ctrl.appendValueInput("COND").appendField("label", "if");
        ctrl.appendDummyInput("TAIL").appendField("tail", "end");
        ctrl.getInput("COND").setVisible(false);

        assertSame(ctrl.getField("tail"), nav.getFirstChild(ctrl));
    }

    @Test
    void previousConnectionSitsBeforeFirstChild() {
        assertSame(s3.getNextConnection(), nav.getNextSibling(s3.getPreviousConnection()));
        assertNull(nav.getPreviousSibling(s3.getPreviousConnection()));
    }
}
