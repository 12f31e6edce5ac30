import org.junit.jupiter.api.Test;

import com.rapcode.script.cfg.CfgBuilder;
import com.rapcode.script.cfg.CfgEdge;
import com.rapcode.script.cfg.CfgNode;
import com.rapcode.script.cfg.ControlFlowGraph;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Parser;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Statement.Break;
import com.rapcode.script.parser.Statement.Program;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowGraphTest {

    private static ControlFlowGraph graph(String src) {
        return CfgBuilder.build(Parser.parseProgram(src));
    }

    private static CfgNode only(ControlFlowGraph g, CfgNode.Kind kind) {
        List<CfgNode> found = g.nodesOfKind(kind);
        assertEquals(1, found.size(), "expected exactly one " + kind + " in " + g.nodes());
        return found.get(0);
    }

    private static CfgNode labelled(ControlFlowGraph g, String label) {
        for (CfgNode n : g.nodes()) {
            if (n.label.equals(label)) return n;
        }
        fail("no node labelled " + label + " in " + g.nodes());
        return null;
    }

    private static CfgEdge edge(ControlFlowGraph g, int from, int to) {
        for (CfgEdge e : g.outgoing(from)) {
            if (e.to == to) return e;
        }
        fail("no edge " + from + "->" + to + " in " + g.edges());
        return null;
    }

    @Test
    void emptyProgram_startToEnd() {
        ControlFlowGraph g = graph("");
        assertEquals(2, g.nodes().size());
        assertEquals(List.of(new CfgEdge(g.startId(), g.endId(), CfgEdge.Label.NONE)).toString(), g.edges().toString());
    }

    @Test
    void straightLine_chainsInOrder() {
        ControlFlowGraph g = graph("x := 1\nOUTPUT x");
        CfgNode assign = labelled(g, "x := 1");
        CfgNode output = labelled(g, "OUTPUT x");
        assertEquals(CfgNode.Kind.ASSIGNMENT, assign.kind);
        assertEquals(CfgNode.Kind.OUTPUT, output.kind);
        edge(g, g.startId(), assign.id);
        edge(g, assign.id, output.id);
        edge(g, output.id, g.endId());
        assertEquals(3, g.edges().size());
    }

    @Test
    void ifWithoutElse_falseEdgeGoesToMerge() {
        ControlFlowGraph g = graph("IF c THEN\n a := 1\nENDIF");
        CfgNode decision = only(g, CfgNode.Kind.DECISION);
        CfgNode merge = only(g, CfgNode.Kind.JUNCTION);
        CfgNode stmt = labelled(g, "a := 1");

        assertEquals("c", decision.label);
        assertEquals(2, g.outgoing(decision.id).size());
        assertEquals(CfgEdge.Label.TRUE, edge(g, decision.id, stmt.id).label);
        assertEquals(CfgEdge.Label.FALSE, edge(g, decision.id, merge.id).label);
        assertEquals(1, g.outgoing(stmt.id).size());
        assertEquals(CfgEdge.Label.NONE, edge(g, stmt.id, merge.id).label);
        edge(g, merge.id, g.endId());
    }

    @Test
    void ifElse_bothBranchesJoin() {
        ControlFlowGraph g = graph("IF c THEN\n OUTPUT 1\nELSE\n OUTPUT 2\nENDIF");
        CfgNode decision = only(g, CfgNode.Kind.DECISION);
        CfgNode merge = only(g, CfgNode.Kind.JUNCTION);
        CfgNode one = labelled(g, "OUTPUT 1");
        CfgNode two = labelled(g, "OUTPUT 2");
        assertEquals(CfgEdge.Label.TRUE, edge(g, decision.id, one.id).label);
        assertEquals(CfgEdge.Label.FALSE, edge(g, decision.id, two.id).label);
        assertEquals(2, g.incoming(merge.id).size());
    }

    @Test
    void unconditionalLoop_breakTargetsLoopExit() {
        ControlFlowGraph g = graph("LOOP\n x := 1\n BREAK\nENDLOOP\nOUTPUT x");
        CfgNode assign = labelled(g, "x := 1");
        CfgNode output = labelled(g, "OUTPUT x");
        CfgNode entry = g.node(g.outgoing(g.startId()).get(0).to);
        assertEquals(CfgNode.Kind.JUNCTION, entry.kind);
        edge(g, entry.id, assign.id);

        CfgNode breakNode = g.node(g.outgoing(assign.id).get(0).to);
        assertEquals(CfgNode.Kind.JUNCTION, breakNode.kind);
        List<CfgEdge> fromBreak = g.outgoing(breakNode.id);
        assertEquals(1, fromBreak.size());
        CfgNode loopExit = g.node(fromBreak.get(0).to);
        assertEquals(CfgNode.Kind.JUNCTION, loopExit.kind);
        edge(g, loopExit.id, output.id);

        // the body ends in BREAK, so there is no back edge
        assertTrue(g.incoming(entry.id).stream().allMatch(e -> e.from == g.startId()));
    }

    @Test
    void nestedBreak_exitsInnermostLoopOnly() {
        ControlFlowGraph g = graph("LOOP\n LOOP\n  BREAK\n ENDLOOP\n OUTPUT 1\nENDLOOP");
        CfgNode output = labelled(g, "OUTPUT 1");
        CfgNode innerExit = g.node(g.incoming(output.id).get(0).from);
        assertEquals(CfgNode.Kind.JUNCTION, innerExit.kind);

        int breaks = 0;
        for (CfgEdge e : g.incoming(innerExit.id)) {
            assertEquals(CfgNode.Kind.JUNCTION, g.node(e.from).kind);
            breaks++;
        }
        assertEquals(1, breaks);
    }

    @Test
    void emptyLoop_selfLoopsOnEntry() {
        ControlFlowGraph g = graph("LOOP\nENDLOOP");
        CfgNode entry = g.node(g.outgoing(g.startId()).get(0).to);
        assertEquals(List.of(entry.id), g.outgoing(entry.id).stream().map(e -> e.to).collect(java.util.stream.Collectors.toList()));
    }

    @Test
    void conditionalWhile_testsBeforeBody() {
        ControlFlowGraph g = graph("WHILE i < 3 DO\n i := i + 1\nENDLOOP");
        CfgNode test = only(g, CfgNode.Kind.DECISION);
        CfgNode body = labelled(g, "i := i + 1");
        assertEquals("i < 3", test.label);
        assertEquals(CfgEdge.Label.TRUE, edge(g, test.id, body.id).label);

        CfgEdge back = g.outgoing(body.id).get(0);
        assertEquals(CfgNode.Kind.JUNCTION, g.node(back.to).kind);
        edge(g, back.to, test.id);

        CfgEdge exit = g.outgoing(test.id).stream().filter(e -> e.label == CfgEdge.Label.FALSE).findFirst().orElseThrow();
        edge(g, exit.to, g.endId());
    }

    @Test
    void inputAssignment_hasInputKind() {
        ControlFlowGraph g = graph("n := INPUT(\"n?\")");
        assertEquals("n := INPUT(\"n?\")", only(g, CfgNode.Kind.INPUT).label);
    }

    @Test
    void strayBreak_isStructuralError() {
        Program p = new Program(List.of(new Break()));
        RapcodeException ex = assertThrows(RapcodeException.class, () -> CfgBuilder.build(p));
        assertEquals(ErrorKind.STRUCTURAL, ex.kind());
    }

    @Test
    void ifWhoseBranchesBothBreak_doesNotFallThrough() {
        ControlFlowGraph g = graph("LOOP\n  IF a THEN\n    BREAK\n  ELSE\n    BREAK\n  ENDIF\n  OUTPUT 1\nENDLOOP\nOUTPUT 2");
        CfgNode decision = labelled(g, "a");
        CfgNode merge = g.node(decision.id + 1);
        assertEquals(CfgNode.Kind.JUNCTION, merge.kind);

        assertTrue(g.incoming(merge.id).isEmpty(), g.edges().toString());
        assertTrue(g.outgoing(merge.id).isEmpty(), g.edges().toString());
        assertTrue(g.incoming(labelled(g, "OUTPUT 1").id).isEmpty(), g.edges().toString());
        // loop exit junction, reached by both breaks
        edge(g, g.node(decision.id - 1).id, labelled(g, "OUTPUT 2").id);
    }
}
