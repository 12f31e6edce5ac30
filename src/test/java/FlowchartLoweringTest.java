import org.junit.jupiter.api.Test;

import com.rapcode.script.flowchart.FlowNode;
import com.rapcode.script.flowchart.FlowchartLowering;
import com.rapcode.script.flowchart.LoweringResult;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Expr;
import com.rapcode.script.parser.Parser;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Statement.Assignment;
import com.rapcode.script.parser.Statement.Break;
import com.rapcode.script.parser.Statement.If;
import com.rapcode.script.parser.Statement.Output;
import com.rapcode.script.parser.Statement.Program;
import com.rapcode.script.parser.Statement.Stmt;
import com.rapcode.script.parser.Statement.While;
import com.rapcode.script.parser.Value;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FlowchartLoweringTest {

    private static Program lower(FlowNode chart) {
        return FlowchartLowering.lowerChart(chart).program();
    }

    private static Stmt assign(String text) { return Parser.parseAssignmentText(text); }

    private static If exitTest(String cond) {
        return new If(Parser.parseExpressionText(cond), List.of(new Break()), null);
    }

    private static While loopOf(List<Stmt> before, String cond, List<Stmt> after) {
        List<Stmt> body = new ArrayList<>(before);
        body.add(exitTest(cond));
        body.addAll(after);
        return new While(new Expr.Literal(Value.TRUE), body);
    }

    @Test
    void sequence_skipsStartAndEnd() {
        FlowNode chart = FlowNode.start(
                FlowNode.assignment("x := 1",
                        FlowNode.output("x * 2", FlowNode.end())));
        assertEquals(new Program(List.of(assign("x := 1"), new Output(Parser.parseExpressionText("x * 2")))),
                lower(chart));
    }

    @Test
    void emptyChart_lowersToEmptyProgram() {
        assertEquals(new Program(List.of()), lower(FlowNode.start(FlowNode.end())));
    }

    @Test
    void loop_exitTestSitsBetweenBeforeAndAfter() {
        FlowNode before = FlowNode.assignment("a := a + 1", null);
        FlowNode after = FlowNode.assignment("b := b + 1", null);

        assertEquals(new Program(List.of(loopOf(List.of(), "x > 3", List.of()))),
                lower(FlowNode.start(FlowNode.loop(null, "x > 3", null, null))));
        assertEquals(new Program(List.of(loopOf(List.of(assign("a := a + 1")), "x > 3", List.of()))),
                lower(FlowNode.start(FlowNode.loop(before, "x > 3", null, null))));
        assertEquals(new Program(List.of(loopOf(List.of(), "x > 3", List.of(assign("b := b + 1"))))),
                lower(FlowNode.start(FlowNode.loop(null, "x > 3", after, null))));
        assertEquals(new Program(List.of(loopOf(List.of(assign("a := a + 1")), "x > 3", List.of(assign("b := b + 1"))))),
                lower(FlowNode.start(FlowNode.loop(before, "x > 3", after, null))));
    }

    @Test
    void decision_branches() {
        FlowNode onlyLeft = FlowNode.decision("x = 1", FlowNode.output("\"one\"", null), null, null);
        If lowered = (If) lower(FlowNode.start(onlyLeft)).body.get(0);
        assertEquals(1, lowered.consequent.size());
        assertFalse(lowered.hasAlternate());

        FlowNode onlyRight = FlowNode.decision("x = 1", null, FlowNode.output("\"other\"", null), null);
        If inverted = (If) lower(FlowNode.start(onlyRight)).body.get(0);
        assertTrue(inverted.consequent.isEmpty());
        assertEquals(List.of(new Output(new Expr.Literal(Value.string("other")))), inverted.alternate);
    }

    @Test
    void inputNode_promptForms() {
        Program p = lower(FlowNode.start(
                FlowNode.input("a", "\"Age?\"",
                        FlowNode.input("b", "Name please",
                                FlowNode.input("c", null, null)))));
        assertEquals(new Assignment(new Expr.Identifier("a"), new Expr.Input(new Expr.Literal(Value.string("Age?")))),
                p.body.get(0));
        assertEquals(new Assignment(new Expr.Identifier("b"), new Expr.Input(new Expr.Literal(Value.string("Name please")))),
                p.body.get(1));
        assertEquals(new Assignment(new Expr.Identifier("c"), new Expr.Input(new Expr.Literal(Value.string("")))),
                p.body.get(2));
    }

    @Test
    void unknownNode_isSkippedWithWarning() {
        LoweringResult result = FlowchartLowering.lowerChart(FlowNode.start(
                FlowNode.unknown("Comment_Box", "note", FlowNode.output("1", null))));
        assertEquals(new Program(List.of(new Output(new Expr.Literal(Value.number(1))))), result.program());
        assertEquals(List.of("Skipping unsupported flowchart node 'Comment_Box' (note)"), result.warnings());
    }

    @Test
    void badNodeText_namesTheNode() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> lower(FlowNode.start(FlowNode.assignment("x = = 1", null))));
        assertEquals(ErrorKind.SYNTAX, ex.kind());
        assertTrue(ex.detail().startsWith("In flowchart Rectangle 'x = = 1': "), ex.detail());
    }

    @Test
    void inputIntoNonVariable_namesTheNodeAndPosition() {
        RapcodeException ex = assertThrows(RapcodeException.class,
                () -> lower(FlowNode.start(FlowNode.input("a + b", "\"Value?\"", null))));
        assertEquals(ErrorKind.SYNTAX, ex.kind());
        assertEquals("In flowchart Parallelogram 'a + b': Input target must be a variable name.", ex.detail());
        assertEquals(1, ex.line());
        assertTrue(ex.column() > 0, "column " + ex.column());
    }

    @Test
    void deepSuccessorChain_doesNotOverflow() {
        FlowNode tail = FlowNode.end();
        for (int i = 0; i < 20000; i++) tail = FlowNode.output("1", tail);
        assertEquals(20000, lower(FlowNode.start(tail)).body.size());
    }
}
