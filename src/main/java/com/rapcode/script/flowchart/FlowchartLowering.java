package com.rapcode.script.flowchart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.rapcode.debug.Debug;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Expr.ExprInterface;
import com.rapcode.script.parser.Expr.Identifier;
import com.rapcode.script.parser.Expr.Input;
import com.rapcode.script.parser.Expr.Literal;
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

/**
 * Lowers a structural flowchart into the statement AST.
 *
 * Decisions become IF statements. A loop with before-block B1, exit condition C and
 * after-block B2 becomes {@code While(TRUE, B1 ++ [If(C, [Break])] ++ B2)}, so the exit test
 * keeps its position inside the body. Node texts go through {@link Parser}, the same
 * expression grammar the Rapcode front end uses. Unknown node kinds are skipped with a warning.
 */
public class FlowchartLowering {
    private static final String TAG = "rapcode.flowchart";

    private final List<String> warnings = new ArrayList<>();

    public static LoweringResult lowerChart(FlowNode root) {
        FlowchartLowering lowering = new FlowchartLowering();
        Program program = lowering.lower(root);
        return new LoweringResult(program, lowering.warnings);
    }

    public Program lower(FlowNode root) {
        return new Program(lowerChain(root));
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** Lowers a node and everything reachable through its successor links. */
    List<Stmt> lowerChain(FlowNode first) {
        List<Stmt> out = new ArrayList<>();
        for (FlowNode node = first; node != null; node = node.successor) {
            lowerNode(node, out);
        }
        return out;
    }

    private void lowerNode(FlowNode node, List<Stmt> out) {
        switch (node.kind) {
            case START:
            case END:
                break;
            case ASSIGNMENT:
                out.add(assignment(node));
                break;
            case INPUT:
                out.add(input(node));
                break;
            case OUTPUT:
                out.add(new Output(expression(node, node.text)));
                break;
            case DECISION:
                out.add(new If(expression(node, node.text), lowerChain(node.left), lowerChain(node.right)));
                break;
            case LOOP:
                out.add(loop(node));
                break;
            default:
                skip(node);
                break;
        }
    }

    private Stmt loop(FlowNode node) {
        List<Stmt> body = new ArrayList<>(lowerChain(node.before));
        body.add(new If(expression(node, node.text), Collections.singletonList(new Break()), null));
        body.addAll(lowerChain(node.after));
        return new While(new Literal(Value.TRUE), body);
    }

    private Stmt assignment(FlowNode node) {
        try {
            return Parser.parseAssignmentText(node.text);
        } catch (RapcodeException e) {
            throw inNode(node, e);
        }
    }

    private Stmt input(FlowNode node) {
        ExprInterface target = expression(node, node.text);
        if (!(target instanceof Identifier)) {
            throw inNode(node, new RapcodeException(ErrorKind.SYNTAX,
                    "Input target must be a variable name.", target.at()));
        }
        return new Assignment((Identifier) target, new Input(prompt(node)));
    }

    private ExprInterface prompt(FlowNode node) {
        String prompt = (node.prompt == null) ? "" : node.prompt.trim();
        if (prompt.startsWith("\"")) return expression(node, prompt);
        return new Literal(Value.string(prompt));
    }

    private ExprInterface expression(FlowNode node, String text) {
        try {
            return Parser.parseExpressionText(text);
        } catch (RapcodeException e) {
            throw inNode(node, e);
        }
    }

    private void skip(FlowNode node) {
        String message = "Skipping unsupported flowchart node '" + node.sourceType + "'"
                + (node.text.isEmpty() ? "" : " (" + node.text + ")");
        warnings.add(message);
        Debug.get().w(TAG, message);
    }

    private static RapcodeException inNode(FlowNode node, RapcodeException e) {
        return new RapcodeException(e.kind(),
                "In flowchart " + node.sourceType + " '" + node.text + "': " + e.detail(),
                e.line(), e.column(), e);
    }
}
