package com.rapcode.script.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.rapcode.debug.Debug;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Expr;
import com.rapcode.script.parser.ExprPrinter;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Statement.Assignment;
import com.rapcode.script.parser.Statement.Break;
import com.rapcode.script.parser.Statement.If;
import com.rapcode.script.parser.Statement.Output;
import com.rapcode.script.parser.Statement.Program;
import com.rapcode.script.parser.Statement.Stmt;
import com.rapcode.script.parser.Statement.StmtVisitor;
import com.rapcode.script.parser.Statement.While;

/**
 * Builds the control-flow graph of a program. Each statement yields an entry/exit
 * {@link Fragment}; a fragment without an exit cannot fall through (it ends in BREAK).
 * Every WHILE pushes its exit junction on a stack while its body is built, so a BREAK at any
 * depth edges straight to the innermost loop's exit.
 */
public class CfgBuilder implements StmtVisitor<CfgBuilder.Fragment> {
    private static final String TAG = "rapcode.cfg";

    /** Entry and exit node ids; {@code exit} is null when control cannot fall through. */
    public static final class Fragment {
        static final Fragment EMPTY = new Fragment(null, null);

        public final Integer entry;
        public final Integer exit;

        Fragment(Integer entry, Integer exit) {
            this.entry = entry;
            this.exit = exit;
        }

        boolean isEmpty() { return entry == null; }
    }

    private final List<CfgNode> nodes = new ArrayList<>();
    private final List<CfgEdge> edges = new ArrayList<>();
    private final Deque<Integer> loopExits = new ArrayDeque<>();

    private CfgBuilder() {}

    public static ControlFlowGraph build(Program program) {
        return new CfgBuilder().buildProgram(program);
    }

    private ControlFlowGraph buildProgram(Program program) {
        int start = addNode(CfgNode.Kind.START, "Start");
        Fragment body = sequence(program.body);
        int end = addNode(CfgNode.Kind.END, "End");

        if (body.isEmpty()) {
            addEdge(start, end, CfgEdge.Label.NONE);
        } else {
            addEdge(start, body.entry, CfgEdge.Label.NONE);
            if (body.exit != null) addEdge(body.exit, end, CfgEdge.Label.NONE);
        }
        Debug.get().d(TAG, "built graph: " + nodes.size() + " nodes, " + edges.size() + " edges");
        return new ControlFlowGraph(nodes, edges, start, end);
    }

    /** Chains statements; the sequence falls through only if its last statement does. */
    Fragment sequence(List<Stmt> statements) {
        if (statements.isEmpty()) return Fragment.EMPTY;
        List<Fragment> parts = new ArrayList<>(statements.size());
        for (Stmt s : statements) parts.add(s.accept(this));

        for (int i = 0; i + 1 < parts.size(); i++) {
            Integer exit = parts.get(i).exit;
            Integer nextEntry = parts.get(i + 1).entry;
            if (exit != null && nextEntry != null) addEdge(exit, nextEntry, CfgEdge.Label.NONE);
        }
        return new Fragment(parts.get(0).entry, parts.get(parts.size() - 1).exit);
    }

    @Override
    public Fragment visitAssignmentStmt(Assignment stmt) {
        CfgNode.Kind kind = (stmt.value instanceof Expr.Input) ? CfgNode.Kind.INPUT : CfgNode.Kind.ASSIGNMENT;
        int n = addNode(kind, stmt.target.name + " := " + ExprPrinter.print(stmt.value));
        return new Fragment(n, n);
    }

    @Override
    public Fragment visitOutputStmt(Output stmt) {
        int n = addNode(CfgNode.Kind.OUTPUT, "OUTPUT " + ExprPrinter.print(stmt.value));
        return new Fragment(n, n);
    }

    @Override
    public Fragment visitIfStmt(If stmt) {
        int decision = addNode(CfgNode.Kind.DECISION, ExprPrinter.print(stmt.test));
        int merge = addNode(CfgNode.Kind.JUNCTION, "");

        boolean thenFallsThrough = branch(decision, merge, stmt.consequent, CfgEdge.Label.TRUE);
        boolean elseFallsThrough = branch(decision, merge, stmt.hasAlternate() ? stmt.alternate : List.of(), CfgEdge.Label.FALSE);
        // both branches break: the merge junction is unreachable and the If has no exit
        return new Fragment(decision, (thenFallsThrough || elseFallsThrough) ? merge : null);
    }

    /** Wires one branch; returns whether it reaches the merge junction. */
    private boolean branch(int decision, int merge, List<Stmt> statements, CfgEdge.Label label) {
        Fragment f = sequence(statements);
        if (f.isEmpty()) {
            addEdge(decision, merge, label);
            return true;
        }
        addEdge(decision, f.entry, label);
        if (f.exit == null) return false;
        addEdge(f.exit, merge, CfgEdge.Label.NONE);
        return true;
    }

    @Override
    public Fragment visitWhileStmt(While stmt) {
        int entry = addNode(CfgNode.Kind.JUNCTION, "");
        int exit = addNode(CfgNode.Kind.JUNCTION, "");

        loopExits.push(exit);
        try {
            if (stmt.isUnconditional()) {
                Fragment body = sequence(stmt.body);
                if (body.isEmpty()) {
                    addEdge(entry, entry, CfgEdge.Label.NONE);
                } else {
                    addEdge(entry, body.entry, CfgEdge.Label.NONE);
                    if (body.exit != null) addEdge(body.exit, entry, CfgEdge.Label.NONE);
                }
            } else {
                int test = addNode(CfgNode.Kind.DECISION, ExprPrinter.print(stmt.test));
                addEdge(entry, test, CfgEdge.Label.NONE);
                Fragment body = sequence(stmt.body);
                if (body.isEmpty()) {
                    addEdge(test, entry, CfgEdge.Label.TRUE);
                } else {
                    addEdge(test, body.entry, CfgEdge.Label.TRUE);
                    if (body.exit != null) addEdge(body.exit, entry, CfgEdge.Label.NONE);
                }
                addEdge(test, exit, CfgEdge.Label.FALSE);
            }
        } finally {
            loopExits.pop();
        }
        return new Fragment(entry, exit);
    }

    @Override
    public Fragment visitBreakStmt(Break stmt) {
        if (loopExits.isEmpty()) {
            throw new RapcodeException(ErrorKind.STRUCTURAL, "'BREAK' used outside of a loop.", stmt.keyword);
        }
        int n = addNode(CfgNode.Kind.JUNCTION, "");
        addEdge(n, loopExits.peek(), CfgEdge.Label.NONE);
        return new Fragment(n, null);
    }

    private int addNode(CfgNode.Kind kind, String label) {
        int id = nodes.size();
        nodes.add(new CfgNode(id, kind, label));
        return id;
    }

    private void addEdge(int from, int to, CfgEdge.Label label) {
        edges.add(new CfgEdge(from, to, label));
    }
}
