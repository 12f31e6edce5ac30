package com.rapcode.protocol;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rapcode.script.parser.Expr;
import com.rapcode.script.parser.Expr.ExprInterface;
import com.rapcode.script.parser.Expr.ExprVisitor;
import com.rapcode.script.parser.Statement.Assignment;
import com.rapcode.script.parser.Statement.Break;
import com.rapcode.script.parser.Statement.If;
import com.rapcode.script.parser.Statement.Output;
import com.rapcode.script.parser.Statement.Program;
import com.rapcode.script.parser.Statement.Stmt;
import com.rapcode.script.parser.Statement.StmtVisitor;
import com.rapcode.script.parser.Statement.While;

/** Static summary of a program: statement counts, decision count and variables touched. */
public final class ProgramStats {

    public enum StatementKind { ASSIGNMENT, INPUT, OUTPUT, IF, WHILE, BREAK }

    private final Map<StatementKind, Integer> counts;
    private final SortedSet<String> variables;

    private ProgramStats(Map<StatementKind, Integer> counts, SortedSet<String> variables) {
        this.counts = Collections.unmodifiableMap(counts);
        this.variables = Collections.unmodifiableSortedSet(variables);
    }

    public static ProgramStats of(Program program) {
        Collector c = new Collector();
        c.block(program.body);
        return new ProgramStats(c.counts, c.variables);
    }

    public int count(StatementKind kind) { return counts.get(kind); }

    public Map<StatementKind, Integer> counts() { return counts; }

    public int totalStatements() {
        int total = 0;
        for (int n : counts.values()) total += n;
        return total;
    }

    /** If and While statements. */
    public int decisions() { return count(StatementKind.IF) + count(StatementKind.WHILE); }

    public int cyclomaticComplexity() { return decisions() + 1; }

    public SortedSet<String> variables() { return variables; }

    public ObjectNode toJson() {
        ObjectNode root = AstJson.mapper().createObjectNode();
        ObjectNode byKind = root.putObject("statements");
        for (Map.Entry<StatementKind, Integer> e : counts.entrySet()) {
            byKind.put(e.getKey().name().toLowerCase(), e.getValue());
        }
        root.put("total", totalStatements());
        root.put("decisions", decisions());
        root.put("cyclomatic", cyclomaticComplexity());
        ArrayNode vars = root.putArray("variables");
        for (String v : variables) vars.add(v);
        return root;
    }

    private static final class Collector implements StmtVisitor<Void>, ExprVisitor<Void> {
        final Map<StatementKind, Integer> counts = new EnumMap<>(StatementKind.class);
        final SortedSet<String> variables = new TreeSet<>();

        Collector() {
            for (StatementKind k : StatementKind.values()) counts.put(k, 0);
        }

        void block(List<Stmt> statements) {
            if (statements == null) return;
            for (Stmt s : statements) s.accept(this);
        }

        private void bump(StatementKind kind) { counts.merge(kind, 1, Integer::sum); }

        private void expr(ExprInterface e) { e.accept(this); }

        @Override
        public Void visitAssignmentStmt(Assignment stmt) {
            bump(stmt.value instanceof Expr.Input ? StatementKind.INPUT : StatementKind.ASSIGNMENT);
            variables.add(stmt.target.name);
            expr(stmt.value);
            return null;
        }

        @Override
        public Void visitOutputStmt(Output stmt) {
            bump(StatementKind.OUTPUT);
            expr(stmt.value);
            return null;
        }

        @Override
        public Void visitIfStmt(If stmt) {
            bump(StatementKind.IF);
            expr(stmt.test);
            block(stmt.consequent);
            block(stmt.alternate);
            return null;
        }

        @Override
        public Void visitWhileStmt(While stmt) {
            bump(StatementKind.WHILE);
            expr(stmt.test);
            block(stmt.body);
            return null;
        }

        @Override
        public Void visitBreakStmt(Break stmt) {
            bump(StatementKind.BREAK);
            return null;
        }

        @Override
        public Void visitLiteralExpr(Expr.Literal expr) { return null; }

        @Override
        public Void visitIdentifierExpr(Expr.Identifier expr) {
            variables.add(expr.name);
            return null;
        }

        @Override
        public Void visitBinaryExpr(Expr.Binary expr) {
            expr(expr.left);
            expr(expr.right);
            return null;
        }

        @Override
        public Void visitUnaryExpr(Expr.Unary expr) {
            expr(expr.operand);
            return null;
        }

        @Override
        public Void visitInputExpr(Expr.Input expr) {
            expr(expr.prompt);
            return null;
        }
    }
}
