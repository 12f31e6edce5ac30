package com.rapcode.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);

        /** Source position of the node, or null when the producing front end had none. */
        Token at();
    }

    public interface StmtVisitor<R> {
        R visitAssignmentStmt(Assignment stmt);
        R visitOutputStmt(Output stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitBreakStmt(Break stmt);
    }

    static List<Stmt> freeze(List<Stmt> statements) {
        if (statements == null || statements.isEmpty()) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(statements));
    }

    /** Root of every AST. */
    public static final class Program {
        public final List<Stmt> body;

        public Program(List<Stmt> body) { this.body = freeze(body); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Program && body.equals(((Program) o).body);
        }

        @Override
        public int hashCode() { return body.hashCode(); }

        @Override
        public String toString() { return "Program" + body; }
    }

    public static final class Assignment implements Stmt {
        public final Expr.Identifier target;
        public final Expr.ExprInterface value;

        public Assignment(Expr.Identifier target, Expr.ExprInterface value) {
            this.target = Objects.requireNonNull(target, "target");
            this.value = Objects.requireNonNull(value, "value");
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignmentStmt(this); }
        public Token at() { return target.token; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Assignment)) return false;
            Assignment a = (Assignment) o;
            return target.equals(a.target) && value.equals(a.value);
        }

        @Override
        public int hashCode() { return Objects.hash(target, value); }

        @Override
        public String toString() { return "Assignment(" + target.name + ", " + value + ")"; }
    }

    public static final class Output implements Stmt {
        public final Expr.ExprInterface value;
        public final Token keyword;

        public Output(Expr.ExprInterface value, Token keyword) {
            this.value = Objects.requireNonNull(value, "value");
            this.keyword = keyword;
        }

        public Output(Expr.ExprInterface value) { this(value, null); }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitOutputStmt(this); }
        public Token at() { return keyword; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Output && value.equals(((Output) o).value);
        }

        @Override
        public int hashCode() { return Objects.hash("OUTPUT", value); }

        @Override
        public String toString() { return "Output(" + value + ")"; }
    }

    /** {@code alternate} is either null or non-empty; an empty else block is stored as null. */
    public static final class If implements Stmt {
        public final Expr.ExprInterface test;
        public final List<Stmt> consequent;
        public final List<Stmt> alternate;
        public final Token keyword;

        public If(Expr.ExprInterface test, List<Stmt> consequent, List<Stmt> alternate, Token keyword) {
            this.test = Objects.requireNonNull(test, "test");
            this.consequent = freeze(consequent);
            this.alternate = (alternate == null || alternate.isEmpty()) ? null : freeze(alternate);
            this.keyword = keyword;
        }

        public If(Expr.ExprInterface test, List<Stmt> consequent, List<Stmt> alternate) {
            this(test, consequent, alternate, null);
        }

        public boolean hasAlternate() { return alternate != null; }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
        public Token at() { return keyword; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof If)) return false;
            If i = (If) o;
            return test.equals(i.test) && consequent.equals(i.consequent) && Objects.equals(alternate, i.alternate);
        }

        @Override
        public int hashCode() { return Objects.hash(test, consequent, alternate); }

        @Override
        public String toString() { return "If(" + test + ", " + consequent + ", " + alternate + ")"; }
    }

    /** The single loop form; pre-, post- and mid-tested loops all lower to it. */
    public static final class While implements Stmt {
        public final Expr.ExprInterface test;
        public final List<Stmt> body;
        public final Token keyword;

        public While(Expr.ExprInterface test, List<Stmt> body, Token keyword) {
            this.test = Objects.requireNonNull(test, "test");
            this.body = freeze(body);
            this.keyword = keyword;
        }

        public While(Expr.ExprInterface test, List<Stmt> body) { this(test, body, null); }

        /** True for {@code While(Literal(TRUE), ...)}, the shape LOOP and flowchart loops produce. */
        public boolean isUnconditional() {
            return test instanceof Expr.Literal && Value.TRUE.equals(((Expr.Literal) test).value);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
        public Token at() { return keyword; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof While)) return false;
            While w = (While) o;
            return test.equals(w.test) && body.equals(w.body);
        }

        @Override
        public int hashCode() { return Objects.hash(test, body); }

        @Override
        public String toString() { return "While(" + test + ", " + body + ")"; }
    }

    public static final class Break implements Stmt {
        public final Token keyword;

        public Break(Token keyword) { this.keyword = keyword; }

        public Break() { this(null); }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
        public Token at() { return keyword; }

        @Override
        public boolean equals(Object o) { return o instanceof Break; }

        @Override
        public int hashCode() { return Break.class.hashCode(); }

        @Override
        public String toString() { return "Break"; }
    }
}
