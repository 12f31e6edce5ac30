package com.rapcode.script.emit;

import java.util.List;

import com.rapcode.script.parser.ExprPrinter;
import com.rapcode.script.parser.Statement.Assignment;
import com.rapcode.script.parser.Statement.Break;
import com.rapcode.script.parser.Statement.If;
import com.rapcode.script.parser.Statement.Output;
import com.rapcode.script.parser.Statement.Program;
import com.rapcode.script.parser.Statement.Stmt;
import com.rapcode.script.parser.Statement.StmtVisitor;
import com.rapcode.script.parser.Statement.While;

/**
 * Prints a program as Rapcode text. Indentation mirrors nesting depth and the output parses
 * back to a structurally equal program.
 */
public class RapcodeEmitter implements StmtVisitor<Void> {
    private final String unit;
    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    public RapcodeEmitter() { this(2); }

    public RapcodeEmitter(int indent) {
        if (indent < 0) throw new IllegalArgumentException("indent must be >= 0");
        this.unit = " ".repeat(indent);
    }

    public String emit(Program program) {
        out.setLength(0);
        depth = 0;
        block(program.body);
        return out.toString();
    }

    private void block(List<Stmt> statements) {
        for (Stmt s : statements) s.accept(this);
    }

    private void nested(List<Stmt> statements) {
        depth++;
        try {
            block(statements);
        } finally {
            depth--;
        }
    }

    private void line(String text) {
        for (int i = 0; i < depth; i++) out.append(unit);
        out.append(text).append('\n');
    }

    @Override
    public Void visitAssignmentStmt(Assignment stmt) {
        line(stmt.target.name + " := " + ExprPrinter.print(stmt.value));
        return null;
    }

    @Override
    public Void visitOutputStmt(Output stmt) {
        line("OUTPUT " + ExprPrinter.print(stmt.value));
        return null;
    }

    @Override
    public Void visitIfStmt(If stmt) {
        line("IF " + ExprPrinter.print(stmt.test) + " THEN");
        nested(stmt.consequent);
        if (stmt.hasAlternate()) {
            line("ELSE");
            nested(stmt.alternate);
        }
        line("ENDIF");
        return null;
    }

    @Override
    public Void visitWhileStmt(While stmt) {
        if (stmt.isUnconditional()) line("LOOP");
        else line("WHILE " + ExprPrinter.print(stmt.test) + " DO");
        nested(stmt.body);
        line("ENDLOOP");
        return null;
    }

    @Override
    public Void visitBreakStmt(Break stmt) {
        line("BREAK");
        return null;
    }
}
