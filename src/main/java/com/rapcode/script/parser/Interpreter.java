package com.rapcode.script.parser;

import java.util.List;

import com.rapcode.debug.Debug;
import com.rapcode.script.RapcodeScript.InputProvider;
import com.rapcode.script.RapcodeScript.OutputSink;
import com.rapcode.script.parser.Expr.Binary;
import com.rapcode.script.parser.Expr.ExprInterface;
import com.rapcode.script.parser.Expr.ExprVisitor;
import com.rapcode.script.parser.Expr.Identifier;
import com.rapcode.script.parser.Expr.Input;
import com.rapcode.script.parser.Expr.Literal;
import com.rapcode.script.parser.Expr.Operator;
import com.rapcode.script.parser.Expr.Unary;
import com.rapcode.script.parser.Statement.Assignment;
import com.rapcode.script.parser.Statement.Break;
import com.rapcode.script.parser.Statement.If;
import com.rapcode.script.parser.Statement.Output;
import com.rapcode.script.parser.Statement.Program;
import com.rapcode.script.parser.Statement.Stmt;
import com.rapcode.script.parser.Statement.StmtVisitor;
import com.rapcode.script.parser.Statement.While;

/**
 * Tree-walking evaluator. Statements return a {@link Signal}: a BREAK yields {@code BROKE},
 * which every block passes upward unchanged until the innermost enclosing WHILE consumes it.
 * Any runtime error aborts the run.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Signal> {
    private static final String TAG = "rapcode.interp";

    private final Environment env;
    private final InputProvider input;
    private final OutputSink output;
    private int loopDepth = 0;

    public Interpreter(Environment env, InputProvider input, OutputSink output) {
        this.env = env;
        this.input = input;
        this.output = output;
    }

    public Environment environment() { return env; }

    public void interpret(Program program) {
        Debug.get().d(TAG, "run start: " + program.body.size() + " top-level statement(s)");
        executeBlock(program.body);
        Debug.get().d(TAG, "run finished");
    }

    public Signal execute(Stmt stmt) {
        return stmt.accept(this);
    }

    public Signal executeBlock(List<Stmt> statements) {
        for (Stmt s : statements) {
            if (execute(s) == Signal.BROKE) return Signal.BROKE;
        }
        return Signal.COMPLETED;
    }

    public Value eval(ExprInterface expr) { return expr.accept(this); }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Signal visitAssignmentStmt(Assignment stmt) {
        env.assign(stmt.target.name, eval(stmt.value));
        return Signal.COMPLETED;
    }

    @Override
    public Signal visitOutputStmt(Output stmt) {
        output.output(eval(stmt.value).display());
        return Signal.COMPLETED;
    }

    @Override
    public Signal visitIfStmt(If stmt) {
        if (eval(stmt.test).isTruthy()) return executeBlock(stmt.consequent);
        if (stmt.hasAlternate()) return executeBlock(stmt.alternate);
        return Signal.COMPLETED;
    }

    @Override
    public Signal visitWhileStmt(While stmt) {
        loopDepth++;
        try {
            while (eval(stmt.test).isTruthy()) {
                if (executeBlock(stmt.body) == Signal.BROKE) break;
            }
        } finally {
            loopDepth--;
        }
        return Signal.COMPLETED;
    }

    @Override
    public Signal visitBreakStmt(Break stmt) {
        if (loopDepth <= 0) {
            throw new RapcodeException(ErrorKind.STRUCTURAL, "'BREAK' used outside of a loop.", stmt.keyword);
        }
        return Signal.BROKE;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitIdentifierExpr(Identifier expr) {
        return env.get(expr.name, expr.token);
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);

        switch (expr.operator) {
            case PLUS:
                if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.NUMBER) {
                    return Value.number(left.asNumber() + right.asNumber());
                }
                if (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING) {
                    return Value.string(left.display() + right.display());
                }
                throw typeError(expr, left, right);
            case MINUS:
                requireNumbers(expr, left, right);
                return Value.number(left.asNumber() - right.asNumber());
            case MULTIPLY:
                requireNumbers(expr, left, right);
                return Value.number(left.asNumber() * right.asNumber());
            case DIVIDE:
                requireNumbers(expr, left, right);
                requireNonZero(expr, right);
                return Value.number(left.asNumber() / right.asNumber());
            case MODULO: {
                requireNumbers(expr, left, right);
                requireNonZero(expr, right);
                double a = left.asNumber();
                double b = right.asNumber();
                double r = a % b;
                // result takes the sign of the divisor
                if (r != 0 && (r < 0) != (b < 0)) r += b;
                return Value.number(r);
            }

            case LESS:
                requireNumbers(expr, left, right);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumbers(expr, left, right);
                return Value.bool(left.asNumber() <= right.asNumber());
            case GREATER:
                requireNumbers(expr, left, right);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumbers(expr, left, right);
                return Value.bool(left.asNumber() >= right.asNumber());

            case EQUAL:
                return Value.bool(left.equals(right));
            case NOT_EQUAL:
                return Value.bool(!left.equals(right));

            default:
                throw new RapcodeException(ErrorKind.SYNTAX, "Unsupported binary operator: " + expr.operator, expr.token);
        }
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value operand = eval(expr.operand);
        if (expr.operator == Operator.NOT) {
            return Value.bool(!operand.isTruthy());
        }
        if (operand.getType() != Value.Type.NUMBER) {
            throw new RapcodeException(ErrorKind.TYPE,
                    "Cannot apply unary minus '-' to non-numeric type '" + operand.typeName() + "'.", expr.token);
        }
        return Value.number(-operand.asNumber());
    }

    @Override
    public Value visitInputExpr(Input expr) {
        String prompt = eval(expr.prompt).display();
        return Value.fromInput(input.readLine(prompt));
    }

    // -------------------------
    // Helpers
    // -------------------------

    private void requireNumbers(Binary expr, Value left, Value right) {
        if (left.getType() != Value.Type.NUMBER || right.getType() != Value.Type.NUMBER) {
            throw typeError(expr, left, right);
        }
    }

    private RapcodeException typeError(Binary expr, Value left, Value right) {
        return new RapcodeException(ErrorKind.TYPE,
                "Cannot apply operator '" + expr.operator.symbol + "' to non-numeric types ('"
                        + left.typeName() + "' and '" + right.typeName() + "').", expr.token);
    }

    private void requireNonZero(Binary expr, Value right) {
        if (right.asNumber() == 0.0) {
            Token at = expr.right.at() != null ? expr.right.at() : expr.token;
            throw new RapcodeException(ErrorKind.VALUE, "Division by zero in '" + ExprPrinter.print(expr) + "'.", at);
        }
    }
}
