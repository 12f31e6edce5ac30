package com.rapcode.script.parser;

import com.rapcode.script.parser.Expr.Binary;
import com.rapcode.script.parser.Expr.ExprInterface;
import com.rapcode.script.parser.Expr.ExprVisitor;
import com.rapcode.script.parser.Expr.Identifier;
import com.rapcode.script.parser.Expr.Input;
import com.rapcode.script.parser.Expr.Literal;
import com.rapcode.script.parser.Expr.Operator;
import com.rapcode.script.parser.Expr.Unary;

/**
 * Renders an expression as Rapcode source. Parentheses are inserted only where operator
 * precedence or left-associativity requires them, so the output parses back to the same tree.
 */
public final class ExprPrinter implements ExprVisitor<String> {

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {}

    public static String print(ExprInterface expr) {
        return expr.accept(INSTANCE);
    }

    /** Source form of a literal value; strings are quoted and escaped, booleans upper-case. */
    public static String literal(Value value) {
        if (value.getType() == Value.Type.STRING) {
            return '"' + value.asString().replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return value.display();
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        return literal(expr.value);
    }

    @Override
    public String visitIdentifierExpr(Identifier expr) {
        return expr.name;
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        int prec = expr.operator.precedence;
        String left = operand(expr.left, prec, false);
        String right = operand(expr.right, prec, true);
        return left + " " + expr.operator.symbol + " " + right;
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        String operand = operand(expr.operand, Operator.NOT.precedence, false);
        if (expr.operator == Operator.NOT) return "NOT " + operand;
        // "-(3)" keeps a negation of a literal apart from the literal -3
        if (expr.operand instanceof Literal && !operand.startsWith("-")) return "-(" + operand + ")";
        // "- -x" rather than "--x"
        return operand.startsWith("-") ? "- " + operand : "-" + operand;
    }

    @Override
    public String visitInputExpr(Input expr) {
        return "INPUT(" + print(expr.prompt) + ")";
    }

    private String operand(ExprInterface child, int parentPrecedence, boolean rightSide) {
        String text = child.accept(this);
        if (child instanceof Binary) {
            int childPrec = ((Binary) child).operator.precedence;
            if (childPrec < parentPrecedence || (rightSide && childPrec == parentPrecedence)) {
                return "(" + text + ")";
            }
        }
        return text;
    }
}
