package com.rapcode.script.parser;

import java.util.Objects;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Source position of the node, or null when the producing front end had none. */
        Token at();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitInputExpr(Input expr);
    }

    /** Binary and unary operators; {@code symbol} is the canonical Rapcode spelling. */
    public enum Operator {
        EQUAL("==", 1),
        NOT_EQUAL("!=", 1),
        LESS("<", 2),
        LESS_EQUAL("<=", 2),
        GREATER(">", 2),
        GREATER_EQUAL(">=", 2),
        PLUS("+", 3),
        MINUS("-", 3),
        MULTIPLY("*", 4),
        DIVIDE("/", 4),
        MODULO("%", 4),
        NOT("NOT", 5),
        NEGATE("-", 5);

        public final String symbol;
        /** Binding strength, higher binds tighter. */
        public final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public boolean isUnary() { return this == NOT || this == NEGATE; }

        public static Operator binary(TokenType type) {
            switch (type) {
                case EQUAL:
                case EQUAL_EQUAL: return EQUAL;
                case BANG_EQUAL: return NOT_EQUAL;
                case LESS: return LESS;
                case LESS_EQUAL: return LESS_EQUAL;
                case GREATER: return GREATER;
                case GREATER_EQUAL: return GREATER_EQUAL;
                case PLUS: return PLUS;
                case MINUS: return MINUS;
                case STAR: return MULTIPLY;
                case SLASH: return DIVIDE;
                case PERCENT: return MODULO;
                default: throw new IllegalArgumentException("Not a binary operator: " + type);
            }
        }

        /** Looks an operator up by its interchange spelling. */
        public static Operator fromSymbol(String symbol, boolean unary) {
            for (Operator op : values()) {
                if (op.isUnary() == unary && op.symbol.equalsIgnoreCase(symbol)) return op;
            }
            if (!unary && "=".equals(symbol)) return EQUAL;
            throw new IllegalArgumentException("Unknown " + (unary ? "unary" : "binary") + " operator: " + symbol);
        }
    }

    // -------------------------
    // Expression nodes
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;
        public final Token token;

        public Literal(Value value, Token token) {
            this.value = Objects.requireNonNull(value, "value");
            this.token = token;
        }

        public Literal(Value value) { this(value, null); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public Token at() { return token; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && value.equals(((Literal) o).value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return "Literal(" + value + ")"; }
    }

    public static final class Identifier implements ExprInterface {
        public final String name;
        public final Token token;

        public Identifier(String name, Token token) {
            this.name = Objects.requireNonNull(name, "name");
            this.token = token;
        }

        public Identifier(String name) { this(name, null); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        @Override
        public Token at() { return token; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Identifier && name.equals(((Identifier) o).name);
        }

        @Override
        public int hashCode() { return name.hashCode(); }

        @Override
        public String toString() { return "Identifier(" + name + ")"; }
    }

    public static final class Binary implements ExprInterface {
        public final Operator operator;
        public final ExprInterface left;
        public final ExprInterface right;
        public final Token token;

        public Binary(ExprInterface left, Operator operator, ExprInterface right, Token token) {
            if (operator.isUnary()) throw new IllegalArgumentException("Unary operator in binary node: " + operator);
            this.left = Objects.requireNonNull(left, "left");
            this.operator = operator;
            this.right = Objects.requireNonNull(right, "right");
            this.token = token;
        }

        public Binary(ExprInterface left, Operator operator, ExprInterface right) {
            this(left, operator, right, null);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public Token at() { return token; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary b = (Binary) o;
            return operator == b.operator && left.equals(b.left) && right.equals(b.right);
        }

        @Override
        public int hashCode() { return Objects.hash(operator, left, right); }

        @Override
        public String toString() { return "Binary(" + operator.symbol + ", " + left + ", " + right + ")"; }
    }

    public static final class Unary implements ExprInterface {
        public final Operator operator;
        public final ExprInterface operand;
        public final Token token;

        public Unary(Operator operator, ExprInterface operand, Token token) {
            if (!operator.isUnary()) throw new IllegalArgumentException("Binary operator in unary node: " + operator);
            this.operator = operator;
            this.operand = Objects.requireNonNull(operand, "operand");
            this.token = token;
        }

        public Unary(Operator operator, ExprInterface operand) { this(operator, operand, null); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public Token at() { return token; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unary)) return false;
            Unary u = (Unary) o;
            return operator == u.operator && operand.equals(u.operand);
        }

        @Override
        public int hashCode() { return Objects.hash(operator, operand); }

        @Override
        public String toString() { return "Unary(" + operator.symbol + ", " + operand + ")"; }
    }

    /** {@code INPUT(prompt)}: blocks for one line of external input. */
    public static final class Input implements ExprInterface {
        public final ExprInterface prompt;
        public final Token token;

        public Input(ExprInterface prompt, Token token) {
            this.prompt = Objects.requireNonNull(prompt, "prompt");
            this.token = token;
        }

        public Input(ExprInterface prompt) { this(prompt, null); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInputExpr(this);
        }

        @Override
        public Token at() { return token; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Input && prompt.equals(((Input) o).prompt);
        }

        @Override
        public int hashCode() { return Objects.hash("INPUT", prompt); }

        @Override
        public String toString() { return "Input(" + prompt + ")"; }
    }
}
