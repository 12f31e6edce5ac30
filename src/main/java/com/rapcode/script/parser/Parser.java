package com.rapcode.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.rapcode.debug.Debug;
import com.rapcode.debug.DebugLevel;
import com.rapcode.script.parser.Expr.Binary;
import com.rapcode.script.parser.Expr.ExprInterface;
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
import com.rapcode.script.parser.Statement.While;

/**
 * Recursive-descent parser for Rapcode.
 *
 * Precedence, lowest first: equality, relational, additive, multiplicative, unary, primary.
 * Every binary level is left-associative and takes its operands only from the next level up.
 * The first malformed token aborts the parse with a SYNTAX error.
 */
public class Parser {
    private static final String TAG = "rapcode.parser";

    private final List<Token> tokens;
    private int current = 0;
    private int loopDepth = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public static Program parseProgram(String source) {
        Program program = new Parser(new Lexer(source).tokenize()).parse();
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "parsed " + program.body.size() + " top-level statement(s)");
        }
        return program;
    }

    /** Parses a flowchart condition or output text; the whole text must be one expression. */
    public static ExprInterface parseExpressionText(String text) {
        Parser parser = new Parser(new Lexer(text).tokenize());
        if (parser.isAtEnd()) throw parser.error(parser.peek(), "Expect expression.");
        ExprInterface expr = parser.expression();
        parser.expectEnd();
        return expr;
    }

    /** Parses a flowchart assignment text such as {@code x := x + 1}. */
    public static Assignment parseAssignmentText(String text) {
        Parser parser = new Parser(new Lexer(text).tokenize());
        parser.match(TokenType.SET);
        Token name = parser.consume(TokenType.IDENTIFIER, "Expect variable name in assignment.");
        parser.consume(TokenType.ASSIGN, "Expect ':=' after variable name.");
        ExprInterface value = parser.expression();
        parser.expectEnd();
        return new Assignment(new Identifier(name.lexeme, name), value);
    }

    public Program parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return new Program(statements);
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.LOOP)) return loopStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.OUTPUT)) return outputStatement();
        if (match(TokenType.SET)) return assignment(consume(TokenType.IDENTIFIER, "Expect variable name after 'SET'."));
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) return assignment(advance());
        return invalidStatement();
    }

    private Stmt assignment(Token name) {
        consume(TokenType.ASSIGN, "Expect ':=' after variable name.");
        ExprInterface value = expression();
        return new Assignment(new Identifier(name.lexeme, name), value);
    }

    private Stmt invalidStatement() {
        Token start = peek();
        if (isStatementEnd(start.type) || start.type == TokenType.EOF) {
            throw error(start, "Expect statement.");
        }
        expression();
        if (check(TokenType.ASSIGN)) throw error(peek(), "Invalid assignment target.");
        throw new RapcodeException(ErrorKind.SYNTAX,
                "Expression statements are not allowed; expect assignment or OUTPUT.", start);
    }

    // IF <expr> THEN <statements> [ELSE <statements>] ENDIF
    private Stmt ifStatement() {
        Token keyword = previous();
        ExprInterface test = expression();
        consume(TokenType.THEN, "Expect 'THEN' after IF condition.");
        List<Stmt> consequent = block(TokenType.ELSE, TokenType.ENDIF);
        List<Stmt> alternate = null;
        if (match(TokenType.ELSE)) {
            alternate = block(TokenType.ENDIF);
        }
        consume(TokenType.ENDIF, "Expect 'ENDIF' to close IF.");
        return new If(test, consequent, alternate, keyword);
    }

    // LOOP <statements> ENDLOOP
    private Stmt loopStatement() {
        Token keyword = previous();
        List<Stmt> body = loopBody();
        return new While(new Literal(Value.TRUE, keyword), body, keyword);
    }

    // WHILE <expr> DO <statements> ENDLOOP
    private Stmt whileStatement() {
        Token keyword = previous();
        ExprInterface test = expression();
        consume(TokenType.DO, "Expect 'DO' after WHILE condition.");
        List<Stmt> body = loopBody();
        return new While(test, body, keyword);
    }

    private List<Stmt> loopBody() {
        loopDepth++;
        try {
            List<Stmt> body = block(TokenType.ENDLOOP);
            consume(TokenType.ENDLOOP, "Expect 'ENDLOOP' to close loop.");
            return body;
        } finally {
            loopDepth--;
        }
    }

    private Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw new RapcodeException(ErrorKind.STRUCTURAL, "'BREAK' used outside of a loop.", keyword);
        }
        return new Break(keyword);
    }

    private Stmt outputStatement() {
        Token keyword = previous();
        return new Output(expression(), keyword);
    }

    private List<Stmt> block(TokenType... terminators) {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!checkAny(terminators)) {
            if (isAtEnd()) {
                throw error(peek(), "Expect '" + terminators[terminators.length - 1].name() + "' before end of input.");
            }
            statements.add(statement());
        }
        return statements;
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() { return equality(); }

    private ExprInterface equality() {
        ExprInterface expr = relational();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.EQUAL)) {
            Token op = previous();
            ExprInterface right = relational();
            expr = new Binary(expr, Operator.binary(op.type), right, op);
        }
        return expr;
    }

    private ExprInterface relational() {
        ExprInterface expr = additive();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token op = previous();
            ExprInterface right = additive();
            expr = new Binary(expr, Operator.binary(op.type), right, op);
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = multiplicative();
            expr = new Binary(expr, Operator.binary(op.type), right, op);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            ExprInterface right = unary();
            expr = new Binary(expr, Operator.binary(op.type), right, op);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new Unary(Operator.NOT, unary(), op);
        }
        if (match(TokenType.MINUS)) {
            Token op = previous();
            // "-3" is a negative literal, "-(3)" a negation
            if (match(TokenType.NUMBER)) {
                return new Literal(Value.number(-(Double) previous().literal), op);
            }
            return new Unary(Operator.NEGATE, unary(), op);
        }
        return primary();
    }

    private ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.FALSE, previous());
        if (match(TokenType.TRUE)) return new Literal(Value.TRUE, previous());
        if (match(TokenType.NUMBER)) return new Literal(Value.number((Double) previous().literal), previous());
        if (match(TokenType.STRING)) return new Literal(Value.string((String) previous().literal), previous());
        if (match(TokenType.IDENTIFIER)) return new Identifier(previous().lexeme, previous());

        if (match(TokenType.INPUT)) {
            Token keyword = previous();
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'INPUT'.");
            ExprInterface prompt = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after INPUT prompt.");
            return new Input(prompt, keyword);
        }

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        throw error(peek(), "Expect expression.");
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private void expectEnd() {
        if (!isAtEnd()) throw error(peek(), "Unexpected trailing input.");
    }

    private boolean isStatementEnd(TokenType type) {
        return type == TokenType.ELSE || type == TokenType.ENDIF || type == TokenType.ENDLOOP;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private RapcodeException error(Token token, String message) {
        String found = token.type == TokenType.EOF ? "end of input" : "'" + token.lexeme + "'";
        return new RapcodeException(ErrorKind.SYNTAX, message + " Found " + found + ".", token);
    }
}
