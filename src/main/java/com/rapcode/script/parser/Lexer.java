package com.rapcode.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.rapcode.debug.Debug;
import com.rapcode.debug.DebugLevel;

/**
 * Turns Rapcode text (or a single flowchart condition/assignment text) into tokens.
 * Keywords are matched case-insensitively; whitespace and comments ({@code //} or {@code #}
 * to end of line) are dropped.
 */
public class Lexer {
    private static final String TAG = "rapcode.lexer";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("SET", TokenType.SET);
        map.put("IF", TokenType.IF);
        map.put("THEN", TokenType.THEN);
        map.put("ELSE", TokenType.ELSE);
        map.put("ENDIF", TokenType.ENDIF);
        map.put("LOOP", TokenType.LOOP);
        map.put("WHILE", TokenType.WHILE);
        map.put("DO", TokenType.DO);
        map.put("ENDLOOP", TokenType.ENDLOOP);
        map.put("BREAK", TokenType.BREAK);
        map.put("OUTPUT", TokenType.OUTPUT);
        map.put("INPUT", TokenType.INPUT);
        map.put("TRUE", TokenType.TRUE);
        map.put("FALSE", TokenType.FALSE);
        map.put("NOT", TokenType.NOT);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public static boolean isKeyword(String word) {
        return word != null && keywords.containsKey(word.toUpperCase(Locale.ROOT));
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, current - lineStart + 1));
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, tokens.size() + " token(s) over " + line + " line(s)");
        }
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '/':
                if (match('/')) skipComment();
                else addToken(TokenType.SLASH);
                break;
            case '#':
                skipComment();
                break;
            case ':':
                if (match('=')) addToken(TokenType.ASSIGN);
                else throw error("Expected '=' after ':'");
                break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error("Unexpected '!'");
                break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                newLine();
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text.toUpperCase(Locale.ROOT), TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    // \" and \\ are the only escapes; any other backslash is kept as written.
    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\' && (peek() == '"' || peek() == '\\')) {
                value.append(advance());
                continue;
            }
            if (c == '\n') newLine();
            value.append(c);
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private RapcodeException error(String msg) {
        return new RapcodeException(ErrorKind.LEXICAL, msg, startLine, startColumn, null);
    }
}
