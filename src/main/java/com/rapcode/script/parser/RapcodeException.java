package com.rapcode.script.parser;

/**
 * The single error type raised by the lexer, parser, lowering, interpreter and CFG builder.
 * Line and column are 1-based; 0 means the position is unknown.
 */
public class RapcodeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final int line;
    private final int column;
    private final String detail;

    public RapcodeException(ErrorKind kind, String detail) {
        this(kind, detail, 0, 0, null);
    }

    public RapcodeException(ErrorKind kind, String detail, Token at) {
        this(kind, detail, at == null ? 0 : at.line, at == null ? 0 : at.column, null);
    }

    public RapcodeException(ErrorKind kind, String detail, int line, int column, Throwable cause) {
        super(format(kind, detail, line, column), cause);
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public ErrorKind kind() { return kind; }
    public int line() { return line; }
    public int column() { return column; }
    public String detail() { return detail; }
    public boolean hasPosition() { return line > 0; }

    private static String format(ErrorKind kind, String detail, int line, int column) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind.label()).append(" error] ");
        if (line > 0) {
            sb.append("line ").append(line);
            if (column > 0) sb.append(':').append(column);
            sb.append(": ");
        }
        sb.append(detail);
        return sb.toString();
    }
}
