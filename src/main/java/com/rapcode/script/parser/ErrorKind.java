package com.rapcode.script.parser;

/** Failure classes surfaced by every pipeline stage. */
public enum ErrorKind {
    LEXICAL("Lexical"),
    SYNTAX("Syntax"),
    LOWERING("Lowering"),
    STRUCTURAL("Structural"),
    TYPE("Type"),
    VALUE("Value"),
    NAME("Name"),
    IO("I/O");

    private final String label;

    ErrorKind(String label) { this.label = label; }

    public String label() { return label; }
}
