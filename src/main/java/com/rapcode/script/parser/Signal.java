package com.rapcode.script.parser;

/** Outcome of executing one statement: it either ran to completion or hit a BREAK. */
public enum Signal {
    COMPLETED,
    BROKE
}
