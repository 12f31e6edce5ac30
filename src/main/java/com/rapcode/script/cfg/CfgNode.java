package com.rapcode.script.cfg;

public final class CfgNode {

    public enum Kind { START, END, ASSIGNMENT, INPUT, OUTPUT, DECISION, JUNCTION }

    public final int id;
    public final Kind kind;
    public final String label;

    public CfgNode(int id, Kind kind, String label) {
        this.id = id;
        this.kind = kind;
        this.label = (label == null) ? "" : label;
    }

    @Override
    public String toString() {
        return id + ":" + kind + (label.isEmpty() ? "" : "[" + label + "]");
    }
}
