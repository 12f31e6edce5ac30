package com.rapcode.script.cfg;

public final class CfgEdge {

    public enum Label {
        NONE(""),
        TRUE("True"),
        FALSE("False");

        public final String text;

        Label(String text) { this.text = text; }
    }

    public final int from;
    public final int to;
    public final Label label;

    public CfgEdge(int from, int to, Label label) {
        this.from = from;
        this.to = to;
        this.label = (label == null) ? Label.NONE : label;
    }

    @Override
    public String toString() {
        return from + "->" + to + (label == Label.NONE ? "" : "(" + label.text + ")");
    }
}
