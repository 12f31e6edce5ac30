package com.rapcode.script.emit;

/** Layout direction of emitted diagrams. */
public enum DiagramDirection {
    TD("TD", "TB"),
    LR("LR", "LR");

    final String mermaid;
    final String dot;

    DiagramDirection(String mermaid, String dot) {
        this.mermaid = mermaid;
        this.dot = dot;
    }
}
