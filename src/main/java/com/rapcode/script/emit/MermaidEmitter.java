package com.rapcode.script.emit;

import com.rapcode.script.cfg.CfgEdge;
import com.rapcode.script.cfg.CfgNode;
import com.rapcode.script.cfg.ControlFlowGraph;

/** Mermaid {@code flowchart} source: one line per node, then one line per edge. */
public class MermaidEmitter implements DiagramEmitter {
    private final DiagramDirection direction;

    public MermaidEmitter() { this(DiagramDirection.TD); }

    public MermaidEmitter(DiagramDirection direction) {
        this.direction = (direction == null) ? DiagramDirection.TD : direction;
    }

    @Override
    public String emit(ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("flowchart ").append(direction.mermaid).append('\n');
        for (CfgNode n : graph.nodes()) {
            sb.append("  ").append(id(n.id)).append(shape(n)).append('\n');
        }
        for (CfgEdge e : graph.edges()) {
            sb.append("  ").append(id(e.from));
            if (e.label == CfgEdge.Label.NONE) sb.append(" --> ");
            else sb.append(" -->|").append(e.label.text).append("| ");
            sb.append(id(e.to)).append('\n');
        }
        return sb.toString();
    }

    static String id(int nodeId) {
        return "N" + nodeId;
    }

    private static String shape(CfgNode n) {
        String label = escape(n.label);
        switch (n.kind) {
            case START:
            case END:
                return "([\"" + label + "\"])";
            case INPUT:
            case OUTPUT:
                return "[/\"" + label + "\"/]";
            case DECISION:
                return "{\"" + label + "\"}";
            case JUNCTION:
                return "((\" \"))";
            default:
                return "[\"" + label + "\"]";
        }
    }

    static String escape(String label) {
        return label.replace("\"", "#quot;").replace("\n", " ");
    }
}
