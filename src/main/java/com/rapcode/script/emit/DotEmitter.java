package com.rapcode.script.emit;

import com.rapcode.script.cfg.CfgEdge;
import com.rapcode.script.cfg.CfgNode;
import com.rapcode.script.cfg.ControlFlowGraph;

/** Graphviz DOT source for the graph; layout is left to the renderer. */
public class DotEmitter implements DiagramEmitter {
    private final DiagramDirection direction;

    public DotEmitter() { this(DiagramDirection.TD); }

    public DotEmitter(DiagramDirection direction) {
        this.direction = (direction == null) ? DiagramDirection.TD : direction;
    }

    @Override
    public String emit(ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph Flowchart {\n");
        sb.append("  rankdir=").append(direction.dot).append(";\n");
        sb.append("  node [fontname=\"Helvetica\", fontsize=10];\n");
        sb.append("  edge [fontname=\"Helvetica\", fontsize=9];\n");
        for (CfgNode n : graph.nodes()) {
            sb.append("  ").append(id(n.id)).append(" [").append(attributes(n)).append("];\n");
        }
        for (CfgEdge e : graph.edges()) {
            sb.append("  ").append(id(e.from)).append(" -> ").append(id(e.to));
            if (e.label != CfgEdge.Label.NONE) {
                sb.append(" [label=\"").append(e.label.text).append("\"]");
            }
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    static String id(int nodeId) {
        return "n" + nodeId;
    }

    private static String attributes(CfgNode n) {
        switch (n.kind) {
            case START:
            case END:
                return "label=\"" + escape(n.label) + "\", shape=ellipse, style=rounded";
            case INPUT:
            case OUTPUT:
                return "label=\"" + escape(n.label) + "\", shape=parallelogram";
            case DECISION:
                return "label=\"" + escape(n.label) + "\", shape=diamond";
            case JUNCTION:
                return "label=\"\", shape=point, width=0.08, height=0.08";
            default:
                return "label=\"" + escape(n.label) + "\", shape=box";
        }
    }

    static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
