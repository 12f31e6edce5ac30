package com.rapcode.script.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Node and edge lists in construction order; immutable once built. */
public final class ControlFlowGraph {
    private final List<CfgNode> nodes;
    private final List<CfgEdge> edges;
    private final int startId;
    private final int endId;

    ControlFlowGraph(List<CfgNode> nodes, List<CfgEdge> edges, int startId, int endId) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.startId = startId;
        this.endId = endId;
    }

    public List<CfgNode> nodes() { return nodes; }
    public List<CfgEdge> edges() { return edges; }
    public int startId() { return startId; }
    public int endId() { return endId; }

    /** Node ids are their index in {@link #nodes()}. */
    public CfgNode node(int id) { return nodes.get(id); }

    public List<CfgNode> nodesOfKind(CfgNode.Kind kind) {
        List<CfgNode> out = new ArrayList<>();
        for (CfgNode n : nodes) {
            if (n.kind == kind) out.add(n);
        }
        return out;
    }

    public List<CfgEdge> outgoing(int id) {
        List<CfgEdge> out = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e.from == id) out.add(e);
        }
        return out;
    }

    public List<CfgEdge> incoming(int id) {
        List<CfgEdge> out = new ArrayList<>();
        for (CfgEdge e : edges) {
            if (e.to == id) out.add(e);
        }
        return out;
    }
}
