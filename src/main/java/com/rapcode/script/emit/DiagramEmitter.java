package com.rapcode.script.emit;

import com.rapcode.script.cfg.ControlFlowGraph;

/** Serializes a control-flow graph into a diagram language. Implementations are side-effect free. */
public interface DiagramEmitter {
    String emit(ControlFlowGraph graph);
}
