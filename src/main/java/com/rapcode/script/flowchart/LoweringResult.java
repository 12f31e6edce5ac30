package com.rapcode.script.flowchart;

import java.util.Collections;
import java.util.List;

import com.rapcode.script.parser.Statement.Program;

public class LoweringResult {
    private final Program program;
    private final List<String> warnings;

    public LoweringResult(Program program, List<String> warnings) {
        this.program = program;
        this.warnings = (warnings == null) ? Collections.emptyList() : Collections.unmodifiableList(warnings);
    }

    public Program program() { return program; }
    public List<String> warnings() { return warnings; }
}
