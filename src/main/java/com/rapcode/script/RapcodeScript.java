package com.rapcode.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.rapcode.debug.Debug;
import com.rapcode.protocol.AstJson;
import com.rapcode.protocol.ProgramStats;
import com.rapcode.script.cfg.CfgBuilder;
import com.rapcode.script.cfg.ControlFlowGraph;
import com.rapcode.script.emit.DiagramDirection;
import com.rapcode.script.emit.DotEmitter;
import com.rapcode.script.emit.MermaidEmitter;
import com.rapcode.script.emit.RapcodeEmitter;
import com.rapcode.script.flowchart.FlowNode;
import com.rapcode.script.flowchart.FlowchartLowering;
import com.rapcode.script.flowchart.LegacyTreeReader;
import com.rapcode.script.flowchart.LoweringResult;
import com.rapcode.script.flowchart.RaptorXmlReader;
import com.rapcode.script.parser.Environment;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Interpreter;
import com.rapcode.script.parser.Parser;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Statement.Program;

/**
 * Rapcode engine facade.
 *
 * - Front ends: Rapcode text, RAPTOR flowchart XML, AST JSON and the legacy generic flowchart tree
 * - Back ends: Rapcode text, Mermaid, Graphviz DOT, AST JSON, and direct interpretation
 * - Host hooks: {@link InputProvider} for INPUT, {@link OutputSink} for OUTPUT
 *
 * An instance is not thread-safe; create one per conversion or run.
 */
public class RapcodeScript {
    private static final String TAG = "rapcode.script";

    /** Supplies one line of user input for an INPUT expression. */
    public interface InputProvider {
        String readLine(String prompt);
    }

    /** Receives the display string of every OUTPUT statement. */
    public interface OutputSink {
        void output(String text);
    }

    /** Conversion targets, with the file extension used for default output paths. */
    public enum OutputFormat {
        RAPCODE("rapcode", "rapcode"),
        MERMAID("mermaid", "mmd"),
        DOT("dot", "dot"),
        JSON("json", "json");

        public final String id;
        public final String extension;

        OutputFormat(String id, String extension) {
            this.id = id;
            this.extension = extension;
        }

        public static OutputFormat fromId(String id) {
            for (OutputFormat f : values()) {
                if (f.id.equalsIgnoreCase(id)) return f;
            }
            throw new IllegalArgumentException("Unknown output format: " + id);
        }
    }

    // ===================== CONFIGURATION =====================

    private int indent = 2;
    private DiagramDirection direction = DiagramDirection.TD;
    private InputProvider inputProvider;
    private OutputSink outputSink;

    public RapcodeScript() {
        this(System.in, System.out);
    }

    /** Binds the default host hooks to the given streams. */
    public RapcodeScript(InputStream in, PrintStream out) {
        this.inputProvider = new StreamInputProvider(in, out);
        this.outputSink = out::println;
    }

    public void setIndent(int indent) {
        if (indent < 0) throw new IllegalArgumentException("indent must be >= 0");
        this.indent = indent;
    }

    public int getIndent() { return indent; }

    public void setDiagramDirection(DiagramDirection direction) {
        this.direction = (direction == null) ? DiagramDirection.TD : direction;
    }

    public DiagramDirection getDiagramDirection() { return direction; }

    public void setInputProvider(InputProvider provider) {
        if (provider == null) throw new IllegalArgumentException("provider is null");
        this.inputProvider = provider;
    }

    public void setOutputSink(OutputSink sink) {
        if (sink == null) throw new IllegalArgumentException("sink is null");
        this.outputSink = sink;
    }

    // ===================== FRONT ENDS =====================

    public Program parse(String source) {
        return Parser.parseProgram(source);
    }

    public LoweringResult lowerFlowchart(String xml) {
        return FlowchartLowering.lowerChart(new RaptorXmlReader().readString(xml));
    }

    /**
     * Reads a JSON document: the canonical AST when the root carries {@code type}, the legacy
     * flowchart tree when it carries {@code node_type}.
     */
    public LoweringResult readJson(String json) {
        JsonNode root;
        try {
            root = AstJson.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new RapcodeException(ErrorKind.LOWERING, "Malformed JSON: " + e.getOriginalMessage(), 0, 0, e);
        }
        if (LegacyTreeReader.isLegacyTree(root)) {
            FlowNode chart = new LegacyTreeReader().read(root);
            return FlowchartLowering.lowerChart(chart);
        }
        if (AstJson.isAst(root)) {
            return new LoweringResult(AstJson.fromJson(root), Collections.emptyList());
        }
        throw new RapcodeException(ErrorKind.LOWERING, "JSON input has neither 'type' nor 'node_type' at its root.");
    }

    /**
     * Loads a program from disk, choosing the front end by extension:
     * {@code .rap}/{@code .xml} flowchart XML, {@code .json} AST or legacy tree, anything else Rapcode text.
     */
    public LoweringResult load(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        String text = readFile(path);
        Debug.get().i(TAG, "loading " + path);
        if (name.endsWith(".rap") || name.endsWith(".xml")) return lowerFlowchart(text);
        if (name.endsWith(".json")) return readJson(text);
        return new LoweringResult(parse(text), Collections.emptyList());
    }

    static String readFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new RapcodeException(ErrorKind.IO, "File not found: " + path, 0, 0, e);
        } catch (IOException e) {
            throw new RapcodeException(ErrorKind.IO, "Cannot read " + path + ": " + e.getMessage(), 0, 0, e);
        }
    }

    // ===================== BACK ENDS =====================

    /** Executes the program and returns the final variable bindings. */
    public Environment run(Program program) {
        Environment env = new Environment();
        new Interpreter(env, inputProvider, outputSink).interpret(program);
        return env;
    }

    public ControlFlowGraph buildGraph(Program program) {
        return CfgBuilder.build(program);
    }

    public String toRapcode(Program program) {
        return new RapcodeEmitter(indent).emit(program);
    }

    public String toMermaid(Program program) {
        return new MermaidEmitter(direction).emit(buildGraph(program));
    }

    public String toDot(Program program) {
        return new DotEmitter(direction).emit(buildGraph(program));
    }

    public String toJson(Program program) {
        return AstJson.write(program);
    }

    public ProgramStats stats(Program program) {
        return ProgramStats.of(program);
    }

    public String convert(Program program, OutputFormat format) {
        switch (format) {
            case RAPCODE: return toRapcode(program);
            case MERMAID: return toMermaid(program);
            case DOT: return toDot(program);
            case JSON: return toJson(program);
            default: throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    // ===================== DEFAULT HOST HOOKS =====================

    /** Prints the prompt followed by a space, then reads one line; end of input reads as "". */
    static final class StreamInputProvider implements InputProvider {
        private final BufferedReader reader;
        private final PrintStream prompts;

        StreamInputProvider(InputStream in, PrintStream prompts) {
            this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            this.prompts = prompts;
        }

        @Override
        public String readLine(String prompt) {
            if (prompt != null && !prompt.isEmpty()) {
                prompts.print(prompt + " ");
                prompts.flush();
            }
            try {
                String line = reader.readLine();
                return (line == null) ? "" : line;
            } catch (IOException ioe) {
                throw new RapcodeException(ErrorKind.IO, "Failed to read input: " + ioe.getMessage(), 0, 0, ioe);
            }
        }
    }
}
