package com.rapcode.script;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.rapcode.debug.Debug;
import com.rapcode.debug.Slf4jDebugSink;
import com.rapcode.script.RapcodeScript.OutputFormat;
import com.rapcode.script.emit.DiagramDirection;
import com.rapcode.script.flowchart.LoweringResult;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.RapcodeException;

/**
 * Command line entry point.
 *
 * <pre>
 *   RapcodeCli &lt;input&gt; --to &lt;rapcode|mermaid|dot|json&gt; [-o &lt;output&gt;] [--indent N] [--direction TD|LR]
 *   RapcodeCli &lt;input&gt; --run
 *   RapcodeCli &lt;input&gt; --stats
 * </pre>
 *
 * Exit codes: 0 success, 1 any conversion or runtime error, 2 usage error.
 */
public final class RapcodeCli {
    private static final String TAG = "rapcode.cli";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join("\n",
            "Usage: RapcodeCli <input> --to <rapcode|mermaid|dot|json> [-o <output>] [--indent N] [--direction TD|LR]",
            "       RapcodeCli <input> --run",
            "       RapcodeCli <input> --stats",
            "Input: .rap/.xml (RAPTOR flowchart), .json (AST or legacy tree), anything else Rapcode text.",
            "Without -o the output goes to <input-base>_converted.<ext>; '-o -' writes to standard output.");

    public static void main(String[] args) {
        Debug.get().setSink(new Slf4jDebugSink());
        System.exit(run(args, System.in, System.out, System.err));
    }

    /** Options collected from the argument list. */
    static final class Options {
        String input;
        OutputFormat format;
        String output;
        boolean run;
        boolean stats;
        Integer indent;
        DiagramDirection direction;
        boolean help;
    }

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Options opts;
        try {
            opts = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (opts.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        RapcodeScript engine = new RapcodeScript(in, out);
        if (opts.indent != null) engine.setIndent(opts.indent);
        if (opts.direction != null) engine.setDiagramDirection(opts.direction);

        Path inputPath = Path.of(opts.input);
        try {
            LoweringResult loaded = engine.load(inputPath);
            for (String warning : loaded.warnings()) {
                err.println("warning: " + warning);
            }

            if (opts.run) {
                engine.run(loaded.program());
                return EXIT_OK;
            }
            if (opts.stats) {
                out.println(engine.stats(loaded.program()).toJson().toPrettyString());
                return EXIT_OK;
            }

            String text = engine.convert(loaded.program(), opts.format);
            if ("-".equals(opts.output)) {
                out.print(text);
                return EXIT_OK;
            }
            Path target = (opts.output != null)
                    ? Path.of(opts.output)
                    : defaultOutputPath(inputPath, opts.format);
            write(target, text);
            out.println("Wrote " + opts.format.id + " output to " + target);
            return EXIT_OK;
        } catch (RapcodeException e) {
            Debug.get().e(TAG, "failed on " + inputPath + ": " + e.getMessage());
            err.println(e.getMessage());
            return EXIT_ERROR;
        }
    }

    static Options parseArgs(String[] args) {
        Options o = new Options();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h":
                case "--help":
                    o.help = true;
                    return o;
                case "--to":
                    o.format = format(value(args, ++i, a));
                    break;
                case "-o":
                case "--output":
                    o.output = value(args, ++i, a);
                    break;
                case "--run":
                    o.run = true;
                    break;
                case "--stats":
                    o.stats = true;
                    break;
                case "--indent":
                    o.indent = indent(value(args, ++i, a));
                    break;
                case "--direction":
                    o.direction = direction(value(args, ++i, a));
                    break;
                default:
                    if (a.startsWith("--to=")) {
                        o.format = format(a.substring(5));
                    } else if (a.startsWith("-") && !"-".equals(a)) {
                        throw new IllegalArgumentException("Unknown option: " + a);
                    } else if (o.input == null) {
                        o.input = a;
                    } else {
                        throw new IllegalArgumentException("Unexpected argument: " + a);
                    }
            }
        }

        if (o.input == null) throw new IllegalArgumentException("Missing input file.");
        int modes = (o.format != null ? 1 : 0) + (o.run ? 1 : 0) + (o.stats ? 1 : 0);
        if (modes == 0) throw new IllegalArgumentException("One of --to, --run or --stats is required.");
        if (modes > 1) throw new IllegalArgumentException("--to, --run and --stats are mutually exclusive.");
        if (o.output != null && o.format == null) throw new IllegalArgumentException("-o requires --to.");
        return o;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + flag);
        return args[i];
    }

    private static OutputFormat format(String id) {
        return OutputFormat.fromId(id);
    }

    private static int indent(String s) {
        int n;
        try {
            n = Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--indent expects a number, got: " + s, e);
        }
        if (n < 0) throw new IllegalArgumentException("--indent must be >= 0");
        return n;
    }

    private static DiagramDirection direction(String s) {
        try {
            return DiagramDirection.valueOf(s.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--direction expects TD or LR, got: " + s, e);
        }
    }

    /** {@code dir/name.ext} becomes {@code dir/name_converted.<format ext>}. */
    static Path defaultOutputPath(Path input, OutputFormat format) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = (dot > 0) ? name.substring(0, dot) : name;
        return input.resolveSibling(base + "_converted." + format.extension);
    }

    private static void write(Path target, String text) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(target, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RapcodeException(ErrorKind.IO, "Cannot write " + target + ": " + e.getMessage(), 0, 0, e);
        }
    }

    private RapcodeCli() {}
}
