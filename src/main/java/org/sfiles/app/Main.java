package org.sfiles.app;

import org.sfiles.notation.core.FlowsheetCodec;
import org.sfiles.notation.core.FlowsheetCodecException;
import org.sfiles.notation.graph.FlowsheetGraph;
import org.sfiles.notation.graph.Stream;
import org.sfiles.notation.graph.UnitNode;

import java.io.PrintStream;

/**
 * Command-line entry point for one-off notation conversions.
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_CODEC_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "usage: sfiles <command> <notation>",
            "commands:",
            "  canonicalize   print the canonical generalized notation",
            "  decode         print the units and streams of the notation",
            "  strip-control  print the canonical notation without control units");

    /**
     * Launches the CLI.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Runs one command.
     *
     * @param args command and notation.
     * @param out standard output.
     * @param err error output.
     * @return process exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length != 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        FlowsheetCodec codec = new FlowsheetCodec();
        String notation = args[1];
        try {
            switch (args[0]) {
                case "canonicalize":
                    out.println(codec.canonicalize(notation));
                    return EXIT_OK;
                case "decode":
                    print(codec.decode(notation).getGraph(), out);
                    return EXIT_OK;
                case "strip-control":
                    out.println(codec.stripControl(notation));
                    return EXIT_OK;
                default:
                    err.println("unknown command: " + args[0]);
                    err.println(USAGE);
                    return EXIT_USAGE;
            }
        } catch (FlowsheetCodecException e) {
            err.println(e.getMessage());
            return EXIT_CODEC_FAILURE;
        }
    }

    private static void print(FlowsheetGraph graph, PrintStream out) {
        for (UnitNode unit : graph.units()) {
            out.println("unit " + unit.getId());
        }
        for (Stream stream : graph.streams()) {
            out.println("stream " + stream);
        }
    }
}
