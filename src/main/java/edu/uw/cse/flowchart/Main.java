package edu.uw.cse.flowchart;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * CLI entry point for the flowchart tool.
 *
 * Usage:
 *   java -jar flowchart.jar &lt;file.java&gt;
 *
 * Options are system properties, see {@link FlowchartConfig}.
 */
public class Main {

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run the tool and return the process exit status instead of exiting.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            printUsage(out);
            return 1;
        }

        FlowchartConfig config = FlowchartConfig.fromSystemProperties();
        try {
            new FlowchartRunner(config, Path.of(args[0])).run(out);
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            if (config.debug) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: flowchart <file.java>");
    }
}
