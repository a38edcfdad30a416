package edu.uw.cse.flowchart;

import edu.uw.cse.flowchart.graph.ControlFlowGraph;
import edu.uw.cse.flowchart.output.GraphPrinter;
import edu.uw.cse.flowchart.output.MermaidRenderer;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Runs the pipeline for one source file and writes the results.
 * The flowchart is the only thing written to the output stream; the text summary
 * and DOT file are debugging aids controlled by {@link FlowchartConfig}.
 */
public class FlowchartRunner {

    private final FlowchartConfig config;
    private final Path sourceFile;
    private final File dotDir;

    public FlowchartRunner(FlowchartConfig config, Path sourceFile, File dotDir) {
        this.config = config;
        this.sourceFile = sourceFile;
        this.dotDir = dotDir;
    }

    public FlowchartRunner(FlowchartConfig config, Path sourceFile) {
        this(config, sourceFile, new File("dot-graph"));
    }

    public void run(PrintStream out) throws IOException {
        String source = SourceParser.readSource(sourceFile);
        if (config.debug) {
            System.err.println("Debug: read " + source.length() + " characters from " + sourceFile);
        }

        ControlFlowGraph graph = new FlowchartGenerator(config).buildGraph(source);
        String sourceName = sourceFile.getFileName().toString();

        if (config.debug) {
            GraphPrinter.printTextSummary(graph, sourceName, System.err);
        }
        if (config.writeDot) {
            GraphPrinter.writeDotFile(graph, sourceName, dotDir);
        }

        out.print(MermaidRenderer.render(graph));
        out.flush();
    }
}
