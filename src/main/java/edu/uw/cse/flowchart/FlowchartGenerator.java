package edu.uw.cse.flowchart;

import com.github.javaparser.ast.Node;
import edu.uw.cse.flowchart.analysis.CfgBuilder;
import edu.uw.cse.flowchart.analysis.UnimplementedHookException;
import edu.uw.cse.flowchart.ast.ConstructClassifier;
import edu.uw.cse.flowchart.ast.FlowConstruct;
import edu.uw.cse.flowchart.graph.ControlFlowGraph;
import edu.uw.cse.flowchart.output.MermaidRenderer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Source text in, flowchart text out: parse, classify, traverse, render.
 * Every call starts a fresh traversal session; nothing is shared between calls.
 */
public class FlowchartGenerator {

    private final FlowchartConfig config;
    private final SourceParser parser;
    private final ConstructClassifier classifier;

    public FlowchartGenerator(FlowchartConfig config, SourceParser parser, ConstructClassifier classifier) {
        this.config = config != null ? config : FlowchartConfig.defaults();
        this.parser = parser;
        this.classifier = classifier;
    }

    public FlowchartGenerator(FlowchartConfig config) {
        this(config, new SourceParser(), new ConstructClassifier());
    }

    public FlowchartGenerator() {
        this(FlowchartConfig.defaults());
    }

    /** Build the control flow graph of the given source text. */
    public ControlFlowGraph buildGraph(String source) {
        if (parser == null) {
            throw new UnimplementedHookException("source parser");
        }
        if (classifier == null) {
            throw new UnimplementedHookException("construct classifier");
        }

        Node root = parser.parse(source);
        List<FlowConstruct> program = classifier.classify(root);
        if (config.debug) {
            System.err.println("Debug: " + program.size() + " top-level constructs");
        }
        return new CfgBuilder(config).build(program);
    }

    /** Render the given source text as a Mermaid flowchart. */
    public String generate(String source) {
        return MermaidRenderer.render(buildGraph(source));
    }

    /** Render the given source file as a Mermaid flowchart. */
    public String generate(Path sourceFile) throws IOException {
        return generate(SourceParser.readSource(sourceFile));
    }
}
