package edu.uw.cse.flowchart.output;

import edu.uw.cse.flowchart.graph.ControlFlowGraph;
import edu.uw.cse.flowchart.graph.Node;
import edu.uw.cse.flowchart.graph.NodeKind;

/**
 * Serializes a control flow graph to Mermaid flowchart text.
 *
 * Output layout:
 * <pre>
 * flowchart TD
 *   n0(["Start"])        one line per node, in id order
 *   n1{"if (x)"}
 *   n0 --&gt; n1            then the incoming edges of each node, in the same order
 *   n1 --&gt;|True| n2
 * </pre>
 * The result depends on nothing but the graph, so rendering twice gives identical text.
 */
public class MermaidRenderer {

    public static final String HEADER = "flowchart TD";

    public static String render(ControlFlowGraph graph) {
        StringBuilder out = new StringBuilder();
        out.append(HEADER).append('\n');

        for (Node node : graph.getNodes()) {
            out.append("  ").append(nodeId(node.getId())).append(nodeShape(node)).append('\n');
        }
        for (Node node : graph.getNodes()) {
            for (int predId : node.getPredecessors()) {
                Node pred = graph.get(predId);
                out.append("  ").append(nodeId(predId)).append(" -->");
                String edgeLabel = edgeLabel(pred);
                if (edgeLabel != null) {
                    out.append('|').append(edgeLabel).append('|');
                }
                out.append(' ').append(nodeId(node.getId())).append('\n');
            }
        }
        return out.toString();
    }

    static String nodeId(int id) {
        return "n" + id;
    }

    /** True/False for edges leaving a branch entry, null for unlabelled edges. */
    static String edgeLabel(Node source) {
        return switch (source.getKind()) {
            case TRUE_BRANCH_ENTRY -> "True";
            case FALSE_BRANCH_ENTRY -> "False";
            default -> null;
        };
    }

    private static String nodeShape(Node node) {
        String label = escape(node.getLabel());
        return switch (shapeOf(node.getKind())) {
            case TERMINAL -> "([\"" + label + "\"])";
            case DECISION -> "{\"" + label + "\"}";
            case PROCESS -> "[\"" + label + "\"]";
        };
    }

    static Shape shapeOf(NodeKind kind) {
        return switch (kind) {
            case START, STOP, DEFINITION -> Shape.TERMINAL;
            case DECISION -> Shape.DECISION;
            default -> Shape.PROCESS;
        };
    }

    /**
     * Mermaid ends a quoted label at the first quote, so quotes become the entity.
     * Line breaks left inside a label (text blocks, block comments) become {@code <br/>}
     * so every node stays on one line. Hidden nodes are still drawn, with a single
     * blank as their label.
     */
    static String escape(String label) {
        if (label.isEmpty()) {
            return " ";
        }
        return label.replace("\"", "&quot;")
                    .replace("\r\n", "<br/>")
                    .replace("\n", "<br/>")
                    .replace("\r", "<br/>");
    }

    enum Shape {
        TERMINAL,
        DECISION,
        PROCESS
    }
}
