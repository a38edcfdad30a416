package edu.uw.cse.flowchart.output;

import edu.uw.cse.flowchart.graph.ControlFlowGraph;
import edu.uw.cse.flowchart.graph.Node;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

/**
 * Prints control flow graphs in text and DOT (Graphviz) format.
 *
 * DOT shapes follow the Mermaid output:
 *   Start/Stop/Definition -> ellipse
 *   Decision              -> diamond
 *   everything else       -> box (hidden branch entries are small points)
 */
public class GraphPrinter {

    /**
     * Print a plain listing of the graph's nodes and edges.
     */
    public static void printTextSummary(ControlFlowGraph graph, String title, PrintStream out) {
        out.println("--- Control Flow Graph for " + title + " ---");
        out.println("Nodes (" + graph.size() + "):");
        for (Node n : graph.getNodes()) {
            out.println("  " + n + " [" + n.getKind() + "]" + (n.isHidden() ? "" : " " + n.getLabel()));
        }
        out.println("Edges (" + graph.edgeCount() + "):");
        if (graph.edgeCount() == 0) {
            out.println("  (none)");
        }
        for (Node n : graph.getNodes()) {
            for (int predId : n.getPredecessors()) {
                String label = MermaidRenderer.edgeLabel(graph.get(predId));
                out.println("  n" + predId + " -> " + n + (label != null ? " (" + label + ")" : ""));
            }
        }
        out.println();
    }

    /**
     * Generate a DOT string for the given graph.
     */
    public static String generateDotString(ControlFlowGraph graph, String title) {
        StringWriter sw = new StringWriter();
        PrintWriter out = new PrintWriter(sw);

        out.println("digraph \"" + escapeDot(title) + "\" {");
        out.println("  rankdir=TB;");
        out.println("  node [fontname=\"Helvetica\", fontsize=10];");
        out.println("  edge [fontname=\"Helvetica\", fontsize=9];");
        out.println();

        for (Node n : graph.getNodes()) {
            out.println("  \"" + n + "\" [" + dotNodeAttrs(n) + "];");
        }
        out.println();

        for (Node n : graph.getNodes()) {
            for (int predId : n.getPredecessors()) {
                String label = MermaidRenderer.edgeLabel(graph.get(predId));
                String attrs = label != null ? " [label=\"" + label + "\"]" : "";
                out.println("  \"n" + predId + "\" -> \"" + n + "\"" + attrs + ";");
            }
        }

        out.println("}");
        out.flush();
        return sw.toString();
    }

    /**
     * Write a DOT file for the graph into dot-graph/, named after the source.
     * Failures are reported and otherwise ignored; the DOT file is an extra.
     *
     * @return the written file, or null if writing failed
     */
    public static File writeDotFile(ControlFlowGraph graph, String sourceName, File dotDir) {
        String fileName = sanitizeFileName(sourceName) + ".dot";

        if (!dotDir.exists()) {
            dotDir.mkdirs();
        }

        File target = new File(dotDir, fileName);
        try (PrintWriter out = new PrintWriter(new FileWriter(target, StandardCharsets.UTF_8))) {
            out.print(generateDotString(graph, sourceName));
            System.err.println("DOT output written to: " + target.getPath());
            return target;
        } catch (IOException e) {
            System.err.println("Error writing DOT file " + target.getPath() + ": " + e.getMessage());
            return null;
        }
    }

    // --- Helpers ---

    private static String dotNodeAttrs(Node n) {
        String label = "label=\"" + escapeDot(n.getLabel()) + "\"";
        return switch (MermaidRenderer.shapeOf(n.getKind())) {
            case TERMINAL -> label + ", shape=ellipse, style=filled, fillcolor=lightblue";
            case DECISION -> label + ", shape=diamond, style=filled, fillcolor=khaki";
            case PROCESS -> n.isHidden() ? "label=\"\", shape=point" : label + ", shape=box";
        };
    }

    /**
     * Generate a safe filename base from a source name (no extension).
     */
    public static String sanitizeFileName(String name) {
        String base = name.endsWith(".java") ? name.substring(0, name.length() - 5) : name;
        base = base.replaceAll("[^A-Za-z0-9_.-]", "_")
                   .replaceAll("_+", "_")
                   .replaceAll("^_|_$", "");
        if (base.isEmpty()) {
            base = "flowchart";
        }
        if (base.length() > 80) {
            base = base.substring(0, 80);
        }
        return base;
    }

    private static String escapeDot(String s) {
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\r\n", "\\n")
                .replace("\n", "\\n");
    }
}
