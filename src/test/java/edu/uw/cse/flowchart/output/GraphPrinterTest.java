package edu.uw.cse.flowchart.output;

import edu.uw.cse.flowchart.analysis.CfgBuilder;
import edu.uw.cse.flowchart.ast.FlowConstruct.Branch;
import edu.uw.cse.flowchart.ast.FlowConstruct.Sequential;
import edu.uw.cse.flowchart.graph.ControlFlowGraph;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.*;

public class GraphPrinterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ControlFlowGraph graph = new CfgBuilder().build(List.of(
        new Branch("if (\"x\".isEmpty())", List.of(new Sequential("a();")), List.of())));

    @Test
    public void testTextSummary() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        GraphPrinter.printTextSummary(graph, "Demo.java", new PrintStream(buffer, true, StandardCharsets.UTF_8));
        String text = buffer.toString(StandardCharsets.UTF_8);

        assertTrue(text.startsWith("--- Control Flow Graph for Demo.java ---"));
        assertTrue(text.contains("Nodes (6):"));
        assertTrue(text.contains("  n2 [TRUE_BRANCH_ENTRY]\n"));
        assertTrue(text.contains("  n3 [STATEMENT] a();\n"));
        assertTrue(text.contains("  n2 -> n3 (True)\n"));
        assertTrue(text.contains("  n4 -> n5 (False)\n"));
    }

    @Test
    public void testDotString() {
        String dot = GraphPrinter.generateDotString(graph, "Demo.java");

        assertTrue(dot.startsWith("digraph \"Demo.java\" {"));
        assertTrue(dot.contains("\"n1\" [label=\"if (\\\"x\\\".isEmpty())\", shape=diamond"));
        assertTrue(dot.contains("\"n2\" [label=\"\", shape=point];"));
        assertTrue(dot.contains("\"n2\" -> \"n3\" [label=\"True\"];"));
        assertTrue(dot.contains("\"n0\" -> \"n1\";"));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    public void testWriteDotFile() throws Exception {
        File dir = new File(tmp.getRoot(), "dot-graph");
        File written = GraphPrinter.writeDotFile(graph, "Demo.java", dir);

        assertNotNull(written);
        assertEquals("Demo.dot", written.getName());
        String content = Files.readString(written.toPath());
        assertEquals(GraphPrinter.generateDotString(graph, "Demo.java"), content);
    }

    @Test
    public void testWriteDotFileIntoRegularFileFails() throws Exception {
        File notADirectory = tmp.newFile("dot-graph");

        assertNull(GraphPrinter.writeDotFile(graph, "Demo.java", notADirectory));
    }

    @Test
    public void testDotFileIsUtf8() throws Exception {
        ControlFlowGraph umlauts = new CfgBuilder().build(List.of(new Sequential("größe = \"ü\";")));
        File written = GraphPrinter.writeDotFile(umlauts, "Umlauts.java", tmp.newFolder("dot"));

        String content = new String(Files.readAllBytes(written.toPath()), StandardCharsets.UTF_8);
        assertTrue(content.contains("label=\"größe = \\\"ü\\\";\""));
    }

    @Test
    public void testSanitizeFileName() {
        assertEquals("Demo", GraphPrinter.sanitizeFileName("Demo.java"));
        assertEquals("my_file.txt", GraphPrinter.sanitizeFileName("my file.txt"));
        assertEquals("flowchart", GraphPrinter.sanitizeFileName("???"));
    }
}
