package edu.uw.cse.flowchart;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.junit.Test;

import static org.junit.Assert.*;

public class SourceParserTest {

    private final SourceParser parser = new SourceParser();

    @Test
    public void testCompilationUnit() {
        Node root = parser.parse("package p;\nclass A { }");
        assertTrue(root instanceof CompilationUnit);
    }

    @Test
    public void testRecordsNeedJava17Level() {
        assertTrue(parser.parse("record P(int x) { }") instanceof CompilationUnit);
    }

    @Test
    public void testSnippet() {
        Node root = parser.parse("x = 1;\nif (x > 0) y(); // trailing comment");
        assertTrue(root instanceof BlockStmt);
        assertEquals(2, ((BlockStmt) root).getStatements().size());
    }

    @Test
    public void testEmptySourceIsEmptyCompilationUnit() {
        CompilationUnit unit = (CompilationUnit) parser.parse("");
        assertTrue(unit.getTypes().isEmpty());
    }

    @Test
    public void testGarbageIsRejected() {
        try {
            parser.parse("class {{{ ");
            fail("expected ParseProblemException");
        } catch (ParseProblemException e) {
            assertFalse(e.getProblems().isEmpty());
        }
    }
}
