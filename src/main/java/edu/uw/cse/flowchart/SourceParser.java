package edu.uw.cse.flowchart;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Parses Java source text with JavaParser.
 *
 * Whole files parse as a compilation unit. Text that is not a compilation unit is
 * retried as a snippet of block statements, so "if (x) { a(); }" is accepted too.
 */
public class SourceParser {

    private final JavaParser parser;

    public SourceParser() {
        this.parser = new JavaParser(new ParserConfiguration().setLanguageLevel(LanguageLevel.JAVA_17));
    }

    /**
     * Parse source text.
     *
     * @return a {@link CompilationUnit}, or a {@link BlockStmt} holding the snippet's statements
     * @throws ParseProblemException with the compilation unit's problems if neither form parses
     */
    public Node parse(String source) {
        ParseResult<CompilationUnit> unit = parser.parse(source);
        if (unit.isSuccessful()) {
            return unit.getResult().get();
        }

        // Newlines keep a trailing line comment from swallowing the closing brace
        ParseResult<BlockStmt> snippet = parser.parseBlock("{\n" + source + "\n}");
        if (snippet.isSuccessful()) {
            return snippet.getResult().get();
        }

        throw new ParseProblemException(unit.getProblems());
    }

    /**
     * Read a whole source file as UTF-8.
     */
    public static String readSource(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
