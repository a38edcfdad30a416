package edu.uw.cse.flowchart.ast;

import com.github.javaparser.JavaToken;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;
import edu.uw.cse.flowchart.ast.FlowConstruct.Unsupported.Category;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps a JavaParser tree onto the {@link FlowConstruct} union.
 *
 * Every visit returns a list because a plain block is spliced into the
 * surrounding sequence instead of becoming a node of its own. Categories without
 * an override fall through to {@link #defaultAction(Node, Void)} and become a
 * sequential statement labelled with their literal source text.
 */
public class ConstructClassifier extends GenericVisitorWithDefaults<List<FlowConstruct>, Void> {

    /**
     * Classify a parsed program: a {@link CompilationUnit} or, for snippets,
     * the {@link BlockStmt} holding its statements.
     */
    public List<FlowConstruct> classify(Node root) {
        Objects.requireNonNull(root, "root");
        return root.accept(this, null);
    }

    // --- Program and type level ---

    @Override
    public List<FlowConstruct> visit(CompilationUnit n, Void arg) {
        List<FlowConstruct> result = new ArrayList<>();
        n.getModule().ifPresent(module -> result.add(sequential(module)));
        n.getPackageDeclaration().ifPresent(pkg -> result.add(sequential(pkg)));
        for (ImportDeclaration imp : n.getImports()) {
            result.add(sequential(imp));
        }
        for (TypeDeclaration<?> type : n.getTypes()) {
            result.addAll(type.accept(this, arg));
        }
        return result;
    }

    @Override
    public List<FlowConstruct> visit(ClassOrInterfaceDeclaration n, Void arg) {
        String keyword = n.isInterface() ? "interface" : "class";
        return definition(keyword + " " + n.getNameAsString(), members(n.getMembers()));
    }

    @Override
    public List<FlowConstruct> visit(EnumDeclaration n, Void arg) {
        List<FlowConstruct> body = new ArrayList<>();
        for (EnumConstantDeclaration entry : n.getEntries()) {
            body.add(sequential(entry));
        }
        body.addAll(members(n.getMembers()));
        return definition("enum " + n.getNameAsString(), body);
    }

    @Override
    public List<FlowConstruct> visit(RecordDeclaration n, Void arg) {
        return definition("record " + n.getNameAsString(), members(n.getMembers()));
    }

    @Override
    public List<FlowConstruct> visit(AnnotationDeclaration n, Void arg) {
        return definition("@interface " + n.getNameAsString(), members(n.getMembers()));
    }

    @Override
    public List<FlowConstruct> visit(MethodDeclaration n, Void arg) {
        List<FlowConstruct> body = n.getBody()
            .map(block -> statements(block.getStatements()))
            .orElseGet(List::of);
        return definition(n.getDeclarationAsString(false, false, true), body);
    }

    @Override
    public List<FlowConstruct> visit(ConstructorDeclaration n, Void arg) {
        return definition(n.getDeclarationAsString(false, false, true),
            statements(n.getBody().getStatements()));
    }

    @Override
    public List<FlowConstruct> visit(CompactConstructorDeclaration n, Void arg) {
        return definition(n.getNameAsString(), statements(n.getBody().getStatements()));
    }

    @Override
    public List<FlowConstruct> visit(InitializerDeclaration n, Void arg) {
        String label = n.isStatic() ? "static initializer" : "initializer";
        return definition(label, statements(n.getBody().getStatements()));
    }

    // --- Statement level ---

    @Override
    public List<FlowConstruct> visit(BlockStmt n, Void arg) {
        return statements(n.getStatements());
    }

    @Override
    public List<FlowConstruct> visit(IfStmt n, Void arg) {
        String label = "if (" + literal(n.getCondition()) + ")";
        List<FlowConstruct> thenPart = n.getThenStmt().accept(this, arg);
        List<FlowConstruct> elsePart = n.getElseStmt()
            .map(stmt -> stmt.accept(this, arg))
            .orElseGet(List::of);
        return List.of(new FlowConstruct.Branch(label, thenPart, elsePart));
    }

    @Override
    public List<FlowConstruct> visit(LocalClassDeclarationStmt n, Void arg) {
        return n.getClassDeclaration().accept(this, arg);
    }

    @Override
    public List<FlowConstruct> visit(LocalRecordDeclarationStmt n, Void arg) {
        return n.getRecordDeclaration().accept(this, arg);
    }

    @Override
    public List<FlowConstruct> visit(WhileStmt n, Void arg) {
        return unsupported(Category.LOOP, n);
    }

    @Override
    public List<FlowConstruct> visit(DoStmt n, Void arg) {
        return unsupported(Category.LOOP, n);
    }

    @Override
    public List<FlowConstruct> visit(ForStmt n, Void arg) {
        return unsupported(Category.LOOP, n);
    }

    @Override
    public List<FlowConstruct> visit(ForEachStmt n, Void arg) {
        return unsupported(Category.LOOP, n);
    }

    @Override
    public List<FlowConstruct> visit(TryStmt n, Void arg) {
        return unsupported(Category.EXCEPTION_HANDLING, n);
    }

    @Override
    public List<FlowConstruct> visit(SwitchStmt n, Void arg) {
        return unsupported(Category.SWITCH, n);
    }

    /**
     * A label does not change what it labels. A labelled loop is still a loop and a
     * labelled if is still a branch; the label is prefixed to the first construct.
     */
    @Override
    public List<FlowConstruct> visit(LabeledStmt n, Void arg) {
        List<FlowConstruct> inner = n.getStatement().accept(this, arg);
        if (inner.size() == 1 && inner.get(0) instanceof FlowConstruct.Unsupported u) {
            return unsupported(u.category(), n);
        }
        if (inner.isEmpty() || (inner.size() == 1 && inner.get(0) instanceof FlowConstruct.Sequential)) {
            return defaultAction(n, arg);
        }
        List<FlowConstruct> result = new ArrayList<>(inner);
        result.set(0, inner.get(0).accept(new LabelPrefixer(n.getLabel().asString() + ": ")));
        return result;
    }

    @Override
    public List<FlowConstruct> defaultAction(Node n, Void arg) {
        return List.of(sequential(n));
    }

    @Override
    public List<FlowConstruct> defaultAction(NodeList n, Void arg) {
        List<FlowConstruct> result = new ArrayList<>();
        for (Object element : n) {
            result.addAll(((Node) element).accept(this, arg));
        }
        return result;
    }

    // --- Helpers ---

    private List<FlowConstruct> statements(NodeList<Statement> stmts) {
        List<FlowConstruct> result = new ArrayList<>();
        for (Statement stmt : stmts) {
            result.addAll(stmt.accept(this, null));
        }
        return result;
    }

    private List<FlowConstruct> members(NodeList<BodyDeclaration<?>> members) {
        List<FlowConstruct> result = new ArrayList<>();
        for (BodyDeclaration<?> member : members) {
            result.addAll(member.accept(this, null));
        }
        return result;
    }

    private static List<FlowConstruct> definition(String label, List<FlowConstruct> body) {
        return List.of(new FlowConstruct.Definition(label, body));
    }

    private static List<FlowConstruct> unsupported(Category category, Node n) {
        return List.of(new FlowConstruct.Unsupported(category, literal(n)));
    }

    private static FlowConstruct sequential(Node n) {
        return new FlowConstruct.Sequential(literal(n));
    }

    /**
     * The construct's own source text. Whitespace and line-break tokens collapse to a
     * single space; literals and comments keep their text.
     * Nodes built in memory have no token range and fall back to the printer.
     */
    static String literal(Node n) {
        Optional<TokenRange> range = n.getTokenRange();
        if (range.isEmpty()) {
            return n.toString().replaceAll("\\s+", " ").trim();
        }
        StringBuilder text = new StringBuilder();
        boolean pendingSpace = false;
        for (JavaToken token : range.get()) {
            if (token.getCategory().isWhitespace()) {
                pendingSpace = text.length() > 0;
                continue;
            }
            if (pendingSpace) {
                text.append(' ');
                pendingSpace = false;
            }
            text.append(token.getText());
        }
        return text.toString();
    }

    private static final class LabelPrefixer implements ConstructVisitor<FlowConstruct> {
        private final String prefix;

        LabelPrefixer(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public FlowConstruct visitSequential(FlowConstruct.Sequential sequential) {
            return new FlowConstruct.Sequential(prefix + sequential.label());
        }

        @Override
        public FlowConstruct visitBranch(FlowConstruct.Branch branch) {
            return new FlowConstruct.Branch(prefix + branch.label(), branch.thenPart(), branch.elsePart());
        }

        @Override
        public FlowConstruct visitDefinition(FlowConstruct.Definition definition) {
            return new FlowConstruct.Definition(prefix + definition.label(), definition.body());
        }

        @Override
        public FlowConstruct visitUnsupported(FlowConstruct.Unsupported unsupported) {
            return new FlowConstruct.Unsupported(unsupported.category(), prefix + unsupported.label());
        }
    }
}
