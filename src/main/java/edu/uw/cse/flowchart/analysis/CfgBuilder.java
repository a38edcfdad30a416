package edu.uw.cse.flowchart.analysis;

import edu.uw.cse.flowchart.FlowchartConfig;
import edu.uw.cse.flowchart.ast.ConstructVisitor;
import edu.uw.cse.flowchart.ast.FlowConstruct;
import edu.uw.cse.flowchart.graph.ControlFlowGraph;
import edu.uw.cse.flowchart.graph.Node;
import edu.uw.cse.flowchart.graph.NodeKind;
import edu.uw.cse.flowchart.graph.PredecessorStack;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Single-pass traversal that turns a classified program into a control flow graph.
 *
 * The top frame of the predecessor stack always holds the nodes the next created
 * node must link back to. Each instance is one traversal session: it owns its own
 * node store and stack and is used by exactly one {@link #build(List)} call.
 *
 * Rules:
 * <ul>
 *   <li>Sequential and unsupported constructs: one STATEMENT node, which becomes the
 *       only open predecessor.</li>
 *   <li>Branch: DECISION node, then each arm in its own frame starting from a hidden
 *       entry node; afterwards the open set is the union of both arm exits. There is
 *       no merge node, fan-in shows up as several predecessors on the next node.</li>
 *   <li>Definition: DEFINITION node linked into the enclosing flow; its body is built
 *       in a fresh empty frame whose exits are dropped, so the body never leaks into
 *       the enclosing sequence.</li>
 * </ul>
 */
public class CfgBuilder implements ConstructVisitor<Void> {

    static final String START_LABEL = "Start";
    static final String STOP_LABEL = "Stop";

    private final FlowchartConfig config;
    private final ControlFlowGraph graph = new ControlFlowGraph();
    private final PredecessorStack stack = new PredecessorStack();
    private boolean used;

    public CfgBuilder(FlowchartConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public CfgBuilder() {
        this(FlowchartConfig.defaults());
    }

    /**
     * Build the graph for a whole program.
     *
     * @param program top-level constructs in source order
     * @return the completed graph, bracketed by exactly one START and one STOP node
     */
    public ControlFlowGraph build(List<FlowConstruct> program) {
        if (used) {
            throw new IllegalStateException("A CfgBuilder builds exactly one graph");
        }
        used = true;

        stack.push(Set.of());
        Node start = create(START_LABEL, NodeKind.START);
        stack.replaceTop(Set.of(start.getId()));

        visitAll(program);

        create(STOP_LABEL, NodeKind.STOP);
        stack.pop();
        if (!stack.isEmpty()) {
            throw new IllegalStateException("Unbalanced predecessor stack: " + stack.depth() + " frames left");
        }
        return graph;
    }

    @Override
    public Void visitSequential(FlowConstruct.Sequential sequential) {
        statement(sequential.label());
        return null;
    }

    @Override
    public Void visitUnsupported(FlowConstruct.Unsupported unsupported) {
        if (config.debug) {
            System.err.println("Debug: " + unsupported.category() + " drawn as a single statement: "
                + unsupported.label());
        }
        statement(unsupported.label());
        return null;
    }

    @Override
    public Void visitBranch(FlowConstruct.Branch branch) {
        Node decision = create(branch.label(), NodeKind.DECISION);
        Set<Integer> afterDecision = Set.of(decision.getId());
        stack.replaceTop(afterDecision);

        Set<Integer> trueExit = arm(afterDecision, NodeKind.TRUE_BRANCH_ENTRY, branch.thenPart());
        Set<Integer> falseExit = arm(afterDecision, NodeKind.FALSE_BRANCH_ENTRY, branch.elsePart());

        Set<Integer> merged = new LinkedHashSet<>(trueExit);
        merged.addAll(falseExit);
        stack.replaceTop(merged);
        return null;
    }

    @Override
    public Void visitDefinition(FlowConstruct.Definition definition) {
        Node def = create(definition.label(), NodeKind.DEFINITION);
        stack.replaceTop(Set.of(def.getId()));

        stack.push(Set.of());
        visitAll(definition.body());
        Set<Integer> bodyExit = stack.pop();
        if (config.debug) {
            System.err.println("Debug: body of " + def + " ends at " + bodyExit + " (not linked back)");
        }
        return null;
    }

    // --- Helpers ---

    private Set<Integer> arm(Set<Integer> entryFrame, NodeKind entryKind, List<FlowConstruct> body) {
        stack.push(entryFrame);
        Node entry = create("", entryKind);
        stack.replaceTop(Set.of(entry.getId()));
        visitAll(body);
        return stack.pop();
    }

    private void statement(String label) {
        Node node = create(label, NodeKind.STATEMENT);
        stack.replaceTop(Set.of(node.getId()));
    }

    private void visitAll(List<FlowConstruct> constructs) {
        for (FlowConstruct construct : constructs) {
            construct.accept(this);
        }
    }

    private Node create(String label, NodeKind kind) {
        Node node = graph.create(label, kind, stack.peek());
        if (config.debug) {
            System.err.println("Debug: " + node + " [" + kind + "] \"" + label + "\" <- " + node.getPredecessors());
        }
        return node;
    }
}
