package edu.uw.cse.flowchart.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Append-only node store. Ids are handed out densely from 0 in creation order,
 * so the backing list doubles as the id index.
 */
public class ControlFlowGraph {

    private final List<Node> nodes = new ArrayList<>();

    /**
     * Create and store a node with the next id.
     *
     * @throws IllegalArgumentException if a predecessor id does not name an existing node
     */
    public Node create(String label, NodeKind kind, Set<Integer> predecessors) {
        int id = nodes.size();
        for (Integer pred : predecessors) {
            if (pred == null || pred < 0 || pred >= id) {
                throw new IllegalArgumentException(
                    "Predecessor " + pred + " of node " + id + " does not exist yet");
            }
        }
        Node node = new Node(id, label, kind, predecessors);
        nodes.add(node);
        return node;
    }

    public Node get(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node with id " + id);
        }
        return nodes.get(id);
    }

    /** All nodes in id order. */
    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        int count = 0;
        for (Node node : nodes) {
            count += node.getPredecessors().size();
        }
        return count;
    }

    public Node getStart() {
        return findFirst(NodeKind.START);
    }

    public Node getStop() {
        return findFirst(NodeKind.STOP);
    }

    private Node findFirst(NodeKind kind) {
        for (Node node : nodes) {
            if (node.getKind() == kind) return node;
        }
        return null;
    }
}
