package edu.uw.cse.flowchart.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A program point in the control flow graph.
 * Identity is the integer id alone; label and kind never take part in equality.
 * Predecessors are stored as ids so nodes never alias each other.
 */
public final class Node {
    private final int id;
    private final String label; // empty for hidden nodes
    private final NodeKind kind;
    private final SortedSet<Integer> predecessors;

    Node(int id, String label, NodeKind kind, Collection<Integer> predecessors) {
        this.id = id;
        this.label = Objects.requireNonNull(label);
        this.kind = Objects.requireNonNull(kind);
        this.predecessors = Collections.unmodifiableSortedSet(new TreeSet<>(predecessors));
    }

    public int getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public NodeKind getKind() {
        return kind;
    }

    /** Ids of the nodes this one receives control from, in ascending order. */
    public SortedSet<Integer> getPredecessors() {
        return predecessors;
    }

    public boolean isHidden() {
        return label.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return id == node.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "n" + id;
    }
}
