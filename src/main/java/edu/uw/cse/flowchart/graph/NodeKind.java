package edu.uw.cse.flowchart.graph;

/**
 * The role a node plays in the control flow graph.
 *
 * START/STOP bracket the whole program, DEFINITION stands in for a method or
 * type body, DECISION is the head of an if/else, and the two branch entries are
 * the hidden nodes that carry the True/False edge labels.
 */
public enum NodeKind {
    START,
    STOP,
    DEFINITION,
    DECISION,
    TRUE_BRANCH_ENTRY,
    FALSE_BRANCH_ENTRY,
    STATEMENT
}
