package edu.uw.cse.flowchart.ast;

/**
 * One method per {@link FlowConstruct} variant, so adding a variant breaks every
 * traversal that has not handled it yet.
 */
public interface ConstructVisitor<R> {

    R visitSequential(FlowConstruct.Sequential sequential);

    R visitBranch(FlowConstruct.Branch branch);

    R visitDefinition(FlowConstruct.Definition definition);

    R visitUnsupported(FlowConstruct.Unsupported unsupported);
}
