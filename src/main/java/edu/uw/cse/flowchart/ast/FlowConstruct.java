package edu.uw.cse.flowchart.ast;

import java.util.List;
import java.util.Objects;

/**
 * The closed set of construct categories the control flow traversal understands.
 * Anything the parser produces is mapped onto one of these variants by
 * {@link ConstructClassifier} before traversal starts.
 */
public sealed interface FlowConstruct
        permits FlowConstruct.Sequential, FlowConstruct.Branch,
                FlowConstruct.Definition, FlowConstruct.Unsupported {

    String label();

    <R> R accept(ConstructVisitor<R> visitor);

    /** A statement that simply passes control to the next one. */
    record Sequential(String label) implements FlowConstruct {
        public Sequential {
            Objects.requireNonNull(label);
        }

        @Override
        public <R> R accept(ConstructVisitor<R> visitor) {
            return visitor.visitSequential(this);
        }
    }

    /** An if/else. A missing else arm is an empty list. */
    record Branch(String label, List<FlowConstruct> thenPart, List<FlowConstruct> elsePart)
            implements FlowConstruct {
        public Branch {
            Objects.requireNonNull(label);
            thenPart = List.copyOf(thenPart);
            elsePart = List.copyOf(elsePart);
        }

        @Override
        public <R> R accept(ConstructVisitor<R> visitor) {
            return visitor.visitBranch(this);
        }
    }

    /** A named unit (type, method, constructor, initializer) whose body runs on invocation. */
    record Definition(String label, List<FlowConstruct> body) implements FlowConstruct {
        public Definition {
            Objects.requireNonNull(label);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(ConstructVisitor<R> visitor) {
            return visitor.visitDefinition(this);
        }
    }

    /**
     * A construct that redirects control in a way the traversal does not model yet.
     * It is drawn as a single opaque statement.
     */
    record Unsupported(Category category, String label) implements FlowConstruct {
        public Unsupported {
            Objects.requireNonNull(category);
            Objects.requireNonNull(label);
        }

        @Override
        public <R> R accept(ConstructVisitor<R> visitor) {
            return visitor.visitUnsupported(this);
        }

        public enum Category {
            LOOP,
            EXCEPTION_HANDLING,
            SWITCH
        }
    }
}
