package edu.uw.cse.flowchart.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Stack of "open" predecessor sets: the node ids still waiting for a successor.
 * One frame per active lexical scope (program, branch arm, definition body).
 * Frames are copied on the way in and out, so callers never share a frame.
 */
public class PredecessorStack {

    private final Deque<Set<Integer>> frames = new ArrayDeque<>();

    public void push(Set<Integer> frame) {
        frames.push(new LinkedHashSet<>(frame));
    }

    public Set<Integer> pop() {
        requireFrame();
        return Collections.unmodifiableSet(frames.pop());
    }

    public Set<Integer> peek() {
        requireFrame();
        return Collections.unmodifiableSet(frames.peek());
    }

    public void replaceTop(Set<Integer> frame) {
        requireFrame();
        frames.pop();
        frames.push(new LinkedHashSet<>(frame));
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    private void requireFrame() {
        if (frames.isEmpty()) {
            throw new NoSuchElementException("Predecessor stack has no active frame");
        }
    }
}
