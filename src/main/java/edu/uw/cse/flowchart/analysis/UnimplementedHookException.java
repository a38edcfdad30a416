package edu.uw.cse.flowchart.analysis;

/**
 * Thrown when an integration point the traversal depends on has not been wired up.
 * This is a configuration defect, not a property of the input, so it is never recovered.
 */
public class UnimplementedHookException extends RuntimeException {

    private final String hook;

    public UnimplementedHookException(String hook) {
        super("Required hook is not configured: " + hook);
        this.hook = hook;
    }

    public String getHook() {
        return hook;
    }
}
