package edu.uw.cse.flowchart;

/**
 * Holds the run options. The command line takes only the source path, so the
 * options are read from system properties (-Dflowchart.debug=true, -Dflowchart.dot=true).
 * Passed to all pipeline components.
 */
public class FlowchartConfig {
    public static final String DEBUG_PROPERTY = "flowchart.debug";
    public static final String DOT_PROPERTY = "flowchart.dot";

    public final boolean debug;
    public final boolean writeDot;

    public FlowchartConfig(boolean debug, boolean writeDot) {
        this.debug = debug;
        this.writeDot = writeDot;
    }

    public static FlowchartConfig defaults() {
        return new FlowchartConfig(false, false);
    }

    public static FlowchartConfig fromSystemProperties() {
        return new FlowchartConfig(Boolean.getBoolean(DEBUG_PROPERTY), Boolean.getBoolean(DOT_PROPERTY));
    }
}
