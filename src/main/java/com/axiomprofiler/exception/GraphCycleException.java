package com.axiomprofiler.exception;

/**
 * Thrown when a dependency points from an entity that was not discovered strictly before its target.
 */
public class GraphCycleException extends InconsistentFactStoreException {

    private final int source;
    private final int target;

    public GraphCycleException(int source, int target) {
        super("Edge " + source + " -> " + target + " does not follow discovery order");
        this.source = source;
        this.target = target;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }
}
