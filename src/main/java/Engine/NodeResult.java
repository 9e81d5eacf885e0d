package Engine;

import report.CallAnalysis;

/** A node's recomputed report paired with whether the node is now exhausted. */
public final class NodeResult {
    private final CallAnalysis analysis;
    private final boolean exhausted;

    public NodeResult(CallAnalysis analysis, boolean exhausted) {
        this.analysis = analysis;
        this.exhausted = exhausted;
    }

    public CallAnalysis getAnalysis() {
        return analysis;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * Merges {@code left} with the report of {@code node}. The result is
     * exhausted only if the caller says so and {@code node} itself is
     * exhausted.
     */
    public static NodeResult mergeNodeResults(CallAnalysis left, boolean exhausted, NodeLike node) {
        if (!node.isExhausted()) {
            exhausted = false;
        }
        return new NodeResult(CallAnalysis.merge(left, node.getResult()), exhausted);
    }
}
