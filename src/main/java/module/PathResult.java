package module;

import Engine.NodeResult;
import report.CallAnalysis;

/** How one iteration ended, the report it filed and the tree's report afterwards. */
public class PathResult {

    public enum Kind {
        COMPLETED,
        TIMEOUT,
        IGNORED,
        NOT_DETERMINISTIC
    }

    private final Kind kind;
    private final CallAnalysis analysis;
    private final NodeResult top;

    public PathResult(Kind kind, CallAnalysis analysis, NodeResult top) {
        this.kind = kind;
        this.analysis = analysis;
        this.top = top;
    }

    public Kind getKind() {
        return kind;
    }

    public CallAnalysis getAnalysis() {
        return analysis;
    }

    public NodeResult getTop() {
        return top;
    }

    @Override
    public String toString() {
        return "PathResult{" + kind + ", " + analysis + "}";
    }
}
