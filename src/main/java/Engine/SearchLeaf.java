package Engine;

import report.CallAnalysis;

/** Terminal node holding one path's final report; always exhausted. */
public final class SearchLeaf extends SearchTreeNode {
    private final StateSpaceCounter stats;

    public SearchLeaf(CallAnalysis result) {
        this.result = result;
        this.exhausted = true;
        this.stats = StateSpaceCounter.ofLeaf(result.getVerificationStatus());
    }

    @Override
    public Choice choose(boolean favorTrue) {
        throw new EngineInternalError("A leaf has no further decisions");
    }

    @Override
    protected NodeResult computeResult(CallAnalysis leafAnalysis) {
        return new NodeResult(result, true);
    }

    @Override
    public StateSpaceCounter stats() {
        return stats;
    }

    @Override
    public String toString() {
        return "SearchLeaf(" + result + ")";
    }
}
