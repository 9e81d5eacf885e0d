package Engine;

import report.CallAnalysis;

/**
 * A materialized decision point. Keeps the report and exhaustion flag it last
 * computed from its children, and the call-stack fingerprint of its first visit.
 */
public abstract class SearchTreeNode extends NodeLike {
    protected String statehash;
    protected CallAnalysis result = new CallAnalysis();
    protected boolean exhausted = false;

    SearchTreeNode() {
    }

    public abstract Choice choose(boolean favorTrue);

    public Choice choose() {
        return choose(false);
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public CallAnalysis getResult() {
        return result;
    }

    public String getStatehash() {
        return statehash;
    }

    /**
     * Records the fingerprint on first visit.
     *
     * @return false if a different fingerprint was recorded earlier
     */
    boolean matchStatehash(String fingerprint) {
        if (statehash == null) {
            statehash = fingerprint;
            return true;
        }
        return statehash.equals(fingerprint);
    }

    /**
     * Recomputes this node's report after a path below it finished.
     *
     * @return whether the report or the exhaustion flag changed
     */
    public boolean updateResult(CallAnalysis leafAnalysis) {
        if (!exhausted) {
            NodeResult next = computeResult(leafAnalysis);
            if (next.isExhausted() != exhausted || !next.getAnalysis().equals(result)) {
                result = next.getAnalysis();
                exhausted = next.isExhausted();
                return true;
            }
        }
        return false;
    }

    /** Ends a path on this node without growing a leaf. */
    void finish(CallAnalysis analysis) {
        result = analysis;
        exhausted = true;
    }

    protected abstract NodeResult computeResult(CallAnalysis leafAnalysis);
}
