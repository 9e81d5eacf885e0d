package Engine;

import report.CallAnalysis;
import report.VerificationStatus;

/**
 * Anything that can sit at a position of the search tree: an unmaterialized
 * {@link NodeStem} or a {@link SearchTreeNode}. The set of kinds is closed;
 * subclasses live in this package only.
 */
public abstract class NodeLike {

    NodeLike() {
    }

    public boolean isExhausted() {
        return false;
    }

    /**
     * The report of this subtree so far. A CONFIRMED status is only ever
     * reported by an exhausted node.
     */
    public abstract CallAnalysis getResult();

    public VerificationStatus getStatus() {
        return getResult().getVerificationStatus();
    }

    public boolean isStem() {
        return false;
    }

    public abstract StateSpaceCounter stats();
}
