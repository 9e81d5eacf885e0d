package Engine;

import report.CallAnalysis;
import report.VerificationStatus;

/** A tree position that has not been visited yet. */
public final class NodeStem extends NodeLike {

    @Override
    public CallAnalysis getResult() {
        return new CallAnalysis(VerificationStatus.UNKNOWN);
    }

    @Override
    public boolean isStem() {
        return true;
    }

    @Override
    public StateSpaceCounter stats() {
        return new StateSpaceCounter();
    }

    @Override
    public String toString() {
        return "NodeStem";
    }
}
