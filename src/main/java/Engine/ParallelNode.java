package Engine;

import report.CallAnalysis;
import report.VerificationStatus;

import java.util.Random;

/**
 * Races two alternative search strategies for the same decision: the first
 * child to finish with a decisive (non-UNKNOWN) verdict wins. Once one side is
 * exhausted, all further iterations go to the other side.
 */
public final class ParallelNode extends RandomizedBinaryPathNode {
    private double falseProbability;
    private final String desc;

    public ParallelNode(Random random, double falseProbability, String desc) {
        super(random);
        this.falseProbability = falseProbability;
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }

    void setFalseProbability(double falseProbability) {
        this.falseProbability = falseProbability;
    }

    @Override
    public double falseProbability() {
        return positive.get().isExhausted() ? 1.0 : falseProbability;
    }

    @Override
    protected NodeResult computeResult(CallAnalysis leafAnalysis) {
        NodeLike pos = positive.get();
        NodeLike neg = negative.get();
        boolean posExhausted = pos.isExhausted();
        boolean negExhausted = neg.isExhausted();
        if (posExhausted && pos.getStatus() != VerificationStatus.UNKNOWN) {
            stats = pos.stats().verdictsOnly();
            return new NodeResult(pos.getResult(), true);
        }
        if (negExhausted && neg.getStatus() != VerificationStatus.UNKNOWN) {
            stats = neg.stats().verdictsOnly();
            return new NodeResult(neg.getResult(), true);
        }
        stats = pos.stats().plus(neg.stats()).verdictsOnly();
        return NodeResult.mergeNodeResults(pos.getResult(), posExhausted && negExhausted, neg);
    }

    @Override
    public String toString() {
        return "ParallelNode(false_pct=" + falseProbability + ", " + desc + ")";
    }
}
