package Engine;

import init.Config;
import report.CallAnalysis;

import java.util.Random;

/**
 * Picks whichever child is not exhausted yet; when both are open, picks at
 * random with {@link #falseProbability()} of going negative. The solver is
 * not consulted.
 */
public class RandomizedBinaryPathNode extends BinaryPathNode {
    protected final Random random;

    public RandomizedBinaryPathNode(Random random) {
        this.random = random;
    }

    public double falseProbability() {
        return Config.defaultFalseProbability;
    }

    @Override
    public Choice choose(boolean favorTrue) {
        boolean positiveOk = !positive.get().isExhausted();
        boolean negativeOk = !negative.get().isExhausted();
        if (!positiveOk && !negativeOk) {
            throw new EngineInternalError("Both branches of " + this + " are exhausted");
        }
        boolean choice;
        if (positiveOk && negativeOk) {
            if (favorTrue) {
                choice = true;
            } else {
                choice = random.nextDouble() > falseProbability();
            }
        } else {
            choice = positiveOk;
        }
        return new Choice(choice, choice ? positive : negative);
    }

    @Override
    protected NodeResult computeResult(CallAnalysis leafAnalysis) {
        NodeLike pos = positive.get();
        NodeLike neg = negative.get();
        stats = pos.stats().plus(neg.stats());
        return NodeResult.mergeNodeResults(pos.getResult(), pos.isExhausted(), neg);
    }

    @Override
    public String toString() {
        return "RandomizedBinaryPathNode(false_pct=" + falseProbability() + ")";
    }
}
