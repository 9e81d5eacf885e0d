package Engine;

import init.Config;
import report.CallAnalysis;

import java.util.Random;

/**
 * A node whose branch is fixed by construction, used as the synthetic root of
 * a search. The root owns the random source shared by the whole tree.
 */
public class SinglePathNode extends SearchTreeNode {
    protected final boolean decision;
    protected final NodeSlot child = new NodeSlot();
    private final Random random;

    public SinglePathNode(boolean decision) {
        this(decision, new Random(Config.randomSeed));
    }

    public SinglePathNode(boolean decision, Random random) {
        this.decision = decision;
        this.random = random;
    }

    public Random getRandom() {
        return random;
    }

    public NodeSlot getChild() {
        return child;
    }

    @Override
    public Choice choose(boolean favorTrue) {
        return new Choice(decision, child);
    }

    @Override
    protected NodeResult computeResult(CallAnalysis leafAnalysis) {
        NodeLike node = child.get();
        return new NodeResult(node.getResult(), node.isExhausted());
    }

    @Override
    public StateSpaceCounter stats() {
        return child.get().stats();
    }

    @Override
    public String toString() {
        return "SinglePathNode(" + decision + ")";
    }
}
