package Engine;

/** A decision with a positive and a negative child. */
public abstract class BinaryPathNode extends SearchTreeNode {
    protected final NodeSlot positive = new NodeSlot();
    protected final NodeSlot negative = new NodeSlot();
    protected StateSpaceCounter stats = new StateSpaceCounter();

    BinaryPathNode() {
    }

    public NodeSlot getPositive() {
        return positive;
    }

    public NodeSlot getNegative() {
        return negative;
    }

    /** Statistics of the positive and negative subtrees, in that order. */
    public StateSpaceCounter[] statsLookahead() {
        return new StateSpaceCounter[] {positive.get().stats(), negative.get().stats()};
    }

    @Override
    public StateSpaceCounter stats() {
        return stats;
    }
}
