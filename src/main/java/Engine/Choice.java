package Engine;

/** Outcome of asking a node which way to go: the decision and the slot it leads to. */
public final class Choice {
    private final boolean decision;
    private final NodeSlot next;

    public Choice(boolean decision, NodeSlot next) {
        this.decision = decision;
        this.next = next;
    }

    public boolean getDecision() {
        return decision;
    }

    public NodeSlot getNext() {
        return next;
    }
}
