package Engine;

/**
 * An owned child position in the search tree. Growing a stem replaces the
 * slot's content; the slot itself never moves.
 */
public final class NodeSlot {
    private NodeLike node = new NodeStem();

    public NodeLike get() {
        return node;
    }

    public boolean isStem() {
        return node.isStem();
    }

    public <N extends SearchTreeNode> N growInto(N grown) {
        if (!node.isStem()) {
            throw new EngineInternalError("Cannot grow " + grown + " over materialized node " + node);
        }
        node = grown;
        return grown;
    }

    @Override
    public String toString() {
        return "NodeSlot(" + node + ")";
    }
}
