package Engine;

import report.CallAnalysis;

/**
 * Marks a path that stopped searching further branches. It stays
 * non-exhausted until the leaf below it reports, so that parents do not treat
 * an in-progress path as fully explored.
 */
public final class DetachedPathNode extends SinglePathNode {
    private StateSpaceCounter stats;

    public DetachedPathNode() {
        super(true, null);
        this.exhausted = false;
    }

    @Override
    protected NodeResult computeResult(CallAnalysis leafAnalysis) {
        return new NodeResult(leafAnalysis, true);
    }

    @Override
    public StateSpaceCounter stats() {
        if (stats != null) {
            return stats;
        }
        StateSpaceCounter narrowed = child.get().stats().verdictsOnly();
        if (exhausted) {
            stats = narrowed;
        }
        return narrowed;
    }

    @Override
    public String toString() {
        return "DetachedPathNode" + (exhausted ? "(exhausted)" : "");
    }
}
