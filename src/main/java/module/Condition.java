package module;

import Engine.StateSpace;
import report.ConditionExpr;

/** A precondition: where it is written and how to evaluate it on the current path. */
public class Condition {

    @FunctionalInterface
    public interface Predicate {
        boolean test(StateSpace space, SymbolicArgs args) throws Exception;
    }

    private final ConditionExpr expr;
    private final Predicate predicate;

    public Condition(ConditionExpr expr, Predicate predicate) {
        this.expr = expr;
        this.predicate = predicate;
    }

    public ConditionExpr getExpr() {
        return expr;
    }

    public boolean evaluate(StateSpace space, SymbolicArgs args) throws Exception {
        return predicate.test(space, args);
    }
}
