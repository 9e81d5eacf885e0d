package module;

import Engine.StateSpace;
import report.ConditionExpr;

/** A check on the body's return value. */
public class Postcondition<R> {

    @FunctionalInterface
    public interface Predicate<R> {
        boolean test(StateSpace space, SymbolicArgs args, R result) throws Exception;
    }

    private final ConditionExpr expr;
    private final Predicate<R> predicate;

    public Postcondition(ConditionExpr expr, Predicate<R> predicate) {
        this.expr = expr;
        this.predicate = predicate;
    }

    public ConditionExpr getExpr() {
        return expr;
    }

    public boolean evaluate(StateSpace space, SymbolicArgs args, R result) throws Exception {
        return predicate.test(space, args, result);
    }
}
