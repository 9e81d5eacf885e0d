package Engine;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import report.CallAnalysis;
import solver.SymbolSolver;
import utils.Log;

import java.util.Random;

/**
 * One narrowing step toward a concrete value for an expression: the positive
 * side pins the expression to the value found in the solver's current model,
 * the negative side excludes that value.
 */
public final class ModelValueNode extends WorstResultNode {
    private final Expr valueExpr;
    private final Expr conditionValue;
    private final String statsKey;

    public ModelValueNode(Random random, Expr valueExpr, SymbolSolver solver) {
        this(random, valueExpr, solver, modelValue(valueExpr, solver));
    }

    private ModelValueNode(Random random, Expr valueExpr, SymbolSolver solver, Expr conditionValue) {
        super(random, solver.getContext().mkEq(valueExpr, conditionValue), solver);
        this.valueExpr = valueExpr;
        this.conditionValue = conditionValue;
        this.statsKey = valueExpr.isConst() ? "realize_" + valueExpr : null;
    }

    private static Expr modelValue(Expr valueExpr, SymbolSolver solver) {
        if (!solver.isSat()) {
            if (Log.isDebugEnabled()) {
                Log.debug("Solver unexpectedly unsat; solver state:\n" + solver);
            }
            throw new EngineInternalError("Unexpected unsat from solver");
        }
        return solver.evaluate(valueExpr);
    }

    public Expr getValueExpr() {
        return valueExpr;
    }

    public Expr getConditionValue() {
        return conditionValue;
    }

    /** The equality this node branches on, {@code valueExpr == conditionValue}. */
    public BoolExpr getCondition() {
        return expr;
    }

    @Override
    protected NodeResult computeResult(CallAnalysis leafAnalysis) {
        int oldRealizations = statsKey == null ? 0 : stats.getCounter(statsKey);
        NodeResult computed = super.computeResult(leafAnalysis);
        if (statsKey != null) {
            stats = stats.copy();
            stats.setCounter(statsKey, oldRealizations + 1);
        }
        return computed;
    }

    @Override
    public String toString() {
        return "ModelValueNode(" + valueExpr + " == " + conditionValue + ")";
    }
}
