package Engine;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import init.Config;
import report.CallAnalysis;
import report.VerificationStatus;
import solver.SymbolSolver;
import solver.Z3ExpressionFormatter;
import utils.Log;

import java.util.Random;

/**
 * A branch on a boolean expression. On construction the solver is asked once
 * whether the expression and its negation are satisfiable; when only one is,
 * the node is forced to that side for good. Reports the worst verdict of its
 * children, or the forced child's verdict.
 */
public class WorstResultNode extends RandomizedBinaryPathNode {
    protected final BoolExpr expr;
    // null when both sides are possible
    protected Boolean forcedPath;

    public WorstResultNode(Random random, BoolExpr expr, SymbolSolver solver) {
        super(random);
        Context ctx = solver.getContext();
        BoolExpr notExpr = ctx.mkNot(expr);
        boolean couldBeTrue = solver.isSat(expr);
        boolean couldBeFalse = solver.isSat(notExpr);
        if (!couldBeTrue && !couldBeFalse) {
            Log.debug(" *** Reached impossible code path *** ");
            if (Log.isDebugEnabled()) {
                Log.debug("Current solver state:\n" + solver);
            }
            throw new EngineInternalError("Reached impossible code path");
        } else if (!couldBeTrue) {
            forcedPath = Boolean.FALSE;
        } else if (!couldBeFalse) {
            forcedPath = Boolean.TRUE;
        }
        this.expr = expr;
    }

    public BoolExpr getExpr() {
        return expr;
    }

    public Boolean getForcedPath() {
        return forcedPath;
    }

    public boolean isForced() {
        return forcedPath != null;
    }

    private boolean checkExhausted() {
        return (positive.get().isExhausted() && negative.get().isExhausted())
                || (Boolean.TRUE.equals(forcedPath) && positive.get().isExhausted())
                || (Boolean.FALSE.equals(forcedPath) && negative.get().isExhausted());
    }

    @Override
    public Choice choose(boolean favorTrue) {
        if (forcedPath == null) {
            return super.choose(favorTrue);
        }
        return new Choice(forcedPath, forcedPath ? positive : negative);
    }

    @Override
    public double falseProbability() {
        return Config.worstResultFalseProbability;
    }

    @Override
    protected NodeResult computeResult(CallAnalysis leafAnalysis) {
        NodeLike pos = positive.get();
        NodeLike neg = negative.get();
        boolean nowExhausted = checkExhausted();
        if (pos.getStatus() == VerificationStatus.REFUTED || Boolean.TRUE.equals(forcedPath)) {
            stats = pos.stats();
            return new NodeResult(pos.getResult(), nowExhausted);
        }
        if (neg.getStatus() == VerificationStatus.REFUTED || Boolean.FALSE.equals(forcedPath)) {
            stats = neg.stats();
            return new NodeResult(neg.getResult(), nowExhausted);
        }
        stats = pos.stats().plus(neg.stats());
        return NodeResult.mergeNodeResults(pos.getResult(), pos.isExhausted(), neg);
    }

    @Override
    public String toString() {
        return "WorstResultNode(" + Z3ExpressionFormatter.formatExpression(expr)
                + (checkExhausted() ? " : exhausted" : "") + ")";
    }
}
