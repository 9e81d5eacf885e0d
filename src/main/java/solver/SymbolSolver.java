package solver;

import com.microsoft.z3.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import init.Config;
import utils.Log;

/**
 * Constraint-solving capability used by the exploration engine: an
 * accumulating set of assertions, satisfiability checks under a timeout, and
 * model extraction right after a satisfiable check.
 */
public class SymbolSolver {
    private final Context ctx;
    private final Solver solver;
    private final int timeoutMillis;
    private int checkCount;

    public SymbolSolver(Context ctx) {
        this(ctx, Config.solverTimeoutMillis);
    }

    public SymbolSolver(Context ctx, int timeoutMillis) {
        this.ctx = ctx;
        this.timeoutMillis = timeoutMillis;
        this.solver = ctx.mkSolver();
        Params params = ctx.mkParams();
        params.add("timeout", timeoutMillis);
        this.solver.setParameters(params);
    }

    public Context getContext() {
        return ctx;
    }

    public int getTimeoutMillis() {
        return timeoutMillis;
    }

    /** Number of satisfiability checks issued so far. */
    public int getCheckCount() {
        return checkCount;
    }

    public void add(BoolExpr constraint) {
        solver.add(constraint);
    }

    public BoolExpr[] getAssertions() {
        return solver.getAssertions();
    }

    /**
     * Checks the current assertions together with {@code assumptions}, which
     * are not retained. An UNKNOWN answer is never treated as unsat.
     */
    public boolean isSat(BoolExpr... assumptions) {
        checkCount++;
        Status status = solver.check(assumptions);
        if (status == Status.UNKNOWN) {
            String reason = solver.getReasonUnknown();
            if (Log.isDebugEnabled()) {
                Log.debug("Unknown satisfiability (" + reason + "). Solver state follows:\n" + solver);
            }
            throw new UnknownSatisfiability(reason);
        }
        return status == Status.SATISFIABLE;
    }

    /** The model of the last check; only valid right after a satisfiable answer. */
    public Model getModel() {
        Model model = solver.getModel();
        if (model == null) {
            throw new IllegalStateException("No model available; last check was not satisfiable");
        }
        return model;
    }

    public Expr evaluate(Expr expr) {
        return getModel().evaluate(expr, true);
    }

    @Override
    public String toString() {
        return solver.toString();
    }

    /**
     * Converts a model value into a plain Java value: integers to {@code Long}
     * (or {@code BigInteger} when wider), rationals to {@code Double}, booleans,
     * strings, bit-vectors to {@code Long}, unit/concat sequences to lists.
     * Anything else is returned as its text.
     */
    public static Object modelValueToJava(Expr value) {
        if (value instanceof IntNum) {
            BigInteger big = ((IntNum) value).getBigInteger();
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (value instanceof RatNum) {
            RatNum rat = (RatNum) value;
            return rat.getNumerator().getBigInteger().doubleValue()
                    / rat.getDenominator().getBigInteger().doubleValue();
        }
        if (value instanceof BitVecNum) {
            return ((BitVecNum) value).getLong();
        }
        if (value.isTrue()) {
            return Boolean.TRUE;
        }
        if (value.isFalse()) {
            return Boolean.FALSE;
        }
        if (value.isString()) {
            return value.getString();
        }
        if (value instanceof SeqExpr) {
            List<Object> items = new ArrayList<>();
            collectSequence(value, items);
            return items;
        }
        return value.toString();
    }

    private static void collectSequence(Expr seq, List<Object> items) {
        if (seq.isApp() && seq.getNumArgs() == 2 && seq.getFuncDecl().getName().toString().equals("seq.++")) {
            for (Expr part : seq.getArgs()) {
                collectSequence(part, items);
            }
        } else if (seq.isApp() && seq.getNumArgs() == 1 && seq.getFuncDecl().getName().toString().equals("seq.unit")) {
            items.add(modelValueToJava(seq.getArgs()[0]));
        } else if (seq.isApp() && seq.getNumArgs() == 0) {
            // seq.empty
            return;
        } else {
            items.add(seq.toString());
        }
    }
}
