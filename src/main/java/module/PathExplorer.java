package module;

import Engine.EngineInternalError;
import Engine.IgnoreAttempt;
import Engine.NodeResult;
import Engine.NotDeterministic;
import Engine.PathTimeout;
import Engine.SinglePathNode;
import Engine.StateSpace;
import Engine.StateSpaceContext;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import report.AnalysisMessage;
import report.CallAnalysis;
import report.ConditionExpr;
import report.MessageType;
import report.VerificationStatus;
import utils.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Repeats iterations of a property against one persistent search tree until
 * the tree is exhausted, a counterexample is found, or a limit is hit.
 *
 * <p>Each explorer owns a solver context; explorations on the same explorer
 * run one at a time.
 */
public class PathExplorer implements AutoCloseable {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Context ctx;
    private final AnalysisOptions options;
    private final ReentrantLock treeLock = new ReentrantLock();

    public PathExplorer() {
        this(AnalysisOptions.fromConfig());
    }

    public PathExplorer(AnalysisOptions options) {
        this.options = options;
        this.ctx = new Context(Map.of("model", "true"));
    }

    public Context getContext() {
        return ctx;
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    public <R> ExplorationResult explore(PropertyUnderTest<R> property) {
        treeLock.lock();
        try {
            return exploreLocked(property);
        } finally {
            treeLock.unlock();
        }
    }

    private <R> ExplorationResult exploreLocked(PropertyUnderTest<R> property) {
        long startTime = System.currentTimeMillis();
        Log.info("[+] Start exploring " + property.getName() + " with " + options);
        SymbolicArgs args = new SymbolicArgs(ctx, property.getInputs());
        SinglePathNode root = new SinglePathNode(true, new Random(options.getRandomSeed()));
        long conditionDeadline = System.nanoTime() + toNanos(options.getPerConditionTimeout());

        NodeResult top = new NodeResult(new CallAnalysis(), false);
        ConditionExpr failingPrecondition = null;
        String failingPreconditionReason = "";
        int iterations = 0;
        while (iterations < options.getMaxIterations()) {
            if (System.nanoTime() > conditionDeadline) {
                Log.debug("Stopping due to per-condition timeout after " + iterations + " iterations");
                break;
            }
            iterations++;
            PathResult path = runIteration(property, args, root);
            CallAnalysis analysis = path.getAnalysis();
            switch (path.getKind()) {
                case COMPLETED:
                    Log.debug("Iteration " + iterations + " completed: " + analysis.getVerificationStatus());
                    break;
                case TIMEOUT:
                    Log.debug("Iteration " + iterations + " timed out");
                    break;
                case IGNORED:
                    Log.debug("Iteration " + iterations + " ignored");
                    break;
                case NOT_DETERMINISTIC:
                    Log.warn("Nondeterministic behavior detected in " + property.getName());
                    break;
                default:
                    throw new EngineInternalError("Unhandled path result " + path.getKind());
            }
            ConditionExpr pre = analysis.getFailingPrecondition();
            if (pre != null && (failingPrecondition == null || pre.getLine() >= failingPrecondition.getLine())) {
                failingPrecondition = pre;
                failingPreconditionReason = analysis.getFailingPreconditionReason();
            }
            top = path.getTop();
            if (top.isExhausted()) {
                Log.debug("Stopping due to code path exhaustion");
                break;
            }
            if (top.getAnalysis().getVerificationStatus() == VerificationStatus.REFUTED) {
                Log.debug("Stopping at the first counterexample");
                break;
            }
        }

        CallAnalysis summary = summarize(property, top.getAnalysis(), failingPrecondition, failingPreconditionReason);
        ExplorationResult result = new ExplorationResult(property.getName(), summary, top.isExhausted(),
                iterations, root.stats(),
                System.currentTimeMillis() - startTime);
        Log.info("[+] " + result);
        return result;
    }

    /** Runs one iteration on a fresh session and files its outcome in the tree. */
    <R> PathResult runIteration(PropertyUnderTest<R> property, SymbolicArgs args, SinglePathNode root) {
        long deadline = System.nanoTime() + toNanos(options.getPerPathTimeout());
        StateSpace space = new StateSpace(ctx, deadline, options.getSolverTimeoutMillis(), root);
        try (StateSpaceContext ignored = new StateSpaceContext(space)) {
            PathResult.Kind kind;
            CallAnalysis analysis;
            Attempt attempt = new Attempt();
            try {
                analysis = attemptCall(property, args, space, attempt);
                kind = PathResult.Kind.COMPLETED;
            } catch (PathTimeout e) {
                analysis = new CallAnalysis(VerificationStatus.UNKNOWN);
                kind = PathResult.Kind.TIMEOUT;
            } catch (IgnoreAttempt e) {
                Log.debug("Ignoring path: " + e.getMessage());
                analysis = attempt.rejectedBy == null
                        ? new CallAnalysis()
                        : CallAnalysis.failingPrecondition(attempt.rejectedBy, "precondition is false");
                kind = PathResult.Kind.IGNORED;
            } catch (NotDeterministic e) {
                analysis = new CallAnalysis(VerificationStatus.REFUTED, Collections.singletonList(
                        AnalysisMessage.fromThrowable(MessageType.NOT_DETERMINISTIC,
                                "Nondeterministic behavior in " + property.getName() + ": " + e.getMessage(), e)));
                kind = PathResult.Kind.NOT_DETERMINISTIC;
            }
            analysis = analysis.withRealizedSmtExprs(space.realizedExprs());
            NodeResult top = space.bubbleStatus(analysis);
            return new PathResult(kind, analysis, top);
        }
    }

    private static final class Attempt {
        ConditionExpr rejectedBy;
    }

    private <R> CallAnalysis attemptCall(PropertyUnderTest<R> property, SymbolicArgs args, StateSpace space,
                                         Attempt attempt) {
        for (Condition precondition : property.getPreconditions()) {
            boolean holds;
            try {
                holds = precondition.evaluate(space, args);
            } catch (Throwable e) {
                rethrowEngineFault(e);
                Log.debug("Precondition " + precondition.getExpr() + " raised " + e);
                return CallAnalysis.failingPrecondition(precondition.getExpr(), describe(e));
            }
            if (!holds) {
                attempt.rejectedBy = precondition.getExpr();
                throw new IgnoreAttempt("Precondition failed: " + precondition.getExpr().getExprSource());
            }
        }

        R returned;
        try {
            returned = property.getBody().call(space, args);
        } catch (Throwable e) {
            rethrowEngineFault(e);
            String call = counterexample(property, args, space);
            return refuted(AnalysisMessage.fromThrowable(MessageType.EXEC_ERR,
                    describe(e) + " when calling " + call, e));
        }

        Postcondition<R> postcondition = property.getPostcondition();
        ConditionExpr post = postcondition.getExpr();
        boolean holds;
        try {
            holds = postcondition.evaluate(space, args, returned);
        } catch (Throwable e) {
            rethrowEngineFault(e);
            String call = counterexample(property, args, space);
            return refuted(AnalysisMessage.fromThrowable(MessageType.POST_ERR,
                    "Error in postcondition: " + describe(e) + " when calling " + call, e));
        }
        if (!holds) {
            String call = counterexample(property, args, space);
            return refuted(new AnalysisMessage(MessageType.POST_FAIL, "false when calling " + call,
                    post.getFilename(), post.getLine(), 0, "", call, post.getExprSource()));
        }
        return new CallAnalysis(VerificationStatus.CONFIRMED);
    }

    private static CallAnalysis refuted(AnalysisMessage message) {
        return new CallAnalysis(VerificationStatus.REFUTED, Collections.singletonList(message));
    }

    /** Stops branching and renders the inputs of this path, e.g. {@code abs(x = -1)}. */
    private static String counterexample(PropertyUnderTest<?> property, SymbolicArgs args, StateSpace space) {
        space.detach();
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Expr> input : args.asMap().entrySet()) {
            Object value = space.materializeValue(input.getValue());
            parts.add(input.getKey() + " = " + (value instanceof String ? "\"" + value + "\"" : value));
        }
        return property.getName() + "(" + String.join(", ", parts) + ")";
    }

    /**
     * Lets engine faults and fatal JVM errors through; everything else the
     * property throws belongs in its report. A stack overflow is reported too.
     */
    private static void rethrowEngineFault(Throwable e) {
        if (e instanceof PathTimeout || e instanceof IgnoreAttempt || e instanceof NotDeterministic
                || e instanceof EngineInternalError) {
            throw (RuntimeException) e;
        }
        if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
            throw (VirtualMachineError) e;
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static CallAnalysis summarize(PropertyUnderTest<?> property, CallAnalysis top,
                                          ConditionExpr failingPrecondition, String reason) {
        ConditionExpr post = property.getPostcondition().getExpr();
        VerificationStatus status = top.getVerificationStatus();
        List<AnalysisMessage> messages = new ArrayList<>(top.getMessages());
        if (status == null) {
            String filename = failingPrecondition == null ? post.getFilename() : failingPrecondition.getFilename();
            int line = failingPrecondition == null ? 0 : failingPrecondition.getLine();
            String text = failingPrecondition == null
                    ? "Unable to meet precondition"
                    : "Unable to meet precondition " + failingPrecondition.getExprSource()
                    + (reason.isEmpty() ? "" : " (" + reason + ")");
            messages.add(new AnalysisMessage(MessageType.PRE_UNSAT, text, filename, line, 0, "", null,
                    failingPrecondition == null ? null : failingPrecondition.getExprSource()));
        } else if (status == VerificationStatus.CONFIRMED) {
            messages.add(new AnalysisMessage(MessageType.CONFIRMED, "Confirmed over all paths.",
                    post.getFilename(), post.getLine(), 0, "", null, post.getExprSource()));
        } else if (status == VerificationStatus.UNKNOWN && messages.isEmpty()) {
            messages.add(new AnalysisMessage(MessageType.CANNOT_CONFIRM, "Not confirmed.",
                    post.getFilename(), post.getLine(), 0, "", null, post.getExprSource()));
        }
        return new CallAnalysis(status, messages, failingPrecondition, reason, top.getRealizedSmtExprs());
    }

    private static long toNanos(double seconds) {
        return (long) (seconds * NANOS_PER_SECOND);
    }

    @Override
    public void close() {
        ctx.close();
    }
}
