package Engine;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.FuncInterp;
import init.Config;
import report.CallAnalysis;
import solver.SymbolSolver;
import solver.Z3ExpressionFormatter;
import utils.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * State of one exploration iteration: the solver with the constraints of the
 * current path, the cursor into the persistent search tree, the symbolic heap
 * and the per-path deadline. A fresh instance is made for every iteration;
 * the tree below {@code searchRoot} is what carries over.
 */
public class StateSpace {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final Context ctx;
    private final SymbolSolver solver;
    private final SinglePathNode searchRoot;
    private final Random random;
    private final List<SearchTreeNode> choicesMade = new ArrayList<>();
    private final SymbolicHeap heap;
    private final List<DeferredAssumption> deferredAssumptions = new ArrayList<>();
    private final Map<Class<?>, Object> extras = new HashMap<>();
    private final Set<Expr> alreadyLogged = new HashSet<>();
    private final Set<Expr> realizedExprs = new LinkedHashSet<>();

    private NodeSlot searchPosition;
    private long executionDeadline;
    private int nextUniq = 1;
    private boolean detached = false;

    private static final class DeferredAssumption {
        final String description;
        final BooleanSupplier checker;

        DeferredAssumption(String description, BooleanSupplier checker) {
            this.description = description;
            this.checker = checker;
        }
    }

    /**
     * @param executionDeadline {@link System#nanoTime()} value after which
     *                          the next decision times out
     */
    public StateSpace(Context ctx, long executionDeadline, int solverTimeoutMillis, SinglePathNode searchRoot) {
        this.ctx = ctx;
        this.solver = new SymbolSolver(ctx, solverTimeoutMillis);
        this.searchRoot = searchRoot;
        this.random = searchRoot.getRandom();
        this.executionDeadline = executionDeadline;
        this.heap = new SymbolicHeap(ctx, expr -> smtFork(expr, null, false));
        this.searchPosition = searchRoot.choose().getNext();
    }

    /** A session on a fresh tree with no practical deadline. */
    public static StateSpace simple(Context ctx) {
        return new StateSpace(ctx, System.nanoTime() + 10_000L * NANOS_PER_SECOND,
                Config.solverTimeoutMillis, new SinglePathNode(true));
    }

    public Context getContext() {
        return ctx;
    }

    public SymbolSolver getSolver() {
        return solver;
    }

    public SinglePathNode getSearchRoot() {
        return searchRoot;
    }

    public List<SearchTreeNode> getChoicesMade() {
        return Collections.unmodifiableList(choicesMade);
    }

    public boolean isDetached() {
        return detached;
    }

    public Set<Expr> realizedExprs() {
        return Collections.unmodifiableSet(realizedExprs);
    }

    public Random rand() {
        return random;
    }

    /** Commits to {@code expr} for the rest of this iteration. */
    public void add(BoolExpr expr) {
        solver.add(expr);
    }

    /** An object whose lifetime is tied to this session's solver. */
    public <T> T extra(Class<T> type, Function<SymbolSolver, T> factory) {
        return (T) extras.computeIfAbsent(type, t -> factory.apply(solver));
    }

    public StateSpaceCounter[] statsLookahead() {
        NodeLike node = searchPosition.get();
        if (node.isStem()) {
            return new StateSpaceCounter[] {new StateSpaceCounter(), new StateSpaceCounter()};
        }
        if (!(node instanceof BinaryPathNode)) {
            throw new EngineInternalError("Node " + node + " is not a binary path node");
        }
        return ((BinaryPathNode) node).statsLookahead();
    }

    public boolean isPossible(BoolExpr expr) {
        return solver.isSat(expr);
    }

    public boolean decide(BoolExpr expr) {
        return decide(expr, false);
    }

    /**
     * Resolves a branch on {@code expr}, commits the chosen literal to the
     * solver and moves the cursor to the chosen child.
     *
     * @throws PathTimeout       if the per-path deadline has passed
     * @throws NotDeterministic  if this position was recorded with another
     *                           node kind, expression or call stack
     */
    public boolean decide(BoolExpr expr, boolean favorTrue) {
        if (System.nanoTime() > executionDeadline) {
            Log.debug("Path execution timeout after making " + choicesMade.size() + " choices.");
            throw new PathTimeout("Path execution timeout after " + choicesMade.size() + " choices");
        }
        WorstResultNode node;
        if (searchPosition.isStem()) {
            node = searchPosition.growInto(new WorstResultNode(random, expr, solver));
        } else {
            NodeLike existing = searchPosition.get();
            if (existing.getClass() != WorstResultNode.class) {
                throw notDeterministic("Decision node expected; found " + existing + " instead.");
            }
            node = (WorstResultNode) existing;
            if (!node.getExpr().equals(expr)) {
                throw notDeterministic("Decision expression changed from:\n  "
                        + Z3ExpressionFormatter.formatExpression(node.getExpr()) + "\nTo:\n  "
                        + Z3ExpressionFormatter.formatExpression(expr));
            }
        }
        String statedesc = stackFingerprint();
        String recorded = node.getStatehash();
        if (!node.matchStatehash(statedesc)) {
            if (Log.isDebugEnabled()) {
                Log.debug(" *** Begin Not Deterministic Debug *** ");
                Log.debug("     First state:\n" + recorded);
                Log.debug("     Current state:\n" + statedesc);
                Log.debug("     Decision points prior to this:");
                for (SearchTreeNode choice : choicesMade) {
                    Log.debug("       " + choice);
                }
                Log.debug("     Stack Diff:\n" + stackDiff(recorded, statedesc));
                Log.debug(" *** End Not Deterministic Debug *** ");
            }
            throw new NotDeterministic("Call stack changed at a replayed decision:\n"
                    + stackDiff(recorded, statedesc));
        }
        Choice choice = node.choose(favorTrue);
        choicesMade.add(node);
        searchPosition = choice.getNext();
        BoolExpr chosenExpr = choice.getDecision() ? expr : ctx.mkNot(expr);
        if (Log.isDebugEnabled() && alreadyLogged.add(chosenExpr)) {
            Log.debug("SMT chose: " + Z3ExpressionFormatter.formatExpression(chosenExpr));
        }
        add(chosenExpr);
        return choice.getDecision();
    }

    public boolean preferTrue(BoolExpr expr) {
        return decide(expr, true);
    }

    /**
     * Races two search strategies at this position. No constraint is added.
     */
    public boolean fork(double falseProbability, String desc) {
        ParallelNode node;
        if (searchPosition.isStem()) {
            node = searchPosition.growInto(new ParallelNode(random, falseProbability, desc));
        } else {
            NodeLike existing = searchPosition.get();
            if (!(existing instanceof ParallelNode)) {
                throw notDeterministic("Parallel node expected; found " + existing + " instead.");
            }
            node = (ParallelNode) existing;
            if (!Objects.equals(node.getDesc(), desc)) {
                throw notDeterministic("Parallel node changed from " + node.getDesc() + " to " + desc);
            }
            node.setFalseProbability(falseProbability);
        }
        choicesMade.add(node);
        Choice choice = node.choose();
        searchPosition = choice.getNext();
        return choice.getDecision();
    }

    /**
     * Pins {@code expr} to one concrete value of the solver's model. Each
     * rejected candidate is excluded before the next one is drawn.
     */
    public Object materializeValue(Expr expr) {
        while (true) {
            if (searchPosition.isStem()) {
                searchPosition.growInto(new ModelValueNode(random, expr, solver));
            }
            NodeLike existing = searchPosition.get();
            if (!(existing instanceof ModelValueNode)) {
                throw notDeterministic("Model value node expected; found " + existing + " instead.");
            }
            ModelValueNode node = (ModelValueNode) existing;
            if (!node.getValueExpr().equals(expr)) {
                throw notDeterministic("Realized expression changed from " + node.getValueExpr() + " to " + expr);
            }
            Choice choice = node.choose(true);
            choicesMade.add(node);
            searchPosition = choice.getNext();
            if (choice.getDecision()) {
                add(node.getCondition());
                realizedExprs.add(expr);
                Object ret = SymbolSolver.modelValueToJava(node.getConditionValue());
                if (Log.isDebugEnabled() && !detached && alreadyLogged.add(expr)) {
                    Log.debug("SMT realized symbolic: " + expr + " == " + ret);
                }
                return ret;
            } else {
                add(ctx.mkNot(node.getCondition()));
            }
        }
    }

    /**
     * One interpretation of an uninterpreted function from the current model.
     * The solver is not bound to it afterwards.
     */
    public FuncInterp modelValueForFunction(FuncDecl decl) {
        if (!solver.isSat()) {
            throw new EngineInternalError("model unexpectedly became unsatisfiable");
        }
        return solver.getModel().getFuncInterp(decl);
    }

    public int currentSnapshot() {
        return heap.currentSnapshot();
    }

    public int checkpoint() {
        return heap.checkpoint();
    }

    public SymbolicHeap getHeap() {
        return heap;
    }

    public Object findKeyInHeap(Expr ref, Class<?> type, Function<Class<?>, Object> proxyGenerator) {
        return heap.findKeyInHeap(ref, type, proxyGenerator);
    }

    public Object findKeyInHeap(Expr ref, Class<?> type, Function<Class<?>, Object> proxyGenerator, int snapshot) {
        return heap.findKeyInHeap(ref, type, proxyGenerator, snapshot);
    }

    public String uniq() {
        nextUniq += 1;
        return "_" + Integer.toHexString(nextUniq);
    }

    /** Decides on {@code expr}, or on a fresh boolean named after {@code desc} when it is null. */
    public boolean smtFork(BoolExpr expr, String desc, boolean favorTrue) {
        if (expr == null) {
            expr = ctx.mkBoolConst((desc == null ? "fork" : desc) + uniq());
        }
        return decide(expr, favorTrue);
    }

    public boolean smtFork() {
        return smtFork(null, null, false);
    }

    public void defer(String description, BooleanSupplier checker) {
        deferredAssumptions.add(new DeferredAssumption(description, checker));
    }

    /**
     * Stops branching on this path: extends the deadline for the work that
     * follows, checks deferred assumptions and grows a detached node.
     *
     * @throws IgnoreAttempt    if a deferred assumption does not hold
     * @throws NotDeterministic if an earlier iteration kept branching here
     */
    public void detach() {
        if (detached) {
            Log.debug("Path is already detached");
            return;
        }
        executionDeadline += (long) (Config.detachGraceSeconds * NANOS_PER_SECOND);
        for (DeferredAssumption assumption : deferredAssumptions) {
            if (!assumption.checker.getAsBoolean()) {
                throw new IgnoreAttempt("deferred assumption failed: " + assumption.description);
            }
        }
        if (!searchPosition.isStem()) {
            throw notDeterministic("Cannot detach at materialized node " + searchPosition.get());
        }
        detached = true;
        DetachedPathNode node = searchPosition.growInto(new DetachedPathNode());
        choicesMade.add(node);
        searchPosition = node.getChild();
        Log.debug("Detached from search tree");
    }

    /**
     * Ends the iteration with {@code analysis} at the cursor and recomputes
     * every node visited, deepest first.
     *
     * @return the root's report and whether the whole tree is exhausted
     */
    public NodeResult bubbleStatus(CallAnalysis analysis) {
        if (searchPosition.isStem()) {
            searchPosition.growInto(new SearchLeaf(analysis));
        } else {
            NodeLike node = searchPosition.get();
            if (!(node instanceof SearchTreeNode)) {
                throw new EngineInternalError("Unexpected node at cursor: " + node);
            }
            ((SearchTreeNode) node).finish(analysis);
        }
        for (int i = choicesMade.size() - 1; i >= 0; i--) {
            choicesMade.get(i).updateResult(analysis);
        }
        searchRoot.updateResult(analysis);
        return new NodeResult(searchRoot.getResult(), searchRoot.isExhausted());
    }

    private NotDeterministic notDeterministic(String detail) {
        Log.debug(" *** Begin Not Deterministic Debug *** ");
        Log.debug(detail);
        Log.debug(" *** End Not Deterministic Debug *** ");
        return new NotDeterministic(detail);
    }

    private static String stackFingerprint() {
        StringBuilder fingerprint = new StringBuilder();
        int taken = 0;
        for (StackTraceElement element : new Throwable().getStackTrace()) {
            if (element.getClassName().equals(StateSpace.class.getName())) {
                continue;
            }
            fingerprint.append(element).append('\n');
            if (++taken >= Config.stackFingerprintDepth) {
                break;
            }
        }
        return fingerprint.toString();
    }

    static String stackDiff(String first, String current) {
        List<String> before = List.of(first.split("\n"));
        List<String> after = List.of(current.split("\n"));
        StringBuilder diff = new StringBuilder();
        for (String line : before) {
            if (!after.contains(line)) {
                diff.append("- ").append(line).append('\n');
            }
        }
        for (String line : after) {
            if (!before.contains(line)) {
                diff.append("+ ").append(line).append('\n');
            }
        }
        return diff.toString();
    }
}
