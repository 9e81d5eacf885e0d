package Engine;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import utils.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Aliasing table from symbolic references to realized values, kept as an
 * ordered list of snapshots. Snapshot 0 is the oldest; the last one is live.
 */
public class SymbolicHeap {

    public static final class Entry {
        private final Expr ref;
        private final Class<?> type;
        private final Object value;

        Entry(Expr ref, Class<?> type, Object value) {
            this.ref = ref;
            this.type = type;
            this.value = value;
        }

        public Expr getRef() {
            return ref;
        }

        public Class<?> getType() {
            return type;
        }

        public Object getValue() {
            return value;
        }
    }

    private final Context ctx;
    // decides whether an equality between two references holds on this path
    private final Predicate<BoolExpr> decider;
    private final List<List<Entry>> heaps = new ArrayList<>();

    public SymbolicHeap(Context ctx, Predicate<BoolExpr> decider) {
        this.ctx = ctx;
        this.decider = decider;
        this.heaps.add(new ArrayList<>());
    }

    public int currentSnapshot() {
        return heaps.size() - 1;
    }

    public int snapshotCount() {
        return heaps.size();
    }

    public List<Entry> getSnapshot(int snapshot) {
        return Collections.unmodifiableList(heaps.get(snapshot));
    }

    /** Freezes the live snapshot and continues on a deep copy of it. */
    public int checkpoint() {
        List<Entry> live = heaps.get(heaps.size() - 1);
        List<Entry> copy = new ArrayList<>(live.size());
        for (Entry entry : live) {
            copy.add(new Entry(entry.ref, entry.type, copyValue(entry.value)));
        }
        heaps.add(copy);
        return currentSnapshot();
    }

    public Object findKeyInHeap(Expr ref, Class<?> type, Function<Class<?>, Object> proxyGenerator) {
        return findKeyInHeap(ref, type, proxyGenerator, currentSnapshot());
    }

    /**
     * Returns the value of an entry in {@code snapshot} whose type unifies with
     * {@code type} and whose reference the solver decides is equal to
     * {@code ref}. Otherwise creates one value and adds it to {@code snapshot}
     * and every later snapshot.
     */
    public Object findKeyInHeap(Expr ref, Class<?> type, Function<Class<?>, Object> proxyGenerator, int snapshot) {
        for (Entry entry : heaps.get(snapshot)) {
            if (!unify(entry.type, type)) {
                continue;
            }
            if (decider.test(ctx.mkEq(entry.ref, ref))) {
                if (Log.isDebugEnabled()) {
                    Log.debug("HEAP key lookup " + ref + ": Found existing. type: "
                            + entry.value.getClass().getSimpleName());
                }
                return entry.value;
            }
        }
        Object created = proxyGenerator.apply(type);
        if (Log.isDebugEnabled()) {
            Log.debug("HEAP key lookup " + ref + ": Created new. type: " + created.getClass().getSimpleName());
        }
        addValueToHeaps(ref, type, created, snapshot);
        return created;
    }

    private void addValueToHeaps(Expr ref, Class<?> type, Object value, int fromSnapshot) {
        int live = currentSnapshot();
        for (int i = fromSnapshot; i < live; i++) {
            heaps.get(i).add(new Entry(ref, type, copyValue(value)));
        }
        heaps.get(live).add(new Entry(ref, type, value));
    }

    static boolean unify(Class<?> storedType, Class<?> requestedType) {
        return requestedType.isAssignableFrom(storedType);
    }

    private static Object copyValue(Object value) {
        if (value instanceof HeapCopyable) {
            return ((HeapCopyable<?>) value).deepCopy();
        }
        return value;
    }
}
