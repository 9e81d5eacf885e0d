package Engine;

import report.VerificationStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-subtree tally of leaves per verdict (plus void paths) and of named
 * realization counters.
 */
public class StateSpaceCounter {
    private final EnumMap<VerificationStatus, Integer> verdicts = new EnumMap<>(VerificationStatus.class);
    private final Map<String, Integer> counters = new TreeMap<>();
    private int ignored;

    public StateSpaceCounter() {
    }

    public static StateSpaceCounter ofLeaf(VerificationStatus status) {
        StateSpaceCounter counter = new StateSpaceCounter();
        if (status == null) {
            counter.ignored = 1;
        } else {
            counter.verdicts.put(status, 1);
        }
        return counter;
    }

    public int get(VerificationStatus status) {
        return verdicts.getOrDefault(status, 0);
    }

    public int getIgnored() {
        return ignored;
    }

    public int getCounter(String key) {
        return counters.getOrDefault(key, 0);
    }

    public void setCounter(String key, int value) {
        counters.put(key, value);
    }

    public Map<String, Integer> getCounters() {
        return Collections.unmodifiableMap(counters);
    }

    public Map<VerificationStatus, Integer> getVerdicts() {
        return Collections.unmodifiableMap(verdicts);
    }

    public int iterations() {
        int total = ignored;
        for (int count : verdicts.values()) {
            total += count;
        }
        return total;
    }

    public double unknownPct() {
        return get(VerificationStatus.UNKNOWN) / (double) (iterations() + 1);
    }

    public StateSpaceCounter plus(StateSpaceCounter other) {
        StateSpaceCounter sum = copy();
        sum.ignored += other.ignored;
        other.verdicts.forEach((k, v) -> sum.verdicts.merge(k, v, Integer::sum));
        other.counters.forEach((k, v) -> sum.counters.merge(k, v, Integer::sum));
        return sum;
    }

    /** Keeps the verdict buckets only, so a subtree looks like an ordinary leaf. */
    public StateSpaceCounter verdictsOnly() {
        StateSpaceCounter narrowed = new StateSpaceCounter();
        narrowed.verdicts.putAll(verdicts);
        narrowed.ignored = ignored;
        return narrowed;
    }

    public StateSpaceCounter copy() {
        StateSpaceCounter copy = new StateSpaceCounter();
        copy.verdicts.putAll(verdicts);
        copy.counters.putAll(counters);
        copy.ignored = ignored;
        return copy;
    }

    @Override
    public String toString() {
        return "StateSpaceCounter" + verdicts + (ignored > 0 ? "+ignored=" + ignored : "")
                + (counters.isEmpty() ? "" : counters.toString());
    }
}
