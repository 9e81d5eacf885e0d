package module;

import Engine.StateSpaceCounter;
import report.AnalysisMessage;
import report.CallAnalysis;
import report.VerificationStatus;

import java.util.List;

public class ExplorationResult {
    private final String name;
    private final CallAnalysis analysis;
    private final boolean exhausted;
    private final int iterations;
    private final StateSpaceCounter stats;
    private final long elapsedMillis;

    public ExplorationResult(String name, CallAnalysis analysis, boolean exhausted, int iterations,
                             StateSpaceCounter stats, long elapsedMillis) {
        this.name = name;
        this.analysis = analysis;
        this.exhausted = exhausted;
        this.iterations = iterations;
        this.stats = stats;
        this.elapsedMillis = elapsedMillis;
    }

    public String getName() {
        return name;
    }

    public CallAnalysis getAnalysis() {
        return analysis;
    }

    /** Null when no path got past the preconditions. */
    public VerificationStatus getStatus() {
        return analysis.getVerificationStatus();
    }

    public List<AnalysisMessage> getMessages() {
        return analysis.getMessages();
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public int getIterations() {
        return iterations;
    }

    public StateSpaceCounter getStats() {
        return stats;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return name + ": " + getStatus() + " after " + iterations + " iterations"
                + (exhausted ? " (exhausted)" : "") + " in " + elapsedMillis + "ms";
    }
}
