package module;

import init.Config;

/** Per-run limits. Immutable; each {@code with...} returns a modified copy. */
public final class AnalysisOptions {
    private final int maxIterations;
    private final double perConditionTimeout;
    private final double perPathTimeout;
    private final int solverTimeoutMillis;
    private final long randomSeed;

    public AnalysisOptions(int maxIterations, double perConditionTimeout, double perPathTimeout,
                           int solverTimeoutMillis, long randomSeed) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.perConditionTimeout = perConditionTimeout;
        this.perPathTimeout = perPathTimeout;
        this.solverTimeoutMillis = solverTimeoutMillis;
        this.randomSeed = randomSeed;
    }

    public static AnalysisOptions fromConfig() {
        return new AnalysisOptions(Config.maxIterations, Config.perConditionTimeout, Config.perPathTimeout,
                Config.solverTimeoutMillis, Config.randomSeed);
    }

    public AnalysisOptions withMaxIterations(int value) {
        return new AnalysisOptions(value, perConditionTimeout, perPathTimeout, solverTimeoutMillis, randomSeed);
    }

    public AnalysisOptions withPerConditionTimeout(double seconds) {
        return new AnalysisOptions(maxIterations, seconds, perPathTimeout, solverTimeoutMillis, randomSeed);
    }

    public AnalysisOptions withPerPathTimeout(double seconds) {
        return new AnalysisOptions(maxIterations, perConditionTimeout, seconds, solverTimeoutMillis, randomSeed);
    }

    public AnalysisOptions withSolverTimeoutMillis(int millis) {
        return new AnalysisOptions(maxIterations, perConditionTimeout, perPathTimeout, millis, randomSeed);
    }

    public AnalysisOptions withRandomSeed(long seed) {
        return new AnalysisOptions(maxIterations, perConditionTimeout, perPathTimeout, solverTimeoutMillis, seed);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getPerConditionTimeout() {
        return perConditionTimeout;
    }

    public double getPerPathTimeout() {
        return perPathTimeout;
    }

    public int getSolverTimeoutMillis() {
        return solverTimeoutMillis;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    @Override
    public String toString() {
        return "AnalysisOptions{maxIterations=" + maxIterations
                + ", perConditionTimeout=" + perConditionTimeout
                + ", perPathTimeout=" + perPathTimeout
                + ", solverTimeoutMillis=" + solverTimeoutMillis
                + ", randomSeed=" + randomSeed + "}";
    }
}
