package init;

public class Config {

    // Basic Config
    public static int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
    public static String logLevel = "INFO";

    // Exploration Config
    public static int maxIterations = 100;
    public static double perConditionTimeout = 30.0; // seconds, whole property
    public static double perPathTimeout = 5.0; // seconds, one iteration
    public static int solverTimeoutMillis = 5000;
    public static long randomSeed = 1801243388510242075L;

    // Search heuristics
    public static double defaultFalseProbability = 0.5;
    // biased toward False so recursive structures stop growing early
    public static double worstResultFalseProbability = 0.75;
    public static double detachGraceSeconds = 2.0;
    public static int stackFingerprintDepth = 8;

    // Path Config
    public static String resultPath = "output/result.jsonl";
}
