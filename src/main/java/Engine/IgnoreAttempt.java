package Engine;

/** Discards the current iteration: it is neither a counterexample nor a confirmation. */
public class IgnoreAttempt extends RuntimeException {
    public IgnoreAttempt(String message) {
        super(message);
    }
}
