package Engine;

/**
 * A replayed decision did not match what was recorded at the same tree
 * position on an earlier iteration.
 */
public class NotDeterministic extends RuntimeException {
    public NotDeterministic(String message) {
        super(message);
    }
}
