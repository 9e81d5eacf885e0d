package Engine;

/**
 * Scoped guard for the session active on the current thread. Opening a second
 * one before the first is closed is a usage error.
 *
 * <pre>
 * try (StateSpaceContext ignored = new StateSpaceContext(space)) {
 *     ...
 * }
 * </pre>
 */
public final class StateSpaceContext implements AutoCloseable {
    private static final ThreadLocal<StateSpace> ACTIVE = new ThreadLocal<>();

    private final StateSpace space;

    public StateSpaceContext(StateSpace space) {
        if (ACTIVE.get() != null) {
            throw new IllegalStateException("Already in a state space context");
        }
        this.space = space;
        ACTIVE.set(space);
    }

    public StateSpace getSpace() {
        return space;
    }

    public static StateSpace optionalContextStatespace() {
        return ACTIVE.get();
    }

    public static StateSpace contextStatespace() {
        StateSpace space = ACTIVE.get();
        if (space == null) {
            throw new IllegalStateException("No state space is active on this thread");
        }
        return space;
    }

    @Override
    public void close() {
        StateSpace current = ACTIVE.get();
        ACTIVE.remove();
        if (current != space) {
            throw new IllegalStateException("State space was altered in context");
        }
    }
}
