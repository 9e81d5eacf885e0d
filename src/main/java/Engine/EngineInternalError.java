package Engine;

/**
 * The engine reached a state that indicates a bug or solver resource
 * exhaustion. Never absorbed by the driver: the whole run is aborted.
 */
public class EngineInternalError extends RuntimeException {
    public EngineInternalError(String message) {
        super(message);
    }
}
