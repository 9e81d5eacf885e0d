package Engine;

/** The per-path deadline passed; the current iteration ends as UNKNOWN. */
public class PathTimeout extends RuntimeException {
    public PathTimeout(String message) {
        super(message);
    }
}
