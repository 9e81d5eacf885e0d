package report;

/**
 * Verdict of one path or of a whole subtree, ordered from worst to best.
 * A property is CONFIRMED only once every reachable path has been explored
 * and none refuted it.
 */
public enum VerificationStatus {
    REFUTED,
    UNKNOWN,
    CONFIRMED;

    public boolean isWorseThan(VerificationStatus other) {
        return this.compareTo(other) < 0;
    }

    public static VerificationStatus worst(VerificationStatus a, VerificationStatus b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
