package report;

/**
 * Kinds of diagnostics, in the order in which they override each other for the
 * same source line: a false postcondition is preferred over one that raised.
 */
public enum MessageType {
    // postcondition holds over all execution paths
    CONFIRMED("confirmed"),
    // postcondition holds over the paths that were attempted
    CANNOT_CONFIRM("cannot_confirm"),
    // no attempted path got past the precondition checks
    PRE_UNSAT("pre_unsat"),
    POST_ERR("post_err"),
    EXEC_ERR("exec_err"),
    // a replayed path took a different decision than before
    NOT_DETERMINISTIC("not_deterministic"),
    POST_FAIL("post_fail"),
    SYNTAX_ERR("syntax_err"),
    IMPORT_ERR("import_err");

    private final String key;

    MessageType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public boolean isError() {
        return this.compareTo(PRE_UNSAT) > 0;
    }
}
