package report;

/**
 * Source location and text of a pre- or postcondition.
 */
public class ConditionExpr {
    private final String filename;
    private final int line;
    private final String exprSource;

    public ConditionExpr(String filename, int line, String exprSource) {
        this.filename = filename;
        this.line = line;
        this.exprSource = exprSource;
    }

    /** A condition located at the line that calls this method. */
    public static ConditionExpr here(String exprSource) {
        StackTraceElement caller = new Throwable().getStackTrace()[1];
        return new ConditionExpr(caller.getFileName(), caller.getLineNumber(), exprSource);
    }

    public String getFilename() {
        return filename;
    }

    public int getLine() {
        return line;
    }

    public String getExprSource() {
        return exprSource;
    }

    @Override
    public String toString() {
        return exprSource + " (" + filename + ":" + line + ")";
    }
}
