package report;

import java.util.Objects;

public class AnalysisMessage {
    private final MessageType state;
    private final String message;
    private final String filename;
    private final int line;
    private final int column;
    private final String traceback;
    private final String testFn;
    private final String conditionSrc;

    public AnalysisMessage(MessageType state, String message, String filename, int line, int column,
                           String traceback) {
        this(state, message, filename, line, column, traceback, null, null);
    }

    public AnalysisMessage(MessageType state, String message, String filename, int line, int column,
                           String traceback, String testFn, String conditionSrc) {
        this.state = Objects.requireNonNull(state);
        this.message = message;
        this.filename = filename;
        this.line = line;
        this.column = column;
        this.traceback = traceback;
        this.testFn = testFn;
        this.conditionSrc = conditionSrc;
    }

    /** Builds a message located at the frame that raised {@code error}. */
    public static AnalysisMessage fromThrowable(MessageType state, String message, Throwable error) {
        StackTraceElement[] trace = error.getStackTrace();
        StackTraceElement at = trace.length > 0 ? trace[0] : null;
        StringBuilder tb = new StringBuilder();
        for (StackTraceElement element : trace) {
            tb.append("  at ").append(element).append('\n');
        }
        return new AnalysisMessage(state, message,
                at == null ? "" : String.valueOf(at.getFileName()),
                at == null ? 0 : at.getLineNumber(), 0, tb.toString());
    }

    public MessageType getState() {
        return state;
    }

    public String getMessage() {
        return message;
    }

    public String getFilename() {
        return filename;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getTraceback() {
        return traceback;
    }

    public String getTestFn() {
        return testFn;
    }

    public String getConditionSrc() {
        return conditionSrc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisMessage)) return false;
        AnalysisMessage that = (AnalysisMessage) o;
        return line == that.line && column == that.column && state == that.state
                && Objects.equals(message, that.message) && Objects.equals(filename, that.filename)
                && Objects.equals(traceback, that.traceback) && Objects.equals(testFn, that.testFn)
                && Objects.equals(conditionSrc, that.conditionSrc);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, message, filename, line, column);
    }

    @Override
    public String toString() {
        return state.getKey() + " " + filename + ":" + line + " " + message;
    }
}
