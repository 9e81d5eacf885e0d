package solver;

import Engine.EngineInternalError;

/**
 * The solver could neither prove nor refute a query. Soundness needs a
 * decisive answer, so this aborts the run.
 */
public class UnknownSatisfiability extends EngineInternalError {
    public UnknownSatisfiability(String reason) {
        super("Unknown satisfiability: " + reason);
    }
}
