package module;

import Engine.StateSpace;

/** The code under test, run once per iteration against the iteration's session. */
@FunctionalInterface
public interface PathBody<R> {
    R call(StateSpace space, SymbolicArgs args) throws Exception;
}
