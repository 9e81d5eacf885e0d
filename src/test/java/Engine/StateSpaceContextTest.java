package Engine;

import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StateSpaceContextTest {

    @Test
    public void activeSessionIsVisibleOnlyInsideTheGuard() {
        try (Context ctx = new Context()) {
            StateSpace space = StateSpace.simple(ctx);
            assertNull(StateSpaceContext.optionalContextStatespace());
            try (StateSpaceContext guard = new StateSpaceContext(space)) {
                assertSame(space, StateSpaceContext.contextStatespace());
                assertSame(space, guard.getSpace());
            }
            assertNull(StateSpaceContext.optionalContextStatespace());
            assertThrows(IllegalStateException.class, StateSpaceContext::contextStatespace);
        }
    }

    @Test
    public void nestedGuardIsRejected() {
        try (Context ctx = new Context()) {
            StateSpace space = StateSpace.simple(ctx);
            try (StateSpaceContext ignored = new StateSpaceContext(space)) {
                assertThrows(IllegalStateException.class, () -> new StateSpaceContext(StateSpace.simple(ctx)));
                assertSame(space, StateSpaceContext.contextStatespace());
            }
        }
    }
}
