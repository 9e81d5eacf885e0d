package module;

import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;
import report.ConditionExpr;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolicArgsTest {

    @Test
    public void inputsKeepDeclarationOrderAndSorts() {
        try (Context ctx = new Context()) {
            PropertyUnderTest<Object> property = new PropertyUnderTest<Object>("p", (space, args) -> null,
                    new Postcondition<>(ConditionExpr.here("True"), (space, args, result) -> true))
                    .withInput("s", SymbolicArgs.Kind.STRING)
                    .withInput("b", SymbolicArgs.Kind.BOOL)
                    .withInput("r", SymbolicArgs.Kind.REAL);

            SymbolicArgs args = new SymbolicArgs(ctx, property.getInputs());

            assertEquals(List.of("s", "b", "r"), new ArrayList<>(args.asMap().keySet()));
            assertEquals(ctx.getStringSort(), args.getString("s").getSort());
            assertEquals(ctx.mkBoolConst("b"), args.getBool("b"));
            assertEquals(ctx.getRealSort(), args.getReal("r").getSort());
            assertThrows(IllegalArgumentException.class, () -> args.get("missing"));
        }
    }
}
