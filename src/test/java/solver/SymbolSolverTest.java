package solver;

import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolSolverTest {

    @Test
    public void assumptionsAreNotRetained() {
        try (Context ctx = new Context()) {
            SymbolSolver solver = new SymbolSolver(ctx, 1000);
            IntExpr x = ctx.mkIntConst("x");
            solver.add(ctx.mkGt(x, ctx.mkInt(3)));

            assertFalse(solver.isSat(ctx.mkLt(x, ctx.mkInt(0))));
            assertTrue(solver.isSat());
            assertEquals(2, solver.getCheckCount());
            assertEquals(1, solver.getAssertions().length);
            assertEquals(1000, solver.getTimeoutMillis());
        }
    }

    @Test
    public void evaluatesAgainstTheLastModel() {
        try (Context ctx = new Context()) {
            SymbolSolver solver = new SymbolSolver(ctx);
            IntExpr x = ctx.mkIntConst("x");
            solver.add(ctx.mkEq(x, ctx.mkInt(42)));
            assertTrue(solver.isSat());
            assertEquals(42L, SymbolSolver.modelValueToJava(solver.evaluate(x)));
        }
    }

    @Test
    public void undecidedQueryIsReportedNotTreatedAsUnsat() {
        try (Context ctx = new Context()) {
            SymbolSolver solver = new SymbolSolver(ctx, 1);
            IntExpr a = ctx.mkIntConst("a");
            IntExpr b = ctx.mkIntConst("b");
            IntExpr c = ctx.mkIntConst("c");
            solver.add(ctx.mkAnd(ctx.mkGt(a, ctx.mkInt(0)), ctx.mkGt(b, ctx.mkInt(0)), ctx.mkGt(c, ctx.mkInt(0))));
            // no solutions exist, and nonlinear integer arithmetic cannot prove it
            solver.add(ctx.mkEq(ctx.mkAdd(ctx.mkMul(a, a, a), ctx.mkMul(b, b, b)), ctx.mkMul(c, c, c)));
            UnknownSatisfiability e = assertThrows(UnknownSatisfiability.class, () -> solver.isSat());
            assertTrue(e.getMessage().startsWith("Unknown satisfiability"));
        }
    }

    @Test
    public void modelAfterUnsatCheckIsUnavailable() {
        try (Context ctx = new Context()) {
            SymbolSolver solver = new SymbolSolver(ctx);
            solver.add(ctx.mkFalse());
            assertFalse(solver.isSat());
            assertThrows(RuntimeException.class, solver::getModel);
        }
    }

    @Test
    public void convertsNumeralsAndLiterals() {
        try (Context ctx = new Context()) {
            assertEquals(5L, SymbolSolver.modelValueToJava(ctx.mkInt(5)));
            assertEquals(-5L, SymbolSolver.modelValueToJava(ctx.mkInt(-5)));
            assertEquals(new BigInteger("100000000000000000000"),
                    SymbolSolver.modelValueToJava(ctx.mkInt("100000000000000000000")));
            assertEquals(0.5, SymbolSolver.modelValueToJava(ctx.mkReal(1, 2)));
            assertEquals(Boolean.TRUE, SymbolSolver.modelValueToJava(ctx.mkTrue()));
            assertEquals(Boolean.FALSE, SymbolSolver.modelValueToJava(ctx.mkFalse()));
            assertEquals("hi", SymbolSolver.modelValueToJava(ctx.mkString("hi")));
            assertEquals(9L, SymbolSolver.modelValueToJava(ctx.mkBV(9, 8)));
        }
    }

    @Test
    public void convertsUnitSequencesToLists() {
        try (Context ctx = new Context()) {
            assertEquals(List.of(1L, 2L),
                    SymbolSolver.modelValueToJava(ctx.mkConcat(ctx.mkUnit(ctx.mkInt(1)), ctx.mkUnit(ctx.mkInt(2)))));
        }
    }
}
