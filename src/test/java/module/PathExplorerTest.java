package module;

import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import main.SampleProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import report.AnalysisMessage;
import report.ConditionExpr;
import report.MessageType;
import report.VerificationStatus;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class PathExplorerTest {

    private PathExplorer explorer;

    @BeforeEach
    public void setUp() {
        explorer = new PathExplorer(AnalysisOptions.fromConfig().withMaxIterations(50));
    }

    @AfterEach
    public void tearDown() {
        explorer.close();
    }

    private static PropertyUnderTest<IntExpr> identity(String name, Postcondition.Predicate<IntExpr> post) {
        return new PropertyUnderTest<IntExpr>(name, (space, args) -> args.getInt("x"),
                new Postcondition<>(ConditionExpr.here("post"), post))
                .withInput("x", SymbolicArgs.Kind.INT);
    }

    @Test
    public void absoluteValueIsConfirmedAfterBothBranches() {
        ExplorationResult result = explorer.explore(SampleProperties.abs());

        assertEquals(VerificationStatus.CONFIRMED, result.getStatus());
        assertTrue(result.isExhausted());
        assertEquals(2, result.getIterations());
        assertEquals(2, result.getStats().get(VerificationStatus.CONFIRMED));
        assertEquals(1, result.getMessages().size());
        assertEquals(MessageType.CONFIRMED, result.getMessages().get(0).getState());
    }

    @Test
    public void clampIsConfirmedOverThreePaths() {
        ExplorationResult result = explorer.explore(SampleProperties.clamp());
        assertEquals(VerificationStatus.CONFIRMED, result.getStatus());
        assertEquals(3, result.getIterations());
    }

    @Test
    public void falsePostconditionReportsACounterexample() {
        ExplorationResult result = explorer.explore(SampleProperties.brokenAbs());

        assertEquals(VerificationStatus.REFUTED, result.getStatus());
        AnalysisMessage message = result.getMessages().get(0);
        assertEquals(MessageType.POST_FAIL, message.getState());
        assertEquals("__return__ >= 0", message.getConditionSrc());
        Matcher matcher = Pattern.compile("false when calling brokenAbs\\(x = (-?\\d+)\\)").matcher(message.getMessage());
        assertTrue(matcher.matches(), message.getMessage());
        assertTrue(Long.parseLong(matcher.group(1)) < -5);
    }

    @Test
    public void errorThrownByBodyIsAnExecutionError() {
        PropertyUnderTest<IntExpr> property = new PropertyUnderTest<IntExpr>("nonNegative", (space, args) -> {
            IntExpr x = args.getInt("x");
            if (space.decide(space.getContext().mkLt(x, space.getContext().mkInt(0)))) {
                throw new AssertionError("x must be non-negative");
            }
            return x;
        }, new Postcondition<>(ConditionExpr.here("true"), (space, args, result) -> true))
                .withInput("x", SymbolicArgs.Kind.INT);

        ExplorationResult result = explorer.explore(property);

        assertEquals(VerificationStatus.REFUTED, result.getStatus());
        AnalysisMessage message = result.getMessages().get(0);
        assertEquals(MessageType.EXEC_ERR, message.getState());
        assertTrue(message.getMessage().startsWith("AssertionError: x must be non-negative when calling nonNegative(x = "),
                message.getMessage());
    }

    @Test
    public void exceptionInBodyIsAnExecutionError() {
        ExplorationResult result = explorer.explore(SampleProperties.division(false));

        assertEquals(VerificationStatus.REFUTED, result.getStatus());
        AnalysisMessage message = result.getMessages().get(0);
        assertEquals(MessageType.EXEC_ERR, message.getState());
        assertTrue(message.getMessage().startsWith("ArithmeticException: / by zero when calling division(x = "),
                message.getMessage());
        assertTrue(message.getMessage().endsWith("y = 0)"), message.getMessage());
        assertEquals("SampleProperties.java", message.getFilename());
    }

    @Test
    public void preconditionExcludesTheFailingInput() {
        ExplorationResult result = explorer.explore(SampleProperties.division(true));
        assertEquals(VerificationStatus.CONFIRMED, result.getStatus());
        assertTrue(result.isExhausted());
        assertEquals(1, result.getStats().getIgnored());
    }

    @Test
    public void changingDecisionsAreReportedAsNondeterminism() {
        AtomicInteger calls = new AtomicInteger();
        PropertyUnderTest<IntExpr> property = new PropertyUnderTest<IntExpr>("drifting",
                (space, args) -> {
                    Context ctx = space.getContext();
                    IntExpr x = args.getInt("x");
                    space.decide(ctx.mkGt(x, ctx.mkInt(calls.getAndIncrement())));
                    return x;
                },
                new Postcondition<>(ConditionExpr.here("True"), (space, args, result) -> true))
                .withInput("x", SymbolicArgs.Kind.INT);

        ExplorationResult result = explorer.explore(property);

        assertEquals(VerificationStatus.REFUTED, result.getStatus());
        assertEquals(2, result.getIterations());
        assertEquals(MessageType.NOT_DETERMINISTIC, result.getMessages().get(0).getState());
    }

    @Test
    public void falsePreconditionEverywhereIsUnsatisfiable() {
        PropertyUnderTest<IntExpr> property = identity("never", (space, args, result) -> true)
                .withPrecondition(new Condition(ConditionExpr.here("False"), (space, args) -> false));

        ExplorationResult result = explorer.explore(property);

        assertNull(result.getStatus());
        assertTrue(result.isExhausted());
        assertEquals(MessageType.PRE_UNSAT, result.getMessages().get(0).getState());
        assertEquals("False", result.getMessages().get(0).getConditionSrc());
    }

    @Test
    public void raisingPreconditionIsRecordedWithItsReason() {
        PropertyUnderTest<IntExpr> property = identity("raising", (space, args, result) -> true)
                .withPrecondition(new Condition(ConditionExpr.here("check()"), (space, args) -> {
                    throw new IllegalStateException("boom");
                }));

        ExplorationResult result = explorer.explore(property);

        assertNull(result.getStatus());
        assertEquals("IllegalStateException: boom", result.getAnalysis().getFailingPreconditionReason());
        assertEquals(MessageType.PRE_UNSAT, result.getMessages().get(0).getState());
        assertTrue(result.getMessages().get(0).getMessage().contains("boom"));
    }

    @Test
    public void raisingPostconditionIsAPostconditionError() {
        PropertyUnderTest<IntExpr> property = identity("postRaises", (space, args, result) -> {
            throw new UnsupportedOperationException("no");
        });

        ExplorationResult result = explorer.explore(property);

        assertEquals(VerificationStatus.REFUTED, result.getStatus());
        assertEquals(MessageType.POST_ERR, result.getMessages().get(0).getState());
        assertTrue(result.getMessages().get(0).getMessage().startsWith("Error in postcondition"));
    }

    @Test
    public void iterationLimitLeavesThePropertyUnconfirmed() {
        try (PathExplorer limited = new PathExplorer(AnalysisOptions.fromConfig().withMaxIterations(1))) {
            ExplorationResult result = limited.explore(SampleProperties.clamp());
            assertEquals(VerificationStatus.UNKNOWN, result.getStatus());
            assertFalse(result.isExhausted());
            assertEquals(1, result.getIterations());
            assertEquals(MessageType.CANNOT_CONFIRM, result.getMessages().get(0).getState());
        }
    }

    @Test
    public void pathDeadlineEndsIterationsAsUnknown() {
        try (PathExplorer hurried = new PathExplorer(AnalysisOptions.fromConfig().withPerPathTimeout(-1.0))) {
            ExplorationResult result = hurried.explore(SampleProperties.abs());
            assertEquals(VerificationStatus.UNKNOWN, result.getStatus());
            assertEquals(MessageType.CANNOT_CONFIRM, result.getMessages().get(0).getState());
        }
    }

    @Test
    public void explorationsDoNotShareTrees() {
        ExplorationResult first = explorer.explore(SampleProperties.abs());
        ExplorationResult second = explorer.explore(SampleProperties.abs());
        assertEquals(first.getIterations(), second.getIterations());
        assertEquals(first.getStatus(), second.getStatus());
    }
}
