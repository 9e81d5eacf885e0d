package report;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CallAnalysisTest {

    private static AnalysisMessage message(MessageType type, String text) {
        return new AnalysisMessage(type, text, "Props.java", 1, 0, "");
    }

    @Test
    public void worseStatusWinsAndMessagesConcatenateLeftThenRight() {
        AnalysisMessage a = message(MessageType.EXEC_ERR, "left");
        AnalysisMessage b = message(MessageType.POST_FAIL, "right");
        CallAnalysis left = new CallAnalysis(VerificationStatus.UNKNOWN, List.of(a));
        CallAnalysis right = new CallAnalysis(VerificationStatus.REFUTED, List.of(b));

        CallAnalysis merged = CallAnalysis.merge(left, right);

        assertEquals(VerificationStatus.REFUTED, merged.getVerificationStatus());
        assertEquals(List.of(a, b), merged.getMessages());
    }

    @Test
    public void mergingAReportWithItselfKeepsItsStatus() {
        for (VerificationStatus status : VerificationStatus.values()) {
            CallAnalysis report = new CallAnalysis(status, List.of(message(MessageType.EXEC_ERR, "m")));
            assertEquals(status, CallAnalysis.merge(report, report).getVerificationStatus());
        }
        CallAnalysis confirmed = new CallAnalysis(VerificationStatus.CONFIRMED);
        assertEquals(confirmed, CallAnalysis.merge(confirmed, confirmed));
    }

    @Test
    public void sideWithoutStatusYieldsTheOther() {
        CallAnalysis refuted = new CallAnalysis(VerificationStatus.REFUTED,
                List.of(message(MessageType.POST_FAIL, "x")));
        CallAnalysis ignored = new CallAnalysis();
        assertSame(refuted, CallAnalysis.merge(ignored, refuted));
        assertSame(refuted, CallAnalysis.merge(refuted, ignored));
    }

    @Test
    public void laterFailingPreconditionWins() {
        ConditionExpr early = new ConditionExpr("Props.java", 10, "x > 0");
        ConditionExpr late = new ConditionExpr("Props.java", 20, "y > 0");
        CallAnalysis left = new CallAnalysis(VerificationStatus.UNKNOWN, Collections.emptyList(), late, "late");
        CallAnalysis right = new CallAnalysis(VerificationStatus.UNKNOWN, Collections.emptyList(), early, "early");

        CallAnalysis merged = CallAnalysis.merge(left, right);
        assertSame(late, merged.getFailingPrecondition());
        assertEquals("late", merged.getFailingPreconditionReason());

        CallAnalysis onlyRight = CallAnalysis.merge(new CallAnalysis(VerificationStatus.CONFIRMED), right);
        assertSame(early, onlyRight.getFailingPrecondition());
    }

    @Test
    public void realizedExpressionsAreUnioned() {
        try (Context ctx = new Context()) {
            Expr x = ctx.mkIntConst("x");
            Expr y = ctx.mkIntConst("y");
            CallAnalysis left = new CallAnalysis(VerificationStatus.CONFIRMED).withRealizedSmtExprs(Set.of(x));
            CallAnalysis right = new CallAnalysis(VerificationStatus.CONFIRMED).withRealizedSmtExprs(Set.of(y));

            Set<Expr> realized = CallAnalysis.merge(left, right).getRealizedSmtExprs();
            assertEquals(2, realized.size());
            assertTrue(realized.contains(x));
            assertTrue(realized.contains(y));
        }
    }

    @Test
    public void failingPreconditionReportHasNoStatus() {
        ConditionExpr pre = ConditionExpr.here("x > 0");
        CallAnalysis analysis = CallAnalysis.failingPrecondition(pre, "boom");
        assertFalse(analysis.hasStatus());
        assertEquals("CallAnalysisTest.java", pre.getFilename());
        assertTrue(pre.getLine() > 0);
        assertEquals("boom", analysis.getFailingPreconditionReason());
    }
}
