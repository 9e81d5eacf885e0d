package report;

import com.microsoft.z3.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Report for one path or one subtree. A {@code null} status means the path
 * has not been evaluated (or was discarded) and is ignored when merging.
 * The status is CONFIRMED only if the node carrying it is exhausted.
 */
public class CallAnalysis {
    private final VerificationStatus verificationStatus;
    private final List<AnalysisMessage> messages;
    private final ConditionExpr failingPrecondition;
    private final String failingPreconditionReason;
    private final Set<Expr> realizedSmtExprs;

    public CallAnalysis() {
        this(null);
    }

    public CallAnalysis(VerificationStatus verificationStatus) {
        this(verificationStatus, Collections.emptyList());
    }

    public CallAnalysis(VerificationStatus verificationStatus, List<AnalysisMessage> messages) {
        this(verificationStatus, messages, null, "");
    }

    public CallAnalysis(VerificationStatus verificationStatus, List<AnalysisMessage> messages,
                        ConditionExpr failingPrecondition, String failingPreconditionReason) {
        this(verificationStatus, messages, failingPrecondition, failingPreconditionReason, Collections.emptySet());
    }

    public CallAnalysis(VerificationStatus verificationStatus, List<AnalysisMessage> messages,
                        ConditionExpr failingPrecondition, String failingPreconditionReason,
                        Set<Expr> realizedSmtExprs) {
        this.verificationStatus = verificationStatus;
        this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
        this.failingPrecondition = failingPrecondition;
        this.failingPreconditionReason = failingPreconditionReason == null ? "" : failingPreconditionReason;
        this.realizedSmtExprs = Collections.unmodifiableSet(new LinkedHashSet<>(realizedSmtExprs));
    }

    public static CallAnalysis failingPrecondition(ConditionExpr precondition, String reason) {
        return new CallAnalysis(null, Collections.emptyList(), precondition, reason);
    }

    public VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    public boolean hasStatus() {
        return verificationStatus != null;
    }

    public List<AnalysisMessage> getMessages() {
        return messages;
    }

    public ConditionExpr getFailingPrecondition() {
        return failingPrecondition;
    }

    public String getFailingPreconditionReason() {
        return failingPreconditionReason;
    }

    public Set<Expr> getRealizedSmtExprs() {
        return realizedSmtExprs;
    }

    public CallAnalysis withMessages(List<AnalysisMessage> newMessages) {
        return new CallAnalysis(verificationStatus, newMessages, failingPrecondition,
                failingPreconditionReason, realizedSmtExprs);
    }

    public CallAnalysis withRealizedSmtExprs(Set<Expr> exprs) {
        return new CallAnalysis(verificationStatus, messages, failingPrecondition,
                failingPreconditionReason, exprs);
    }

    /**
     * Combines the reports of two sibling subtrees: the worse status wins,
     * messages are concatenated left then right, and when both sides carry a
     * failing precondition the one on the later source line is kept.
     * A side without a status yields the other side unchanged.
     */
    public static CallAnalysis merge(CallAnalysis left, CallAnalysis right) {
        if (left.verificationStatus == null) {
            return right;
        }
        if (right.verificationStatus == null) {
            return left;
        }
        CallAnalysis precondSide;
        if (left.failingPrecondition != null && right.failingPrecondition != null) {
            precondSide = left.failingPrecondition.getLine() > right.failingPrecondition.getLine() ? left : right;
        } else {
            precondSide = left.failingPrecondition != null ? left : right;
        }
        List<AnalysisMessage> merged = new ArrayList<>(left.messages);
        merged.addAll(right.messages);
        Set<Expr> realized = new LinkedHashSet<>(left.realizedSmtExprs);
        realized.addAll(right.realizedSmtExprs);
        return new CallAnalysis(
                VerificationStatus.worst(left.verificationStatus, right.verificationStatus),
                merged,
                precondSide.failingPrecondition,
                precondSide.failingPreconditionReason,
                realized);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallAnalysis)) return false;
        CallAnalysis that = (CallAnalysis) o;
        return verificationStatus == that.verificationStatus
                && messages.equals(that.messages)
                && failingPrecondition == that.failingPrecondition
                && failingPreconditionReason.equals(that.failingPreconditionReason)
                && realizedSmtExprs.equals(that.realizedSmtExprs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verificationStatus, messages, failingPreconditionReason);
    }

    @Override
    public String toString() {
        return "CallAnalysis(" + verificationStatus + ", messages=" + messages.size()
                + (failingPrecondition == null ? "" : ", failing=" + failingPrecondition) + ")";
    }
}
