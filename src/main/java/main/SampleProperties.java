package main;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntSort;
import module.Condition;
import module.Postcondition;
import module.PropertyUnderTest;
import module.SymbolicArgs;
import report.ConditionExpr;

import java.util.List;

/** Small contracts used by the batch runner and its tests. */
public class SampleProperties {

    public static PropertyUnderTest<ArithExpr<IntSort>> abs() {
        return new PropertyUnderTest<ArithExpr<IntSort>>("abs",
                (space, args) -> {
                    Context ctx = space.getContext();
                    IntExpr x = args.getInt("x");
                    if (space.decide(ctx.mkLt(x, ctx.mkInt(0)))) {
                        return ctx.mkUnaryMinus(x);
                    }
                    return x;
                },
                new Postcondition<>(ConditionExpr.here("__return__ >= 0"),
                        (space, args, result) -> space.decide(
                                space.getContext().mkGe(result, space.getContext().mkInt(0)))))
                .withInput("x", SymbolicArgs.Kind.INT);
    }

    /** Like {@link #abs()} but wrong below -5. */
    public static PropertyUnderTest<ArithExpr<IntSort>> brokenAbs() {
        return new PropertyUnderTest<ArithExpr<IntSort>>("brokenAbs",
                (space, args) -> {
                    Context ctx = space.getContext();
                    IntExpr x = args.getInt("x");
                    if (space.decide(ctx.mkLt(x, ctx.mkInt(-5)))) {
                        return x;
                    }
                    if (space.decide(ctx.mkLt(x, ctx.mkInt(0)))) {
                        return ctx.mkUnaryMinus(x);
                    }
                    return x;
                },
                new Postcondition<>(ConditionExpr.here("__return__ >= 0"),
                        (space, args, result) -> space.decide(
                                space.getContext().mkGe(result, space.getContext().mkInt(0)))))
                .withInput("x", SymbolicArgs.Kind.INT);
    }

    public static PropertyUnderTest<ArithExpr<IntSort>> division(boolean guarded) {
        PropertyUnderTest<ArithExpr<IntSort>> property = new PropertyUnderTest<ArithExpr<IntSort>>(
                guarded ? "guardedDivision" : "division",
                (space, args) -> {
                    Context ctx = space.getContext();
                    IntExpr x = args.getInt("x");
                    IntExpr y = args.getInt("y");
                    if (space.decide(ctx.mkEq(y, ctx.mkInt(0)))) {
                        throw new ArithmeticException("/ by zero");
                    }
                    return ctx.mkDiv(x, y);
                },
                new Postcondition<>(ConditionExpr.here("True"), (space, args, result) -> true))
                .withInput("x", SymbolicArgs.Kind.INT)
                .withInput("y", SymbolicArgs.Kind.INT);
        if (guarded) {
            property.withPrecondition(new Condition(ConditionExpr.here("y != 0"),
                    (space, args) -> space.decide(space.getContext().mkNot(
                            space.getContext().mkEq(args.getInt("y"), space.getContext().mkInt(0))))));
        }
        return property;
    }

    public static PropertyUnderTest<ArithExpr<IntSort>> clamp() {
        return new PropertyUnderTest<ArithExpr<IntSort>>("clamp",
                (space, args) -> {
                    Context ctx = space.getContext();
                    IntExpr n = args.getInt("n");
                    if (space.decide(ctx.mkLt(n, ctx.mkInt(0)))) {
                        return ctx.mkInt(0);
                    }
                    if (space.decide(ctx.mkGt(n, ctx.mkInt(10)))) {
                        return ctx.mkInt(10);
                    }
                    return n;
                },
                new Postcondition<>(ConditionExpr.here("0 <= __return__ <= 10"),
                        (space, args, result) -> {
                            Context ctx = space.getContext();
                            return space.decide(ctx.mkAnd(ctx.mkGe(result, ctx.mkInt(0)),
                                    ctx.mkLe(result, ctx.mkInt(10))));
                        }))
                .withInput("n", SymbolicArgs.Kind.INT);
    }

    public static List<PropertyUnderTest<?>> all() {
        return List.of(abs(), brokenAbs(), division(false), division(true), clamp());
    }
}
