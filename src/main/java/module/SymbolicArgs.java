package module;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.RealExpr;
import com.microsoft.z3.SeqExpr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The symbolic inputs of a property, created once per exploration so that
 * every iteration sees the same constants.
 */
public class SymbolicArgs {

    public enum Kind {
        INT,
        BOOL,
        REAL,
        STRING
    }

    private final Map<String, Expr> values = new LinkedHashMap<>();

    public SymbolicArgs(Context ctx, Map<String, Kind> declared) {
        for (Map.Entry<String, Kind> entry : declared.entrySet()) {
            values.put(entry.getKey(), create(ctx, entry.getKey(), entry.getValue()));
        }
    }

    private static Expr create(Context ctx, String name, Kind kind) {
        switch (kind) {
            case INT:
                return ctx.mkIntConst(name);
            case BOOL:
                return ctx.mkBoolConst(name);
            case REAL:
                return ctx.mkRealConst(name);
            case STRING:
                return ctx.mkConst(name, ctx.getStringSort());
            default:
                throw new IllegalArgumentException("Unsupported input kind: " + kind);
        }
    }

    public Expr get(String name) {
        Expr value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No symbolic input named " + name);
        }
        return value;
    }

    public IntExpr getInt(String name) {
        return (IntExpr) get(name);
    }

    public BoolExpr getBool(String name) {
        return (BoolExpr) get(name);
    }

    public RealExpr getReal(String name) {
        return (RealExpr) get(name);
    }

    public SeqExpr<?> getString(String name) {
        return (SeqExpr<?>) get(name);
    }

    public Map<String, Expr> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "SymbolicArgs" + values;
    }
}
