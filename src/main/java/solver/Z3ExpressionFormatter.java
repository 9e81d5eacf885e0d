package solver;

import com.microsoft.z3.*;
import java.util.*;

/**
 * Renders solver expressions as infix text for diagnostics and debug logs.
 */
public class Z3ExpressionFormatter {

    private static final Map<String, String> OPERATOR_MAP = new HashMap<String, String>() {{
        put("+", "+");
        put("-", "-");
        put("*", "*");
        put("div", "/");
        put("/", "/");
        put("mod", "%");
        put("rem", "%");
        put("<", "<");
        put("<=", "<=");
        put(">", ">");
        put(">=", ">=");
        put("=>", "implies");
        put("bvsge", ">=");
        put("bvsle", "<=");
        put("bvsgt", ">");
        put("bvslt", "<");
        put("bvadd", "+");
        put("bvsub", "-");
        put("bvmul", "*");
        put("bvsdiv", "/");
        put("bvsrem", "%");
        put("bvand", "&");
        put("bvor", "|");
        put("bvxor", "^");
        put("str.++", "+");
    }};

    private static final Map<String, Integer> PRECEDENCE = new HashMap<String, Integer>() {{
        put("*", 5);
        put("div", 5);
        put("/", 5);
        put("mod", 5);
        put("rem", 5);
        put("bvmul", 5);
        put("bvsdiv", 5);
        put("bvsrem", 5);
        put("+", 4);
        put("-", 4);
        put("bvadd", 4);
        put("bvsub", 4);
        put("str.++", 4);
        put("<", 3);
        put("<=", 3);
        put(">", 3);
        put(">=", 3);
        put("=", 3);
        put("distinct", 3);
        put("not", 2);
        put("and", 1);
        put("or", 0);
        put("=>", 0);
    }};

    public static String formatExpression(Expr expr) {
        if (expr == null) return "";
        if (expr.isTrue()) return "true";
        if (expr.isFalse()) return "false";
        if (expr instanceof IntNum) {
            return ((IntNum) expr).getBigInteger().toString();
        }
        if (expr instanceof BitVecNum) {
            return String.valueOf(((BitVecNum) expr).getLong());
        }
        if (expr.isString()) {
            return "\"" + expr.getString() + "\"";
        }
        if (!expr.isApp() || expr.getNumArgs() == 0) {
            return expr.toString().replace("|", "");
        }

        String declName = expr.getFuncDecl().getName().toString();
        switch (declName) {
            case "not":
                Expr arg = expr.getArgs()[0];
                if (arg.isApp() && arg.getFuncDecl().getName().toString().equals("=")) {
                    return formatBinaryOp(arg, "!=");
                }
                return "not " + wrap(arg, expr);
            case "and":
                return formatNaryOp(expr, "and");
            case "or":
                return formatNaryOp(expr, "or");
            case "=":
                return formatBinaryOp(expr, "==");
            case "distinct":
                return formatBinaryOp(expr, "!=");
            case "ite":
                Expr[] ite = expr.getArgs();
                return "(" + formatExpression(ite[1]) + " if " + formatExpression(ite[0])
                        + " else " + formatExpression(ite[2]) + ")";
            default:
                break;
        }
        if (OPERATOR_MAP.containsKey(declName)) {
            if (expr.getNumArgs() == 1 && declName.equals("-")) {
                return "-" + wrap(expr.getArgs()[0], expr);
            }
            return formatNaryOp(expr, OPERATOR_MAP.get(declName));
        }
        return formatDefaultExpr(expr);
    }

    private static String formatBinaryOp(Expr expr, String operator) {
        Expr[] args = expr.getArgs();
        if (args.length != 2) {
            return formatDefaultExpr(expr);
        }
        return wrap(args[0], expr) + " " + operator + " " + wrap(args[1], expr);
    }

    private static String formatNaryOp(Expr expr, String operator) {
        Expr[] args = expr.getArgs();
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                result.append(" ").append(operator).append(" ");
            }
            result.append(wrap(args[i], expr));
        }
        return result.toString();
    }

    private static String formatDefaultExpr(Expr expr) {
        StringBuilder result = new StringBuilder();
        result.append(expr.getFuncDecl().getName().toString().replace("|", "")).append("(");
        Expr[] args = expr.getArgs();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) result.append(", ");
            result.append(formatExpression(args[i]));
        }
        result.append(")");
        return result.toString();
    }

    private static String wrap(Expr child, Expr parent) {
        String text = formatExpression(child);
        return needsParentheses(child, parent) ? "(" + text + ")" : text;
    }

    private static boolean needsParentheses(Expr child, Expr parent) {
        if (!child.isApp() || child.getNumArgs() == 0) return false;
        Integer childPrec = PRECEDENCE.get(child.getFuncDecl().getName().toString());
        Integer parentPrec = PRECEDENCE.get(parent.getFuncDecl().getName().toString());
        if (childPrec == null || parentPrec == null) return false;
        return childPrec <= parentPrec;
    }

    public static String formatModelValue(Model model, Expr expr) {
        Expr value = model.evaluate(expr, false);
        if (value == null) return formatExpression(expr) + " = undefined";
        return formatExpression(expr) + " = " + formatExpression(value);
    }
}
