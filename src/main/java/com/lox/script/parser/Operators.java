package com.lox.script.parser;

import java.math.BigDecimal;
import java.util.function.UnaryOperator;

/**
 * Operator semantics of the language: pure functions over Values.
 *
 * The TreeBuilder binds each operator rule to one of the Binary/Unary constants once;
 * the Interpreter only ever calls {@code apply} on the constant stored in the node.
 */
public final class Operators {

    private Operators() {}

    public enum Binary {
        ADD("+", "add", Operators::add),
        SUB("-", "sub", Operators::sub),
        MUL("*", "mul", Operators::mul),
        DIV("/", "div", Operators::div),
        GT(">", "gt", Operators::gt),
        LT("<", "lt", Operators::lt),
        GE(">=", "ge", Operators::ge),
        LE("<=", "le", Operators::le),
        EQ("==", "eq", Operators::eq),
        NE("!=", "ne", Operators::ne);

        public final String symbol;
        public final String rule;
        private final java.util.function.BinaryOperator<Value> fn;

        Binary(String symbol, String rule, java.util.function.BinaryOperator<Value> fn) {
            this.symbol = symbol;
            this.rule = rule;
            this.fn = fn;
        }

        public Value apply(Value left, Value right) {
            return fn.apply(left, right);
        }
    }

    public enum Unary {
        NEG("-", "neg", Operators::negate),
        NOT("!", "not_", Operators::not);

        public final String symbol;
        public final String rule;
        private final UnaryOperator<Value> fn;

        Unary(String symbol, String rule, UnaryOperator<Value> fn) {
            this.symbol = symbol;
            this.rule = rule;
            this.fn = fn;
        }

        public Value apply(Value operand) {
            return fn.apply(operand);
        }
    }

    // -------------------------
    // Truthiness
    // -------------------------

    /** false and nil are falsy, everything else (0 and "" included) is truthy. */
    public static boolean truthy(Value v) {
        switch (v.getType()) {
            case NIL: return false;
            case BOOL: return v.asBool();
            default: return true;
        }
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    public static Value add(Value a, Value b) {
        if (a.getType() == Value.Type.NUMBER && b.getType() == Value.Type.NUMBER) {
            return Value.number(a.asNumber() + b.asNumber());
        }
        if (a.getType() == Value.Type.STRING && b.getType() == Value.Type.STRING) {
            return Value.string(a.asString() + b.asString());
        }
        throw ScriptError.typeError("Unsupported operand types for '+': " + a.getType() + ", " + b.getType());
    }

    public static Value sub(Value a, Value b) {
        requireNumbers(a, b, "-");
        return Value.number(a.asNumber() - b.asNumber());
    }

    public static Value mul(Value a, Value b) {
        requireNumbers(a, b, "*");
        return Value.number(a.asNumber() * b.asNumber());
    }

    public static Value div(Value a, Value b) {
        requireNumbers(a, b, "/");
        if (b.asNumber() == 0.0) throw ScriptError.divisionByZero("Division by zero");
        return Value.number(a.asNumber() / b.asNumber());
    }

    // -------------------------
    // Comparison
    // -------------------------

    public static Value gt(Value a, Value b) {
        requireNumbers(a, b, ">");
        return Value.bool(a.asNumber() > b.asNumber());
    }

    public static Value lt(Value a, Value b) {
        requireNumbers(a, b, "<");
        return Value.bool(a.asNumber() < b.asNumber());
    }

    public static Value ge(Value a, Value b) {
        requireNumbers(a, b, ">=");
        return Value.bool(a.asNumber() >= b.asNumber());
    }

    public static Value le(Value a, Value b) {
        requireNumbers(a, b, "<=");
        return Value.bool(a.asNumber() <= b.asNumber());
    }

    public static Value eq(Value a, Value b) {
        return Value.bool(isEqual(a, b));
    }

    public static Value ne(Value a, Value b) {
        return Value.bool(!isEqual(a, b));
    }

    /** Values of different kinds are never equal; callables, classes and instances compare by reference. */
    public static boolean isEqual(Value a, Value b) {
        if (a.getType() != b.getType()) return false;
        switch (a.getType()) {
            case NIL: return true;
            case NUMBER: return a.asNumber() == b.asNumber();
            case BOOL: return a.asBool() == b.asBool();
            case STRING: return a.asString().equals(b.asString());
            default: return a.value == b.value;
        }
    }

    // -------------------------
    // Unary
    // -------------------------

    public static Value negate(Value v) {
        if (v.getType() != Value.Type.NUMBER) {
            throw ScriptError.typeError("Operand of unary '-' must be a number, got " + v.getType());
        }
        return Value.number(-v.asNumber());
    }

    public static Value not(Value v) {
        return Value.bool(!truthy(v));
    }

    private static void requireNumbers(Value a, Value b, String symbol) {
        if (a.getType() != Value.Type.NUMBER || b.getType() != Value.Type.NUMBER) {
            throw ScriptError.typeError("Operator '" + symbol + "' expects numbers, got " + a.getType() + ", " + b.getType());
        }
    }

    // -------------------------
    // Implicit integers (names starting with i..n)
    // -------------------------

    public static boolean isImplicitInteger(String name) {
        if (name == null || name.isEmpty()) return false;
        char c = name.charAt(0);
        return c >= 'i' && c <= 'n';
    }

    /**
     * Coerces to an integral number where that makes numeric sense. Never fails:
     * values with no integral reading come back unchanged.
     */
    public static Value toIntegral(Value v) {
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                if (Double.isNaN(d) || Double.isInfinite(d)) return v;
                double truncated = d < 0 ? Math.ceil(d) : Math.floor(d);
                return truncated == d ? v : Value.number(truncated);
            }
            case BOOL:
                return Value.number(v.asBool() ? 1 : 0);
            case STRING: {
                Double parsed = parseIntegerText(v.asString());
                return parsed == null ? v : Value.number(parsed);
            }
            default:
                return v;
        }
    }

    private static Double parseIntegerText(String raw) {
        String text = raw.strip();
        if (text.isEmpty()) return null;

        int i = 0;
        if (text.charAt(0) == '+' || text.charAt(0) == '-') i = 1;
        if (i >= text.length()) return null;

        StringBuilder digits = new StringBuilder(text.length());
        boolean lastWasDigit = false;
        for (; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
                lastWasDigit = true;
            } else if (c == '_' && lastWasDigit && i + 1 < text.length()) {
                lastWasDigit = false;
            } else {
                return null;
            }
        }
        if (!lastWasDigit) return null;

        double magnitude = new BigDecimal(digits.toString()).doubleValue();
        return text.charAt(0) == '-' ? -magnitude : magnitude;
    }

    // -------------------------
    // Rendering
    // -------------------------

    public static String stringify(Value v) {
        switch (v.getType()) {
            case NIL: return "nil";
            case BOOL: return v.asBool() ? "true" : "false";
            case STRING: return v.asString();
            case NUMBER: return formatNumber(v.asNumber());
            case FUNC: return v.asFunc().toString();
            case CLASS: return v.asClass().name;
            case INSTANCE: return v.asInstance().toString();
            default: return String.valueOf(v.value);
        }
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
        if (d == Math.rint(d)) {
            return new BigDecimal(d).toBigInteger().toString();
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
