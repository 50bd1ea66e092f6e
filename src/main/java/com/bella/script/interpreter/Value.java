package com.bella.script.interpreter;

import java.util.ArrayList;
import java.util.List;

import com.bella.script.interpreter.BellaError.TypeError;

/**
 * A Bella runtime value. Numbers and booleans are immutable; arrays and functions are
 * shared by reference when assigned or passed.
 */
public class Value {
    public enum Type { NUMBER, BOOL, ARRAY, FUNC }

    /** Integral doubles below this magnitude print without a fraction. */
    private static final double PLAIN_INTEGER_LIMIT = 1e15;

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, a); }
    public static Value func(BellaFunction f) { return new Value(Type.FUNC, f); }

    public static Value array(Value... items) {
        List<Value> a = new ArrayList<>(items.length);
        for (Value v : items) a.add(v);
        return array(a);
    }

    public Type getType() { return type; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new TypeError(String.valueOf(type), "Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new TypeError(String.valueOf(type), "Expected bool, got " + type);
        return (boolean) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new TypeError(String.valueOf(type), "Expected array, got " + type);
        return (List<Value>) value; // shared, not copied
    }

    public BellaFunction asFunc() {
        if (type != Type.FUNC) throw new TypeError(String.valueOf(type), "Expected function, got " + type);
        return (BellaFunction) value;
    }

    /** Canonical printed form: {@code -180}, {@code 1.4142135623730951}, {@code [1, true, [2, 3]]}. */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case ARRAY:
                return asArray().toString();
            case FUNC:
                return asFunc().toString();
            default:
                throw new IllegalStateException("Unhandled value type: " + type);
        }
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && Math.abs(d) < PLAIN_INTEGER_LIMIT) {
            // also folds -0.0 to "0"
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case NUMBER: return asNumber() == other.asNumber();
            case BOOL: return asBool() == other.asBool();
            case ARRAY: return asArray().equals(other.asArray());
            default: return value == other.value;
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NUMBER: {
                double d = asNumber();
                // 0.0 and -0.0 compare equal
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            case BOOL: return Boolean.hashCode(asBool());
            case ARRAY: return asArray().hashCode();
            default: return System.identityHashCode(value);
        }
    }
}
