package com.bella.script.interpreter;

import java.util.List;

/** Payload of a FUNC value: either a host-native callable or a user-defined closure. */
public abstract class BellaFunction {
    protected final String name;

    protected BellaFunction(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public abstract int arity();

    /** Arity has already been checked by the caller. */
    abstract Value invoke(Interpreter interpreter, List<Value> args);

    @Override
    public String toString() {
        return "<function " + name + ">";
    }
}
