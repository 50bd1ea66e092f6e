package com.bella.script.interpreter;

import java.util.List;

import com.bella.script.interpreter.BellaError.TypeError;

/**
 * A host-implemented function over numbers. Arguments reach {@link Body#call} already
 * unwrapped to doubles, in call order.
 */
public final class NativeFunction extends BellaFunction {

    /** Functional interface for native bodies. */
    public interface Body {
        Value call(double[] args);
    }

    private final int arity;
    private final Body body;

    public NativeFunction(String name, int arity, Body body) {
        super(name);
        if (arity < 0) throw new IllegalArgumentException("arity must be >= 0: " + arity);
        this.arity = arity;
        this.body = body;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    Value invoke(Interpreter interpreter, List<Value> args) {
        double[] nums = new double[args.size()];
        for (int i = 0; i < nums.length; i++) {
            Value v = args.get(i);
            if (v.getType() != Value.Type.NUMBER) {
                throw new TypeError(name, name + "() argument " + i + " must be a number, got " + v.getType());
            }
            nums[i] = v.asNumber();
        }
        return body.call(nums);
    }
}
