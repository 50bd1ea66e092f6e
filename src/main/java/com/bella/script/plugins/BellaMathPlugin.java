package com.bella.script.plugins;

import com.bella.debug.Debug;
import com.bella.script.BellaScript;
import com.bella.script.interpreter.Value;

/**
 * BellaMathPlugin
 *
 * The Bella standard library. Every engine registers it before a program runs, so these
 * names are bound in the root frame:
 *
 *   sin(x) cos(x) sqrt(x) exp(x) ln(x)   unary
 *   hypot(x, y)                          binary
 *   π                                    constant
 *
 * All functions are pure and take numbers only.
 */
public final class BellaMathPlugin {

    private BellaMathPlugin() {}

    public static void register(BellaScript engine) {

        engine.registerFunction("sin", 1, args -> Value.number(Math.sin(args[0])));

        engine.registerFunction("cos", 1, args -> Value.number(Math.cos(args[0])));

        engine.registerFunction("hypot", 2, args -> Value.number(Math.hypot(args[0], args[1])));

        engine.registerFunction("sqrt", 1, args -> Value.number(Math.sqrt(args[0])));

        engine.registerFunction("exp", 1, args -> Value.number(Math.exp(args[0])));

        // natural logarithm, a function and not the ln(10) constant
        engine.registerFunction("ln", 1, args -> Value.number(Math.log(args[0])));

        engine.registerConstant("π", Math.PI);

        Debug.get().d("bella.plugins", "math library registered");
    }
}
