package com.bella.script.interpreter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.bella.script.ast.Expr;
import com.bella.script.ast.Expr.Identifier;

/** A closure: parameter names, one body expression and the frame it was declared in. */
public final class UserFunction extends BellaFunction {
    final List<String> params;
    final Expr.ExprInterface body;
    final Environment closure;

    UserFunction(String name, List<Identifier> params, Expr.ExprInterface body, Environment closure) {
        super(name);
        List<String> names = new ArrayList<>(params.size());
        for (Identifier p : params) names.add(p.name);
        this.params = List.copyOf(names);
        this.body = body;
        this.closure = closure;
    }

    public List<String> params() {
        return params;
    }

    @Override
    public int arity() {
        return params.size();
    }

    @Override
    Value invoke(Interpreter interpreter, List<Value> args) {
        // New call frame is a child of the closure (lexical scoping), not of the caller.
        Map<String, Value> bindings = new LinkedHashMap<>();
        for (int i = 0; i < params.size(); i++) {
            if (bindings.putIfAbsent(params.get(i), args.get(i)) != null) {
                throw new BellaError.RedeclarationError(params.get(i));
            }
        }
        return interpreter.evaluate(body, closure.childFrame(bindings));
    }
}
