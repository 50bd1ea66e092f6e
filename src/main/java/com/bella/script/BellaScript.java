package com.bella.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.bella.debug.Debug;
import com.bella.script.ast.Expr;
import com.bella.script.ast.Program;
import com.bella.script.interpreter.BellaError;
import com.bella.script.interpreter.Environment;
import com.bella.script.interpreter.Interpreter;
import com.bella.script.interpreter.NativeFunction;
import com.bella.script.interpreter.Value;
import com.bella.script.plugins.BellaMathPlugin;

/**
 * Core Bella engine.
 *
 * - Input: an already-built {@link Program} (see {@link com.bella.script.ast.Ast} and
 *   {@link com.bella.script.ast.AstJsonReader})
 * - Types: number (double), bool, array, function
 * - Statements: declaration (:=), assignment, print, while, function declaration
 * - Built-ins: the math library from {@link BellaMathPlugin}, plus anything the host
 *   registers via {@link #registerFunction}
 * - Errors: every evaluation error is a {@link BellaError}; a run stops at the first one
 */
public class BellaScript {

    private static final String TAG = "bella.engine";

    /** Line-oriented output target for print statements. */
    public interface PrintSink {
        void println(String line);
    }

    /** Hook told about an evaluation error before it leaves {@link #run}. */
    public interface ErrorReporter {
        void report(BellaError error, String kind, String subject, String message);
    }

    // ===================== ENGINE PUBLIC API =====================

    private final Map<String, Value> builtins = new LinkedHashMap<>();
    private PrintSink output = System.out::println;
    private ErrorReporter errorReporter;

    public BellaScript() {
        BellaMathPlugin.register(this);
    }

    public void registerFunction(String name, int arity, NativeFunction.Body body) {
        builtins.put(name, Value.func(new NativeFunction(name, arity, body)));
    }

    public void registerConstant(String name, double value) {
        builtins.put(name, Value.number(value));
    }

    public Set<String> builtinNames() {
        return Collections.unmodifiableSet(builtins.keySet());
    }

    public void setOutput(PrintSink output) {
        this.output = (output == null) ? System.out::println : output;
    }

    public void setErrorReporter(ErrorReporter errorReporter) {
        this.errorReporter = errorReporter;
    }

    /**
     * Runs a program against a fresh root frame seeded with the built-ins.
     * Returns the root frame's final bindings (built-ins included), in declaration order.
     */
    public Map<String, Value> run(Program program) {
        if (program == null) throw new IllegalArgumentException("program must not be null");

        Environment root = newRootFrame();
        Interpreter interpreter = new Interpreter(root, output);

        Debug.get().d(TAG, "run: " + program.body.statements.size() + " top-level statement(s)");
        try {
            interpreter.execute(program.body);
        } catch (BellaError e) {
            onError(e);
            throw e;
        }
        Debug.get().d(TAG, "run: completed");
        return root.snapshot();
    }

    /** Evaluates one expression against a fresh root frame. */
    public Value evaluate(Expr.ExprInterface expr) {
        Environment root = newRootFrame();
        try {
            return new Interpreter(root, output).evaluate(expr, root);
        } catch (BellaError e) {
            onError(e);
            throw e;
        }
    }

    private Environment newRootFrame() {
        return new Environment(builtins);
    }

    private void onError(BellaError e) {
        Debug.get().d(TAG, "error: " + e.diagnostic());
        if (errorReporter != null) {
            errorReporter.report(e, e.kind(), e.subject(), e.getMessage());
        }
    }
}
