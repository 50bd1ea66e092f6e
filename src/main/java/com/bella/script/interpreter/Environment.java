package com.bella.script.interpreter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.bella.script.interpreter.BellaError.RedeclarationError;
import com.bella.script.interpreter.BellaError.UnboundVariableError;

/**
 * One scope frame: name to value bindings plus an optional parent used only for lookup.
 *
 * The root frame is owned by the engine for the whole run. A call frame is created per
 * user-function invocation, parented to the closure's captured frame, and dropped when the
 * call returns.
 */
public class Environment {

    public final Environment parent;

    private final Map<String, Value> vars = new LinkedHashMap<>();

    /** Root frame. */
    public Environment() {
        this.parent = null;
    }

    public Environment(Map<String, Value> initial) {
        this.parent = null;
        if (initial != null) vars.putAll(initial);
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds a new name in THIS frame; outer frames are not consulted. */
    public void declare(String name, Value value) {
        if (vars.containsKey(name)) {
            throw new RedeclarationError(name);
        }
        vars.put(name, value);
    }

    /** Rebinds the nearest existing binding of {@code name}, walking outwards. */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.vars.containsKey(name)) {
                e.vars.put(name, value);
                return;
            }
        }
        throw new UnboundVariableError(name);
    }

    public Value lookup(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.vars.get(name);
            if (v != null) return v;
        }
        throw new UnboundVariableError(name);
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.vars.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return vars.containsKey(name);
    }

    // -------------------------
    // Frames
    // -------------------------

    public Environment childFrame() {
        return new Environment(this);
    }

    /** A call frame parented to this one, pre-populated with {@code bindings}. */
    public Environment childFrame(Map<String, Value> bindings) {
        Environment child = new Environment(this);
        if (bindings != null) {
            for (Map.Entry<String, Value> b : bindings.entrySet()) {
                child.declare(b.getKey(), b.getValue());
            }
        }
        return child;
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    /** Read-only view of this frame's own bindings, in declaration order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(vars));
    }
}
