package org.calc;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.calc.CalcException.ErrorKind;

/**
 * Variable bindings for one calculator session. Not thread-safe; a session owns exactly one.
 */
public final class Environment {
    private final Map<String, Double> vars = new TreeMap<>();

    public double lookup(String name) {
        Double v = vars.get(name);
        if (v == null) throw new CalcException(ErrorKind.UNDEFINED_VARIABLE, "undefined variable '" + name + "'");
        return v;
    }

    /** Binds {@code name}, replacing any previous value. */
    public void assign(String name, double value) { vars.put(name, value); }

    public boolean isDefined(String name) { return vars.containsKey(name); }

    /** Read-only view, sorted by name. */
    public Map<String, Double> variables() { return Collections.unmodifiableMap(vars); }
}
