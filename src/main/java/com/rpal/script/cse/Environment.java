package com.rpal.script.cse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.rpal.script.RpalRuntimeException;

/**
 * One link of the lexical environment chain. Bindings are fixed when the environment is
 * created; closures share environments freely because nothing mutates them afterwards.
 */
public class Environment {

    public final String name;
    public final Environment parent;

    private final Map<String, Value> bindings;

    private Environment(String name, Environment parent, Map<String, Value> bindings) {
        this.name = name;
        this.parent = parent;
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /** The primitive environment {@code e_0}. */
    public static Environment root(Map<String, Value> initial) {
        return new Environment("e_0", null, initial == null ? Collections.<String, Value>emptyMap() : initial);
    }

    /** Child frame created by one closure application. */
    public Environment childScope(int id, Map<String, Value> bindings) {
        return new Environment("e_" + id, this, bindings);
    }

    public Value get(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.bindings.get(name);
            if (v != null) return v;
        }
        throw RpalRuntimeException.lookup(name);
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.bindings.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return bindings.containsKey(name);
    }

    public Map<String, Value> bindings() {
        return bindings;
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    /** DEBUG: frame names from this environment out to the root, e.g. [e_3, e_1, e_0]. */
    public List<String> chain() {
        List<String> out = new ArrayList<>();
        for (Environment e = this; e != null; e = e.parent) out.add(e.name);
        return out;
    }

    @Override
    public String toString() {
        return name;
    }
}
