package org.sysmlite.engine.eval;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of native function implementations.
 *
 * Functions are stored by qualified name and by simple name. Lookup by
 * simple name serves invocations whose function reference did not resolve,
 * e.g. in documents analyzed without the standard library; a simple name
 * shared by two packages is only reachable by qualified name.
 */
public class BuiltinFunctionRegistry {

    private final Map<FunctionKey, BuiltinFunction> byKey = new LinkedHashMap<>();
    private final Map<String, BuiltinFunction> byQualifiedName = new HashMap<>();
    private final Map<String, BuiltinFunction> bySimpleName = new HashMap<>();
    private final Map<String, Integer> simpleNameCounts = new HashMap<>();

    public void register(FunctionKey key, BuiltinFunction function) {
        if (byKey.put(key, function) == null) {
            simpleNameCounts.merge(key.name(), 1, Integer::sum);
        }
        byQualifiedName.put(key.qualifiedName(), function);
        if (simpleNameCounts.get(key.name()) == 1) {
            bySimpleName.put(key.name(), function);
        } else {
            bySimpleName.remove(key.name());
        }
    }

    public void register(String packageName, String name, BuiltinFunction function) {
        register(FunctionKey.of(packageName, name), function);
    }

    public Optional<BuiltinFunction> find(FunctionKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    /**
     * @param name qualified name, e.g. {@code NumericalFunctions::sum}, or a simple name
     */
    public Optional<BuiltinFunction> find(String name) {
        BuiltinFunction function = byQualifiedName.get(name);
        if (function == null) {
            function = bySimpleName.get(name);
        }
        return Optional.ofNullable(function);
    }

    public boolean hasFunction(String name) {
        return find(name).isPresent();
    }

    public Map<FunctionKey, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(byKey);
    }

    /**
     * Create a registry with every builtin function package.
     */
    public static BuiltinFunctionRegistry withBuiltins() {
        BuiltinFunctionRegistry registry = new BuiltinFunctionRegistry();
        BaseFunctions.register(registry);
        DataFunctions.register(registry);
        ControlFunctions.register(registry);
        SequenceFunctions.register(registry);
        StringFunctions.register(registry);
        NumericalFunctions.register(registry);
        return registry;
    }
}
