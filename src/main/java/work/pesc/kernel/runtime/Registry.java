package work.pesc.kernel.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores named functions and the single-character operator aliases that point at them.
 * Aliases are plain names: they are resolved on use, so an alias may name a function that does not exist yet.
 */
public final class Registry {
    private final Map<String, PescFunction> functions = new ConcurrentHashMap<>();
    private final Map<Character, String> operators = new ConcurrentHashMap<>();

    public Registry register(String name, PescFunction fn) {
        return register(null, name, fn);
    }

    public Registry register(Character alias, String name, PescFunction fn) {
        if (alias != null) {
            operators.put(alias, name);
        }
        functions.put(name, fn);
        return this;
    }

    public Registry alias(char alias, String name) {
        operators.put(alias, name);
        return this;
    }

    public PescFunction get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public boolean isOperator(char symbol) {
        return operators.containsKey(symbol);
    }

    public Optional<String> resolveOperator(char symbol) {
        return Optional.ofNullable(operators.get(symbol));
    }

    public void unregister(String name) {
        if (name != null) {
            functions.remove(name);
        }
    }

    public Map<String, PescFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    public Map<Character, String> operators() {
        return Collections.unmodifiableMap(operators);
    }
}
