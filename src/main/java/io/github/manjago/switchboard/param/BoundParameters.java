package io.github.manjago.switchboard.param;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positional values bound to a signature's slots.
 */
public final class BoundParameters {
    
    private final Map<String, String> values;
    private final String variadicName;
    private final List<String> variadicValues;
    
    BoundParameters(Map<String, String> values, @Nullable String variadicName, List<String> variadicValues) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.variadicName = variadicName;
        this.variadicValues = List.copyOf(variadicValues);
    }
    
    /**
     * @return value of a required or optional slot; for an optional slot
     *         without a token this is its default (possibly null)
     */
    public @Nullable String get(@NotNull String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("No such parameter: " + name);
        }
        return values.get(name);
    }
    
    /**
     * @return tokens collected by the variadic slot (possibly empty)
     */
    public @NotNull List<String> getAll(@NotNull String name) {
        if (!name.equals(variadicName)) {
            throw new IllegalArgumentException("No such variadic parameter: " + name);
        }
        return variadicValues;
    }
    
    /**
     * @return single-valued slots in declaration order
     */
    public @NotNull Map<String, String> values() {
        return values;
    }
    
    public @NotNull List<String> variadic() {
        return variadicValues;
    }
    
    @Override
    public String toString() {
        if (variadicName == null) {
            return values.toString();
        }
        Map<String, Object> all = new LinkedHashMap<>(values);
        all.put(variadicName, variadicValues);
        return all.toString();
    }
}
