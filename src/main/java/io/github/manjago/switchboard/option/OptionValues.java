package io.github.manjago.switchboard.option;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Option values recognized in one invocation.
 * 
 * Keyed by option identity. Insertion order follows first occurrence on
 * the command line; a repeated keyed option keeps its last value.
 */
public final class OptionValues {
    
    private final Map<Option, Object> values = new LinkedHashMap<>();
    
    /**
     * Empty set of values; the recognizer fills it.
     */
    public OptionValues() {}
    
    void setFlag(Flag flag) {
        values.put(flag, Boolean.TRUE);
    }
    
    <T> void setValue(KeyedOption<T> option, T value) {
        values.put(option, value);
    }
    
    /**
     * @return true if the flag was passed
     */
    public boolean isSet(@NotNull Flag flag) {
        return values.containsKey(flag);
    }
    
    /**
     * @return true if the option occurred on the command line
     */
    public boolean isPresent(@NotNull Option option) {
        return values.containsKey(option);
    }
    
    /**
     * @return converted value, or null if the option was not given
     */
    public <T> @Nullable T get(@NotNull KeyedOption<T> option) {
        @SuppressWarnings("unchecked")
        T value = (T) values.get(option);
        return value;
    }
    
    public <T> T getOrDefault(@NotNull KeyedOption<T> option, T fallback) {
        T value = get(option);
        return value != null ? value : fallback;
    }
    
    /**
     * Look up a value by any of the option's spellings.
     * 
     * @return Boolean.TRUE for a set flag, the converted value for a keyed
     *         option, or null if no given option has that spelling
     */
    public @Nullable Object get(@NotNull String spelling) {
        for (Map.Entry<Option, Object> entry : values.entrySet()) {
            if (entry.getKey().names().contains(spelling)) {
                return entry.getValue();
            }
        }
        return null;
    }
    
    public @NotNull Set<Option> present() {
        return Collections.unmodifiableSet(values.keySet());
    }
    
    /**
     * @return values keyed by each option's display name, in occurrence order
     */
    public @NotNull Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        values.forEach((option, value) -> map.put(option.displayName(), value));
        return map;
    }
    
    public int size() {
        return values.size();
    }
    
    @Override
    public String toString() {
        return asMap().toString();
    }
}
