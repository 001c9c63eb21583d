package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.core.ConfigurationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alternate invocation names, each mapped to a canonical command name.
 * 
 * Resolution is a single substitution. A target may not itself be an
 * alias, which also rules out cycles.
 */
public final class AliasTable {
    
    /** {@code -h -> help}, {@code -v -> version} */
    public static final AliasTable DEFAULTS = new AliasTable(Map.of("-h", "help", "-v", "version"));
    
    public static final AliasTable EMPTY = new AliasTable(Map.of());
    
    private final Map<String, String> aliases;
    
    public AliasTable(Map<String, String> aliases) {
        Map<String, String> copy = new LinkedHashMap<>(aliases);
        for (Map.Entry<String, String> entry : copy.entrySet()) {
            String alias = entry.getKey();
            String target = entry.getValue();
            if (alias == null || alias.isEmpty() || target == null || target.isEmpty()) {
                throw new ConfigurationException("Empty alias entry: " + alias + " -> " + target);
            }
            if (copy.containsKey(target)) {
                throw new ConfigurationException("Alias '" + alias + "' points to another alias '" + target + "'");
            }
        }
        this.aliases = Map.copyOf(copy);
    }
    
    /**
     * @return the canonical name for this token, or the token itself
     */
    @Contract(pure = true)
    public @NotNull String resolve(@NotNull String token) {
        return aliases.getOrDefault(token, token);
    }
    
    public AliasTable with(String alias, String target) {
        Map<String, String> copy = new LinkedHashMap<>(aliases);
        copy.put(alias, target);
        return new AliasTable(copy);
    }
    
    public AliasTable without(String alias) {
        Map<String, String> copy = new LinkedHashMap<>(aliases);
        copy.remove(alias);
        return new AliasTable(copy);
    }
    
    public @NotNull Map<String, String> asMap() {
        return aliases;
    }
    
    public boolean isEmpty() {
        return aliases.isEmpty();
    }
    
    @Override
    public String toString() {
        return "AliasTable" + aliases;
    }
}
