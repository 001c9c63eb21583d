package io.github.manjago.switchboard.option;

import io.github.manjago.switchboard.core.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Spelling lookup over the options visible to one command.
 * 
 * Construction fails on a duplicate spelling, so an ambiguous
 * configuration is caught before any token is read.
 */
public final class OptionRegistry {
    
    private final List<Option> options;
    private final List<OptionGroup> groups;
    private final Map<String, Option> bySpelling = new HashMap<>();
    
    public OptionRegistry(Collection<? extends Option> options) {
        this(options, List.of());
    }
    
    /**
     * @param options visible options (own, inherited and global)
     * @param groups option groups declared by the command
     * @throws ConfigurationException on duplicate spellings, or a group
     *         member that is not visible
     */
    public OptionRegistry(Collection<? extends Option> options, Collection<OptionGroup> groups) {
        this.options = List.copyOf(options);
        this.groups = List.copyOf(groups);
        
        for (Option option : this.options) {
            for (String name : option.names()) {
                Option previous = bySpelling.putIfAbsent(name, option);
                if (previous != null && previous != option) {
                    throw new ConfigurationException("Duplicate option spelling '" + name
                            + "' used by " + previous + " and " + option);
                }
            }
        }
        
        Set<Option> visible = new HashSet<>(this.options);
        for (OptionGroup group : this.groups) {
            for (Option member : group.options()) {
                if (!visible.contains(member)) {
                    throw new ConfigurationException("Option group " + group
                            + " refers to an option the command does not declare: " + member);
                }
            }
        }
    }
    
    public @Nullable Option lookup(@NotNull String spelling) {
        return bySpelling.get(spelling);
    }
    
    public @NotNull List<Option> options() {
        return options;
    }
    
    public @NotNull List<OptionGroup> groups() {
        return groups;
    }
}
