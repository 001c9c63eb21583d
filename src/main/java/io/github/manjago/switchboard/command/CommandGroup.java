package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.core.ConfigurationException;
import io.github.manjago.switchboard.option.Option;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inner node of the command tree.
 * 
 * Its shared options are visible to every descendant command.
 */
public final class CommandGroup implements Routable {
    
    private final String name;
    private final String description;
    private final Map<String, Routable> children;
    private final List<Option> sharedOptions;
    
    private CommandGroup(Builder b) {
        this.name = checkName(b.name);
        this.description = b.description;
        this.sharedOptions = List.copyOf(b.sharedOptions);
        this.children = new LinkedHashMap<>();
        for (Routable child : b.children) {
            if (children.putIfAbsent(child.name(), child) != null) {
                throw new ConfigurationException("Group '" + name + "' has two children named '" + child.name() + "'");
            }
        }
    }
    
    public static Builder builder(String name) {
        return new Builder(name);
    }
    
    @Override
    public @NotNull String name() {
        return name;
    }
    
    @Override
    public @NotNull String description() {
        return description;
    }
    
    /**
     * @return children in registration order
     */
    public @NotNull List<Routable> children() {
        return List.copyOf(children.values());
    }
    
    /**
     * @return the child with exactly this name, or null
     */
    public @Nullable Routable child(@NotNull String name) {
        return children.get(name);
    }
    
    public @NotNull List<Option> sharedOptions() {
        return sharedOptions;
    }
    
    static String checkName(String name) {
        if (name == null || name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new ConfigurationException("Invalid command name: '" + name + "'");
        }
        return name;
    }
    
    @Override
    public String toString() {
        return "CommandGroup(" + name + ")";
    }
    
    public static class Builder {
        private final String name;
        private String description = "";
        private final List<Routable> children = new ArrayList<>();
        private final List<Option> sharedOptions = new ArrayList<>();
        
        private Builder(String name) {
            this.name = name;
        }
        
        public Builder description(String description) { this.description = description == null ? "" : description; return this; }
        public Builder child(Routable child) { this.children.add(child); return this; }
        public Builder children(List<? extends Routable> children) { this.children.addAll(children); return this; }
        public Builder sharedOption(Option option) { this.sharedOptions.add(option); return this; }
        public Builder sharedOptions(List<? extends Option> options) { this.sharedOptions.addAll(options); return this; }
        
        public CommandGroup build() {
            return new CommandGroup(this);
        }
    }
}
