package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.option.Option;
import io.github.manjago.switchboard.option.OptionGroup;
import io.github.manjago.switchboard.param.ParameterSignature;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Leaf of the command tree: a unit of work.
 * 
 * Carries its own options, option groups and positional signature, plus
 * the action that runs once everything is bound.
 */
public final class Command implements Routable {
    
    private final String name;
    private final String description;
    private final List<Option> options;
    private final List<OptionGroup> optionGroups;
    private final ParameterSignature signature;
    private final CommandAction action;
    private final boolean rawTokens;
    
    private Command(Builder b) {
        this.name = CommandGroup.checkName(b.name);
        this.description = b.description;
        this.options = List.copyOf(b.options);
        this.optionGroups = List.copyOf(b.optionGroups);
        this.signature = b.signature;
        this.action = Objects.requireNonNull(b.action, "action");
        this.rawTokens = b.rawTokens;
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
    
    public @NotNull List<Option> options() {
        return options;
    }
    
    public @NotNull List<OptionGroup> optionGroups() {
        return optionGroups;
    }
    
    public @NotNull ParameterSignature signature() {
        return signature;
    }
    
    public @NotNull CommandAction action() {
        return action;
    }
    
    /**
     * Whether option recognition is skipped, so every remaining token
     * (options included) is bound positionally.
     */
    public boolean acceptsRawTokens() {
        return rawTokens;
    }
    
    @Override
    public String toString() {
        return "Command(" + name + ")";
    }
    
    public static class Builder {
        private final String name;
        private String description = "";
        private final List<Option> options = new ArrayList<>();
        private final List<OptionGroup> optionGroups = new ArrayList<>();
        private ParameterSignature signature = ParameterSignature.EMPTY;
        private CommandAction action = CommandAction.NOOP;
        private boolean rawTokens = false;
        
        private Builder(String name) {
            this.name = name;
        }
        
        public Builder description(String description) { this.description = description == null ? "" : description; return this; }
        public Builder option(Option option) { this.options.add(option); return this; }
        public Builder options(List<? extends Option> options) { this.options.addAll(options); return this; }
        public Builder optionGroup(OptionGroup group) { this.optionGroups.add(group); return this; }
        public Builder signature(ParameterSignature signature) { this.signature = signature; return this; }
        public Builder action(CommandAction action) { this.action = action; return this; }
        public Builder rawTokens(boolean rawTokens) { this.rawTokens = rawTokens; return this; }
        
        public Command build() {
            return new Command(this);
        }
    }
}
