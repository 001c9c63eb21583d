package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.option.Option;
import io.github.manjago.switchboard.option.OptionRegistry;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Result of successful routing: groups traversed, the terminal command,
 * and every option visible to it.
 */
public record CommandPath(@NotNull GroupPath groups, @NotNull Command command, @NotNull List<Option> visibleOptions) {
    
    public CommandPath {
        visibleOptions = List.copyOf(visibleOptions);
    }
    
    /**
     * Spelling lookup for this command.
     * 
     * @throws io.github.manjago.switchboard.core.ConfigurationException on
     *         duplicate spellings
     */
    public OptionRegistry optionRegistry() {
        return new OptionRegistry(visibleOptions, command.optionGroups());
    }
    
    /**
     * Invocation prefix, e.g. {@code tool test unit}.
     */
    public String invocation() {
        return groups.invocation() + " " + command.name();
    }
    
    /**
     * One-line usage, e.g. {@code tool greet <name> [<greeting>] [options]}.
     */
    public String usage() {
        StringBuilder sb = new StringBuilder(invocation());
        if (!command.signature().isEmpty()) {
            sb.append(' ').append(command.signature().usage());
        }
        if (!visibleOptions.isEmpty()) {
            sb.append(" [options]");
        }
        return sb.toString();
    }
}
