package io.github.manjago.switchboard.command;

import org.jetbrains.annotations.NotNull;

/**
 * Node of the command tree: a {@link CommandGroup} or a leaf {@link Command}.
 */
public sealed interface Routable permits CommandGroup, Command {
    
    /**
     * @return name matched exactly (case-sensitive) against a token
     */
    @NotNull String name();
    
    @NotNull String description();
}
