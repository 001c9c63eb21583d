package io.github.manjago.switchboard.route;

import io.github.manjago.switchboard.command.CommandPath;
import io.github.manjago.switchboard.command.GroupPath;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of routing: a resolved command or a routing failure.
 */
public sealed interface RouteResult permits RouteResult.Resolved, RouteResult.RoutingFailure {
    
    /**
     * Tokens named a command.
     */
    record Resolved(@NotNull CommandPath path) implements RouteResult {}
    
    /**
     * No command found.
     * 
     * @param partialPath deepest group reached; for error reporting only
     * @param unmatchedToken the token that matched no child, as typed; null
     *                       when the tokens ran out at a group
     */
    record RoutingFailure(@NotNull GroupPath partialPath, @Nullable String unmatchedToken) implements RouteResult {}
}
