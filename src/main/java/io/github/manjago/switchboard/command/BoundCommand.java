package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.option.OptionValues;
import io.github.manjago.switchboard.param.BoundParameters;
import org.jetbrains.annotations.NotNull;

/**
 * Fully interpreted invocation, ready to execute.
 */
public record BoundCommand(@NotNull CommandPath path, @NotNull OptionValues options, @NotNull BoundParameters parameters) {
    
    public @NotNull Command command() {
        return path.command();
    }
    
    public void execute(ExecutionContext context) throws CommandFailure {
        path.command().action().execute(this, context);
    }
}
