package io.github.manjago.switchboard.core;

import io.github.manjago.switchboard.command.BoundCommand;
import io.github.manjago.switchboard.command.CommandPath;
import io.github.manjago.switchboard.option.OptionException;
import io.github.manjago.switchboard.param.ParameterException;
import io.github.manjago.switchboard.route.RouteResult;
import org.jetbrains.annotations.NotNull;

/**
 * The single outcome of interpreting one token list.
 * 
 * Either a command ready to run, a request to print usage and stop with
 * success, or a failure from one of the three stages.
 */
public sealed interface Interpretation permits Interpretation.Ready, Interpretation.UsageRequested,
        Interpretation.RouteFailed, Interpretation.OptionsMisused, Interpretation.ParametersRejected {
    
    int FAILURE_STATUS = 1;
    
    /**
     * @return exit status this outcome maps to before execution
     */
    int exitStatus();
    
    default boolean isFailure() {
        return exitStatus() != 0;
    }
    
    /** Everything bound; the command may run */
    record Ready(@NotNull BoundCommand command) implements Interpretation {
        @Override
        public int exitStatus() {
            return 0;
        }
    }
    
    /** Help flag given; print the usage of this command and stop */
    record UsageRequested(@NotNull CommandPath path) implements Interpretation {
        @Override
        public int exitStatus() {
            return 0;
        }
    }
    
    /** No command matched the tokens */
    record RouteFailed(@NotNull RouteResult.RoutingFailure failure) implements Interpretation {
        @Override
        public int exitStatus() {
            return FAILURE_STATUS;
        }
    }
    
    /** Option recognition failed */
    record OptionsMisused(@NotNull CommandPath path, @NotNull OptionException error) implements Interpretation {
        @Override
        public int exitStatus() {
            return FAILURE_STATUS;
        }
    }
    
    /** Positional tokens did not fit the signature */
    record ParametersRejected(@NotNull CommandPath path, @NotNull ParameterException error) implements Interpretation {
        @Override
        public int exitStatus() {
            return FAILURE_STATUS;
        }
    }
}
