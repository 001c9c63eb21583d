package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.core.TokenStream;
import io.github.manjago.switchboard.option.Flag;
import io.github.manjago.switchboard.param.ParameterSignature;
import io.github.manjago.switchboard.route.RouteResult;

import java.util.List;

/**
 * Factories for the built-in {@code help} and {@code version} commands and
 * the {@code -h/--help} flag.
 */
public final class BuiltinCommands {
    
    public static final String HELP = "help";
    public static final String VERSION = "version";
    
    private BuiltinCommands() {}
    
    /**
     * {@code help [command ...]}: lists the commands of a group, or prints
     * the usage of the command the arguments route to.
     */
    public static Command help() {
        return Command.builder(HELP)
                .description("Prints help information")
                .signature(ParameterSignature.builder().variadic("command").build())
                .rawTokens(true)
                .action(BuiltinCommands::showHelp)
                .build();
    }
    
    /**
     * {@code version}: prints the configured version.
     */
    public static Command version(String version) {
        return Command.builder(VERSION)
                .description("Prints the current version of this app")
                .action((command, context) -> context.out().println("Version: " + version))
                .build();
    }
    
    public static Flag helpFlag() {
        return Flag.of("-h", "--help", "Show help information for this command");
    }
    
    private static void showHelp(BoundCommand command, ExecutionContext context) throws CommandFailure {
        List<String> target = command.parameters().getAll("command");
        RouteResult result = context.router().route(context.registry(), TokenStream.of(target));
        
        if (result instanceof RouteResult.Resolved resolved) {
            context.out().println(context.renderer().renderUsage(resolved.path()));
        } else if (result instanceof RouteResult.RoutingFailure failure) {
            context.out().println(context.renderer().renderCommandList(failure.partialPath()));
            if (failure.unmatchedToken() != null) {
                throw new CommandFailure("Command \"" + failure.unmatchedToken() + "\" not found");
            }
        }
    }
}
