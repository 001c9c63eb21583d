package io.github.manjago.switchboard.cli;

import io.github.manjago.switchboard.command.BoundCommand;
import io.github.manjago.switchboard.command.CommandAction;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.core.ConfigurationException;
import io.github.manjago.switchboard.core.Interpretation;
import io.github.manjago.switchboard.core.Interpreter;
import io.github.manjago.switchboard.core.StreamManipulator;
import io.github.manjago.switchboard.core.TokenStream;
import io.github.manjago.switchboard.route.RouteResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Interpret tokens against a registry and print each stage's outcome.
 * Nothing is executed.
 * 
 * Examples:
 *   switchboard trace -r tree.conf -- build -rj 4 app
 *   switchboard trace -r tree.conf -f settings.conf -- test bogus
 */
@Command(
    name = "trace",
    description = "Show how tokens are routed, recognized and bound",
    mixinStandardHelpOptions = true
)
public class TraceCommand extends RegistryCommand implements Callable<Integer> {
    
    @Parameters(arity = "0..*", paramLabel = "TOKEN", description = "Tokens to interpret (put them after --)")
    List<String> tokens = new ArrayList<>();
    
    @Override
    public Integer call() {
        CommandRegistry registry;
        try {
            registry = loadRegistry(CommandAction.NOOP);
        } catch (ConfigurationException e) {
            err().println("Invalid registry: " + e.getMessage());
            return 2;
        }
        
        PrintWriter out = out();
        out.printf("Tokens:        %s%n", tokens);
        
        TokenStream preview = TokenStream.of(tokens);
        for (StreamManipulator manipulator : registry.manipulators()) {
            manipulator.manipulate(preview);
        }
        out.printf("Manipulated:   %s%n", preview.tokens());
        
        Interpretation result = new Interpreter(registry).interpret(tokens);
        print(out, result);
        out.printf("Exit status:   %d%n", result.exitStatus());
        return result.exitStatus();
    }
    
    private static void print(PrintWriter out, Interpretation result) {
        if (result instanceof Interpretation.Ready ready) {
            BoundCommand bound = ready.command();
            out.printf("Routed:        %s%n", bound.path().invocation());
            out.printf("Options:       %s%n", bound.options());
            out.printf("Parameters:    %s%n", bound.parameters());
            out.println("Outcome:       ready");
        } else if (result instanceof Interpretation.UsageRequested usage) {
            out.printf("Routed:        %s%n", usage.path().invocation());
            out.println("Outcome:       usage requested");
        } else if (result instanceof Interpretation.RouteFailed failed) {
            RouteResult.RoutingFailure failure = failed.failure();
            out.printf("Partial path:  %s%n", failure.partialPath().names());
            out.printf("Unmatched:     %s%n",
                    failure.unmatchedToken() != null ? failure.unmatchedToken() : "(none, subcommand required)");
            out.println("Outcome:       routing failure");
        } else if (result instanceof Interpretation.OptionsMisused misused) {
            out.printf("Routed:        %s%n", misused.path().invocation());
            out.printf("Outcome:       option error %s: %s%n",
                    misused.error().getKind(), misused.error().getMessage());
        } else if (result instanceof Interpretation.ParametersRejected rejected) {
            out.printf("Routed:        %s%n", rejected.path().invocation());
            out.printf("Outcome:       parameter error %s: %s%n",
                    rejected.error().getKind(), rejected.error().getMessage());
        }
    }
}
