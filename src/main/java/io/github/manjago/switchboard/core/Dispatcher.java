package io.github.manjago.switchboard.core;

import io.github.manjago.switchboard.command.CommandFailure;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.command.ExecutionContext;
import io.github.manjago.switchboard.help.HelpRenderer;
import io.github.manjago.switchboard.help.PlainHelpRenderer;
import io.github.manjago.switchboard.route.RouteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Runs one invocation end to end and maps the outcome to an exit status.
 * 
 * Interprets the tokens, prints usage or errors through the
 * {@link HelpRenderer}, and executes a ready command.
 */
public class Dispatcher {
    
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    
    private final Interpreter interpreter;
    private final HelpRenderer renderer;
    private final PrintStream out;
    private final PrintStream err;
    
    public Dispatcher(CommandRegistry registry) {
        this(new Interpreter(registry), new PlainHelpRenderer(), System.out, System.err);
    }
    
    public Dispatcher(Interpreter interpreter, HelpRenderer renderer, PrintStream out, PrintStream err) {
        this.interpreter = interpreter;
        this.renderer = renderer;
        this.out = out;
        this.err = err;
    }
    
    public int dispatch(String... args) {
        return dispatch(Arrays.asList(args));
    }
    
    /**
     * @param args command-line tokens, program name excluded
     * @return process exit status
     */
    public int dispatch(List<String> args) {
        Interpretation result = interpreter.interpret(args);
        
        if (result instanceof Interpretation.Ready ready) {
            return execute(ready);
        } else if (result instanceof Interpretation.UsageRequested usage) {
            out.println(renderer.renderUsage(usage.path()));
        } else if (result instanceof Interpretation.RouteFailed failed) {
            RouteResult.RoutingFailure failure = failed.failure();
            if (failure.unmatchedToken() != null) {
                err.println("\nCommand \"" + failure.unmatchedToken() + "\" not found");
            }
            out.println(renderer.renderCommandList(failure.partialPath()));
        } else if (result instanceof Interpretation.OptionsMisused misused) {
            err.println(renderer.renderMisusedOptions(misused.path(), misused.error()));
        } else if (result instanceof Interpretation.ParametersRejected rejected) {
            err.println(rejected.error().getMessage());
            err.println("Usage: " + rejected.path().usage());
        }
        return result.exitStatus();
    }
    
    private int execute(Interpretation.Ready ready) {
        ExecutionContext context = new ExecutionContext(
                interpreter.getRegistry(), interpreter.getRouter(), renderer, out, err);
        try {
            ready.command().execute(context);
            return 0;
        } catch (CommandFailure e) {
            if (e.getMessage() != null) {
                err.println(e.getMessage());
            }
            return e.getExitStatus();
        } catch (RuntimeException e) {
            log.debug("Command '{}' failed", ready.command().path().invocation(), e);
            err.println("An error occurred: " + e.getMessage());
            return Interpretation.FAILURE_STATUS;
        }
    }
}
