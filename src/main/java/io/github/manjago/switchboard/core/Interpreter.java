package io.github.manjago.switchboard.core;

import io.github.manjago.switchboard.command.BoundCommand;
import io.github.manjago.switchboard.command.CommandPath;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.option.DefaultOptionRecognizer;
import io.github.manjago.switchboard.option.Flag;
import io.github.manjago.switchboard.option.OptionException;
import io.github.manjago.switchboard.option.OptionRecognizer;
import io.github.manjago.switchboard.option.OptionValues;
import io.github.manjago.switchboard.param.BoundParameters;
import io.github.manjago.switchboard.param.DefaultParameterFiller;
import io.github.manjago.switchboard.param.ParameterException;
import io.github.manjago.switchboard.param.ParameterFiller;
import io.github.manjago.switchboard.route.DefaultRouter;
import io.github.manjago.switchboard.route.RouteResult;
import io.github.manjago.switchboard.route.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a token list into an {@link Interpretation}.
 * 
 * Pipeline, strictly in order and on one thread:
 * <ol>
 *   <li>stream manipulators (short-flag splitting)</li>
 *   <li>router: tokens to command path</li>
 *   <li>option recognizer: visible options consumed from the stream</li>
 *   <li>parameter filler: the rest bound to the signature</li>
 * </ol>
 * The first failing stage ends the pipeline. Each call works on its own
 * fresh {@link TokenStream}; the registry is only read.
 */
public class Interpreter {
    
    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);
    
    private final CommandRegistry registry;
    private final Router router;
    private final OptionRecognizer recognizer;
    private final ParameterFiller filler;
    
    public Interpreter(CommandRegistry registry) {
        this(registry, new DefaultRouter(), new DefaultOptionRecognizer(), new DefaultParameterFiller());
    }
    
    public Interpreter(CommandRegistry registry, Router router,
                       OptionRecognizer recognizer, ParameterFiller filler) {
        this.registry = registry;
        this.router = router;
        this.recognizer = recognizer;
        this.filler = filler;
    }
    
    public CommandRegistry getRegistry() {
        return registry;
    }
    
    public Router getRouter() {
        return router;
    }
    
    /**
     * Interpret command-line tokens (program name excluded).
     */
    public Interpretation interpret(List<String> tokens) {
        TokenStream stream = TokenStream.of(tokens);
        for (StreamManipulator manipulator : registry.manipulators()) {
            manipulator.manipulate(stream);
        }
        log.debug("Interpreting {}", stream);
        
        // Step 1: route
        RouteResult route = router.route(registry, stream);
        if (route instanceof RouteResult.RoutingFailure failure) {
            return new Interpretation.RouteFailed(failure);
        }
        CommandPath path = ((RouteResult.Resolved) route).path();
        
        // Step 2: recognize options
        OptionValues options;
        if (path.command().acceptsRawTokens()) {
            options = new OptionValues();
        } else {
            try {
                options = recognizer.recognize(path.optionRegistry(), stream);
            } catch (OptionException e) {
                log.debug("Option error for '{}': {}", path.invocation(), e.getMessage());
                return new Interpretation.OptionsMisused(path, e);
            }
            Flag helpFlag = registry.helpFlag();
            if (helpFlag != null && options.isSet(helpFlag)) {
                return new Interpretation.UsageRequested(path);
            }
        }
        
        // Step 3: fill parameters
        BoundParameters parameters;
        try {
            parameters = filler.fill(path.command().signature(), stream);
        } catch (ParameterException e) {
            log.debug("Parameter error for '{}': {}", path.invocation(), e.getMessage());
            return new Interpretation.ParametersRejected(path, e);
        }
        
        return new Interpretation.Ready(new BoundCommand(path, options, parameters));
    }
}
