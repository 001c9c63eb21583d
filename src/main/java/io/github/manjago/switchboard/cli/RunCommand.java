package io.github.manjago.switchboard.cli;

import io.github.manjago.switchboard.command.BoundCommand;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.command.ExecutionContext;
import io.github.manjago.switchboard.core.ConfigurationException;
import io.github.manjago.switchboard.core.Dispatcher;
import io.github.manjago.switchboard.core.Interpreter;
import io.github.manjago.switchboard.help.PlainHelpRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Dispatch tokens against a registry, as the defined program would.
 * 
 * Every defined command echoes what it was bound to; built-in help and
 * version behave normally. Exits with the dispatcher's status.
 * 
 * Examples:
 *   switchboard run -r tree.conf -- build --jobs 4 app
 *   switchboard run -r tree.conf -- help test
 */
@Command(
    name = "run",
    description = "Dispatch tokens with echoing commands",
    mixinStandardHelpOptions = true
)
public class RunCommand extends RegistryCommand implements Callable<Integer> {
    
    @Parameters(arity = "0..*", paramLabel = "TOKEN", description = "Tokens to dispatch (put them after --)")
    List<String> tokens = new ArrayList<>();
    
    @Override
    public Integer call() {
        CommandRegistry registry;
        try {
            registry = loadRegistry(RunCommand::echo);
        } catch (ConfigurationException e) {
            err().println("Invalid registry: " + e.getMessage());
            return 2;
        }
        
        // Dispatcher writes to streams; collect them and forward to picocli's writers
        ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        Dispatcher dispatcher = new Dispatcher(new Interpreter(registry), new PlainHelpRenderer(),
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
        int status = dispatcher.dispatch(tokens);
        
        forward(outBytes, out());
        forward(errBytes, err());
        return status;
    }
    
    private static void forward(ByteArrayOutputStream bytes, PrintWriter writer) {
        writer.print(bytes.toString(StandardCharsets.UTF_8));
        writer.flush();
    }
    
    static void echo(BoundCommand command, ExecutionContext context) {
        context.out().println("Running: " + command.path().invocation());
        for (Map.Entry<String, Object> entry : command.options().asMap().entrySet()) {
            context.out().printf("  option    %-16s %s%n", entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, String> entry : command.parameters().values().entrySet()) {
            context.out().printf("  parameter %-16s %s%n", entry.getKey(), entry.getValue());
        }
        if (command.command().signature().variadic() != null) {
            context.out().printf("  parameter %-16s %s%n",
                    command.command().signature().variadic().name(), command.parameters().variadic());
        }
    }
}
