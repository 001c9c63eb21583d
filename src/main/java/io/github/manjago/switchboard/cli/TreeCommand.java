package io.github.manjago.switchboard.cli;

import io.github.manjago.switchboard.command.Command;
import io.github.manjago.switchboard.command.CommandAction;
import io.github.manjago.switchboard.command.CommandGroup;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.command.Routable;
import io.github.manjago.switchboard.core.ConfigurationException;
import io.github.manjago.switchboard.option.Option;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Print the command tree of a registry definition.
 */
@picocli.CommandLine.Command(
    name = "tree",
    description = "Print the command tree with options and aliases",
    mixinStandardHelpOptions = true
)
public class TreeCommand extends RegistryCommand implements Callable<Integer> {
    
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
        out.println(registry.name() + options(registry.root().sharedOptions()));
        print(out, registry.root(), "  ");
        
        if (!registry.aliases().isEmpty()) {
            out.println();
            out.println("Aliases:");
            for (Map.Entry<String, String> alias : registry.aliases().asMap().entrySet()) {
                out.printf("  %s -> %s%n", alias.getKey(), alias.getValue());
            }
        }
        return 0;
    }
    
    private static void print(PrintWriter out, CommandGroup group, String indent) {
        for (Routable child : group.children()) {
            if (child instanceof CommandGroup sub) {
                out.println(indent + sub.name() + "/" + options(sub.sharedOptions()));
                print(out, sub, indent + "  ");
            } else if (child instanceof Command command) {
                String signature = command.signature().usage();
                out.println(indent + command.name()
                        + (signature.isEmpty() ? "" : " " + signature)
                        + options(command.options()));
            }
        }
    }
    
    private static String options(List<Option> options) {
        if (options.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("  [");
        for (int i = 0; i < options.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(options.get(i).displayName());
        }
        return sb.append(']').toString();
    }
}
