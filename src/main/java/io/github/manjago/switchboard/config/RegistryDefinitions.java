package io.github.manjago.switchboard.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.switchboard.command.Command;
import io.github.manjago.switchboard.command.CommandAction;
import io.github.manjago.switchboard.command.CommandGroup;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.command.Routable;
import io.github.manjago.switchboard.core.ConfigurationException;
import io.github.manjago.switchboard.option.Flag;
import io.github.manjago.switchboard.option.KeyedOption;
import io.github.manjago.switchboard.option.Option;
import io.github.manjago.switchboard.option.OptionGroup;
import io.github.manjago.switchboard.option.ValueType;
import io.github.manjago.switchboard.param.Parameter;
import io.github.manjago.switchboard.param.ParameterSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a command tree from HOCON.
 * 
 * <pre>
 * registry {
 *   global-options = [ { names = ["-q", "--quiet"], description = "Less output" } ]
 *   commands = [
 *     {
 *       name = build
 *       description = "Builds the project"
 *       options = [ { names = ["-j", "--jobs"], type = int } ]
 *       option-groups = [ { restriction = at-most-one, options = ["--json", "--yaml"] } ]
 *       parameters = [ { name = target, kind = required },
 *                      { name = mode, kind = optional, default = debug } ]
 *     }
 *     { name = test, shared-options = [...], commands = [ ... ] }   # a group
 *   ]
 * }
 * </pre>
 * An entry with a {@code commands} list is a group. Option {@code type}
 * defaults to {@code flag}; other types are those of {@link ValueType}.
 * Option groups refer to the command's own options by spelling.
 */
public final class RegistryDefinitions {
    
    private static final Logger log = LoggerFactory.getLogger(RegistryDefinitions.class);
    
    private RegistryDefinitions() {}
    
    /**
     * Parse a definition file and add its commands to the builder.
     * 
     * @param action action given to every defined command
     * @throws ConfigurationException if the file is missing or malformed
     */
    public static CommandRegistry.Builder load(Path file, CommandRegistry.Builder builder, CommandAction action) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Registry definition not found: " + file);
        }
        log.info("Loading registry definition from {}", file);
        return apply(ConfigFactory.parseFile(file.toFile()).resolve(), builder, action);
    }
    
    /**
     * Add the commands under {@code registry} in the given config to the builder.
     */
    public static CommandRegistry.Builder apply(Config config, CommandRegistry.Builder builder, CommandAction action) {
        try {
            Config registry = config.getConfig("registry");
            if (registry.hasPath("global-options")) {
                builder.globalOptions(options(registry.getConfigList("global-options")));
            }
            builder.commands(routables(registry.getConfigList("commands"), action));
            return builder;
        } catch (ConfigException e) {
            throw new ConfigurationException("Malformed registry definition: " + e.getMessage(), e);
        }
    }
    
    // ========== Tree ==========
    
    private static List<Routable> routables(List<? extends Config> entries, CommandAction action) {
        List<Routable> routables = new ArrayList<>();
        for (Config entry : entries) {
            routables.add(entry.hasPath("commands") ? group(entry, action) : command(entry, action));
        }
        return routables;
    }
    
    private static CommandGroup group(Config c, CommandAction action) {
        CommandGroup.Builder builder = CommandGroup.builder(c.getString("name"))
                .description(optString(c, "description"))
                .children(routables(c.getConfigList("commands"), action));
        if (c.hasPath("shared-options")) {
            builder.sharedOptions(options(c.getConfigList("shared-options")));
        }
        return builder.build();
    }
    
    private static Command command(Config c, CommandAction action) {
        String name = c.getString("name");
        List<Option> options = c.hasPath("options") ? options(c.getConfigList("options")) : List.of();
        
        Command.Builder builder = Command.builder(name)
                .description(optString(c, "description"))
                .options(options)
                .action(action);
        
        if (c.hasPath("option-groups")) {
            for (Config g : c.getConfigList("option-groups")) {
                builder.optionGroup(optionGroup(name, g, options));
            }
        }
        if (c.hasPath("parameters")) {
            List<Parameter> parameters = new ArrayList<>();
            for (Config p : c.getConfigList("parameters")) {
                parameters.add(parameter(p));
            }
            builder.signature(new ParameterSignature(parameters));
        }
        return builder.build();
    }
    
    // ========== Options ==========
    
    private static List<Option> options(List<? extends Config> entries) {
        List<Option> options = new ArrayList<>();
        for (Config entry : entries) {
            options.add(option(entry));
        }
        return options;
    }
    
    private static Option option(Config c) {
        String[] names = c.getStringList("names").toArray(new String[0]);
        String description = optString(c, "description");
        String type = c.hasPath("type") ? c.getString("type") : "flag";
        if (type.equalsIgnoreCase("flag")) {
            return new Flag(names, description);
        }
        return keyed(names, description, ValueType.byName(type));
    }
    
    private static <T> KeyedOption<T> keyed(String[] names, String description, ValueType<T> type) {
        return new KeyedOption<>(names, description, type);
    }
    
    private static OptionGroup optionGroup(String command, Config c, List<Option> declared) {
        OptionGroup.Restriction restriction = enumValue(OptionGroup.Restriction.class, c.getString("restriction"));
        List<Option> members = new ArrayList<>();
        for (String spelling : c.getStringList("options")) {
            Option found = null;
            for (Option option : declared) {
                if (option.names().contains(spelling)) {
                    found = option;
                    break;
                }
            }
            if (found == null) {
                throw new ConfigurationException("Option group of '" + command
                        + "' names an undeclared option: " + spelling);
            }
            members.add(found);
        }
        return new OptionGroup(restriction, members);
    }
    
    // ========== Parameters ==========
    
    private static Parameter parameter(Config c) {
        String name = c.getString("name");
        Parameter.Kind kind = c.hasPath("kind")
                ? enumValue(Parameter.Kind.class, c.getString("kind"))
                : Parameter.Kind.REQUIRED;
        return switch (kind) {
            case REQUIRED -> Parameter.required(name);
            case OPTIONAL -> Parameter.optional(name, c.hasPath("default") ? c.getString("default") : null);
            case VARIADIC -> Parameter.variadic(name);
        };
    }
    
    // ========== Helpers ==========
    
    private static String optString(Config c, String path) {
        return c.hasPath(path) ? c.getString(path) : "";
    }
    
    /**
     * Accepts {@code at-most-one}, {@code at_most_one} and {@code AT_MOST_ONE}.
     */
    private static <E extends Enum<E>> E enumValue(Class<E> type, String raw) {
        String name = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + type.getSimpleName() + ": " + raw, e);
        }
    }
}
