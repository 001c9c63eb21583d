package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.core.ConfigurationException;
import io.github.manjago.switchboard.core.ShortFlagSplitter;
import io.github.manjago.switchboard.core.StreamManipulator;
import io.github.manjago.switchboard.option.Flag;
import io.github.manjago.switchboard.option.KeyedOption;
import io.github.manjago.switchboard.option.Option;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The complete command tree of one program, with its alias table, global
 * options and built-ins.
 * 
 * Built once and read-only afterwards. Every command's visible option
 * set is validated while building, so configuration mistakes surface at
 * startup instead of on first use.
 */
public final class CommandRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);
    
    private final CommandGroup root;
    private final String version;
    private final AliasTable aliases;
    private final Flag helpFlag;
    private final Command helpCommand;
    private final Command versionCommand;
    private final List<StreamManipulator> manipulators;
    
    private CommandRegistry(Builder b) {
        this.version = b.version;
        this.aliases = b.aliases;
        this.helpFlag = b.helpFlag ? BuiltinCommands.helpFlag() : null;
        this.helpCommand = b.helpCommand ? BuiltinCommands.help() : null;
        this.versionCommand = b.version != null ? BuiltinCommands.version(b.version) : null;
        
        CommandGroup.Builder rootBuilder = CommandGroup.builder(b.name)
                .description(b.description)
                .children(b.commands)
                .sharedOptions(b.globalOptions);
        if (helpCommand != null) {
            rootBuilder.child(helpCommand);
        }
        if (versionCommand != null) {
            rootBuilder.child(versionCommand);
        }
        if (helpFlag != null) {
            rootBuilder.sharedOption(helpFlag);
        }
        this.root = rootBuilder.build();
        
        int commands = validate(GroupPath.of(root), root);
        
        List<StreamManipulator> passes = new ArrayList<>();
        if (b.splitShortFlags) {
            passes.add(new ShortFlagSplitter(valueSpellings(root)));
        }
        passes.addAll(b.manipulators);
        this.manipulators = List.copyOf(passes);
        
        log.info("Command registry '{}' built: {} commands, {} aliases", root.name(), commands, aliases.asMap().size());
    }
    
    public static Builder builder(String name) {
        return new Builder(name);
    }
    
    // ========== Accessors ==========
    
    public @NotNull CommandGroup root() {
        return root;
    }
    
    public @NotNull String name() {
        return root.name();
    }
    
    public @NotNull String description() {
        return root.description();
    }
    
    public @Nullable String version() {
        return version;
    }
    
    public @NotNull AliasTable aliases() {
        return aliases;
    }
    
    /**
     * @return the built-in help flag, or null if disabled
     */
    public @Nullable Flag helpFlag() {
        return helpFlag;
    }
    
    public @Nullable Command helpCommand() {
        return helpCommand;
    }
    
    public @Nullable Command versionCommand() {
        return versionCommand;
    }
    
    /**
     * @return stream passes, in the order they run
     */
    public @NotNull List<StreamManipulator> manipulators() {
        return manipulators;
    }
    
    // ========== Validation ==========
    
    /**
     * Build every command's option registry once; duplicates throw.
     * 
     * @return number of commands in the subtree
     */
    private static int validate(GroupPath path, CommandGroup group) {
        int count = 0;
        for (Routable child : group.children()) {
            if (child instanceof CommandGroup sub) {
                count += validate(path.append(sub), sub);
            } else if (child instanceof Command command) {
                try {
                    path.resolve(command).optionRegistry();
                } catch (ConfigurationException e) {
                    throw new ConfigurationException("Command '" + path.resolve(command).invocation()
                            + "': " + e.getMessage(), e);
                }
                count++;
            }
        }
        return count;
    }
    
    /**
     * Spellings that always take a value. A spelling declared as a flag
     * anywhere in the tree is left out, since a sibling may read it as a flag.
     */
    private static Set<String> valueSpellings(CommandGroup root) {
        Set<String> keyed = new LinkedHashSet<>();
        Set<String> flags = new LinkedHashSet<>();
        collectSpellings(root, keyed, flags);
        keyed.removeAll(flags);
        return keyed;
    }
    
    private static void collectSpellings(CommandGroup group, Set<String> keyed, Set<String> flags) {
        collectSpellings(group.sharedOptions(), keyed, flags);
        for (Routable child : group.children()) {
            if (child instanceof CommandGroup sub) {
                collectSpellings(sub, keyed, flags);
            } else if (child instanceof Command command) {
                collectSpellings(command.options(), keyed, flags);
            }
        }
    }
    
    private static void collectSpellings(List<Option> options, Set<String> keyed, Set<String> flags) {
        for (Option option : options) {
            if (option instanceof KeyedOption<?>) {
                keyed.addAll(option.names());
            } else {
                flags.addAll(option.names());
            }
        }
    }
    
    // ========== Builder ==========
    
    public static class Builder {
        private final String name;
        private String description = "";
        private String version = null;
        private final List<Routable> commands = new ArrayList<>();
        private final List<Option> globalOptions = new ArrayList<>();
        private AliasTable aliases = AliasTable.DEFAULTS;
        private boolean helpCommand = true;
        private boolean helpFlag = true;
        private boolean splitShortFlags = true;
        private final List<StreamManipulator> manipulators = new ArrayList<>();
        
        private Builder(String name) {
            this.name = name;
        }
        
        public Builder description(String description) { this.description = description == null ? "" : description; return this; }
        
        /**
         * @param version version string; null or empty disables the version command
         */
        public Builder version(String version) { this.version = version == null || version.isEmpty() ? null : version; return this; }
        public Builder command(Routable command) { this.commands.add(command); return this; }
        public Builder commands(List<? extends Routable> commands) { this.commands.addAll(commands); return this; }
        public Builder globalOption(Option option) { this.globalOptions.add(option); return this; }
        public Builder globalOptions(List<? extends Option> options) { this.globalOptions.addAll(options); return this; }
        public Builder aliases(AliasTable aliases) { this.aliases = aliases; return this; }
        public Builder aliases(Map<String, String> aliases) { this.aliases = new AliasTable(aliases); return this; }
        public Builder alias(String alias, String target) { this.aliases = aliases.with(alias, target); return this; }
        public Builder helpCommand(boolean enabled) { this.helpCommand = enabled; return this; }
        public Builder helpFlag(boolean enabled) { this.helpFlag = enabled; return this; }
        public Builder splitShortFlags(boolean enabled) { this.splitShortFlags = enabled; return this; }
        
        /**
         * Add a stream pass that runs after the built-in short-flag splitter.
         */
        public Builder manipulator(StreamManipulator manipulator) { this.manipulators.add(manipulator); return this; }
        
        /**
         * @throws ConfigurationException if the tree is invalid
         */
        public CommandRegistry build() {
            return new CommandRegistry(this);
        }
    }
}
