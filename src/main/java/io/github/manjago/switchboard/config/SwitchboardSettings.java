package io.github.manjago.switchboard.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.core.ConfigurationException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Program-level settings for a command registry.
 * 
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record SwitchboardSettings(
    // Identity
    String name,
    String version,           // empty = no version command
    String description,
    
    // Built-ins
    boolean helpCommand,
    boolean helpFlag,
    
    // Routing
    Map<String, String> aliases,
    
    // Stream manipulation
    boolean splitShortFlags
) {
    
    public SwitchboardSettings {
        aliases = Map.copyOf(aliases);
    }
    
    /**
     * Load default configuration.
     */
    public static SwitchboardSettings defaults() {
        return fromConfig(ConfigFactory.load());
    }
    
    /**
     * Load configuration from a specific file.
     * 
     * @throws ConfigurationException if the file cannot be parsed or holds wrong types
     */
    public static SwitchboardSettings fromFile(Path configFile) {
        Config merged;
        try {
            Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
            merged = fileConfig.withFallback(ConfigFactory.load()).resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("Malformed settings file " + configFile + ": " + e.getMessage(), e);
        }
        return fromConfig(merged);
    }
    
    /**
     * Load from Config object.
     * 
     * @throws ConfigurationException if a setting is missing or has the wrong type
     */
    public static SwitchboardSettings fromConfig(Config config) {
        try {
            return read(config.getConfig("switchboard"));
        } catch (ConfigException e) {
            throw new ConfigurationException("Malformed settings: " + e.getMessage(), e);
        }
    }
    
    private static SwitchboardSettings read(Config c) {
        // Alias keys such as "-h" are not valid path segments, so read the object directly
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : c.getObject("aliases").entrySet()) {
            aliases.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
        }
        
        return new SwitchboardSettings(
            c.getString("name"),
            c.getString("version"),
            c.getString("description"),
            c.getBoolean("help.command"),
            c.getBoolean("help.flag"),
            aliases,
            c.getBoolean("stream.split-short-flags")
        );
    }
    
    /**
     * Registry builder preset from these settings.
     */
    public CommandRegistry.Builder newRegistry() {
        return CommandRegistry.builder(name)
                .description(description)
                .version(version)
                .helpCommand(helpCommand)
                .helpFlag(helpFlag)
                .aliases(aliases)
                .splitShortFlags(splitShortFlags);
    }
    
    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String name = "switchboard";
        private String version = "";
        private String description = "";
        private boolean helpCommand = true;
        private boolean helpFlag = true;
        private Map<String, String> aliases = new LinkedHashMap<>(Map.of("-h", "help", "-v", "version"));
        private boolean splitShortFlags = true;
        
        public Builder name(String name) { this.name = name; return this; }
        public Builder version(String version) { this.version = version; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder helpCommand(boolean enabled) { this.helpCommand = enabled; return this; }
        public Builder helpFlag(boolean enabled) { this.helpFlag = enabled; return this; }
        public Builder aliases(Map<String, String> aliases) { this.aliases = new LinkedHashMap<>(aliases); return this; }
        public Builder alias(String alias, String target) { this.aliases.put(alias, target); return this; }
        public Builder splitShortFlags(boolean enabled) { this.splitShortFlags = enabled; return this; }
        
        public SwitchboardSettings build() {
            return new SwitchboardSettings(
                name, version, description, helpCommand, helpFlag, aliases, splitShortFlags
            );
        }
    }
    
    @Override
    public String toString() {
        return String.format("""
            SwitchboardSettings:
              name:                      %s
              version:                   %s
              description:               %s
              help.command:              %s
              help.flag:                 %s
              aliases:                   %s
              stream.split-short-flags:  %s
            """,
            name,
            version.isEmpty() ? "(none)" : version,
            description.isEmpty() ? "(none)" : description,
            helpCommand,
            helpFlag,
            aliases.isEmpty() ? "(none)" : aliases,
            splitShortFlags
        );
    }
}
