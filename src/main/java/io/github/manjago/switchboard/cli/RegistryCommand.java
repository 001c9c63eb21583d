package io.github.manjago.switchboard.cli;

import io.github.manjago.switchboard.command.CommandAction;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.config.RegistryDefinitions;
import io.github.manjago.switchboard.config.SwitchboardSettings;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.nio.file.Path;

/**
 * Base for subcommands that work on a registry definition file.
 */
abstract class RegistryCommand {
    
    @Spec
    CommandSpec spec;
    
    @Option(names = {"-r", "--registry"}, required = true, description = "Registry definition (HOCON)")
    Path registryFile;
    
    @Option(names = {"-f", "--settings"}, description = "Settings file (HOCON), overrides reference.conf")
    Path settingsFile;
    
    SwitchboardSettings settings() {
        return settingsFile != null ? SwitchboardSettings.fromFile(settingsFile) : SwitchboardSettings.defaults();
    }
    
    CommandRegistry loadRegistry(CommandAction action) {
        return RegistryDefinitions.load(registryFile, settings().newRegistry(), action).build();
    }
    
    PrintWriter out() {
        return spec.commandLine().getOut();
    }
    
    PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
