package io.github.manjago.switchboard.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Switchboard CLI - inspect how command-line tokens are interpreted.
 * 
 * Usage:
 *   switchboard trace -r tree.conf -- build -j 4   - Show each pipeline stage
 *   switchboard run -r tree.conf -- build -j 4     - Dispatch with echoing commands
 *   switchboard tree -r tree.conf                  - Print the command tree
 *   switchboard info                               - Show version and defaults
 */
@Command(
    name = "switchboard",
    description = "Command-line token interpreter - routing, options, parameters",
    mixinStandardHelpOptions = true,
    version = "Switchboard " + SwitchboardCli.VERSION,
    subcommands = {
        TraceCommand.class,
        RunCommand.class,
        TreeCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class SwitchboardCli implements Runnable {
    
    static final String VERSION = "1.0.0";
    
    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }
    
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SwitchboardCli()).execute(args);
        System.exit(exitCode);
    }
}
