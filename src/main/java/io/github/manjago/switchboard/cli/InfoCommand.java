package io.github.manjago.switchboard.cli;

import io.github.manjago.switchboard.config.SwitchboardSettings;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about Switchboard.
 */
@Command(
    name = "info",
    description = "Show version and default settings",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {
    
    @Override
    public Integer call() {
        System.out.println();
        System.out.println("Switchboard " + SwitchboardCli.VERSION);
        System.out.println("Command-line token interpreter");
        System.out.println();
        System.out.println("Pipeline: manipulators -> router -> option recognizer -> parameter filler");
        System.out.println();
        
        System.out.println("Default Settings:");
        System.out.println(SwitchboardSettings.defaults());
        
        return 0;
    }
}
