package io.github.manjago.switchboard.help;

import io.github.manjago.switchboard.command.CommandPath;
import io.github.manjago.switchboard.command.GroupPath;
import io.github.manjago.switchboard.option.OptionException;

/**
 * Turns pipeline results into text for the user.
 * 
 * The pipeline itself never formats messages; it hands structured values
 * to a renderer.
 */
public interface HelpRenderer {
    
    /**
     * Children of the deepest group in {@code path}.
     */
    String renderCommandList(GroupPath path);
    
    /**
     * Usage statement of a routed command.
     */
    String renderUsage(CommandPath path);
    
    /**
     * Usage statement followed by what went wrong with the options.
     */
    String renderMisusedOptions(CommandPath path, OptionException error);
}
