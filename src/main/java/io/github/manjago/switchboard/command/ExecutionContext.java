package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.help.HelpRenderer;
import io.github.manjago.switchboard.route.Router;

import java.io.PrintStream;

/**
 * Collaborators available to a running {@link CommandAction}.
 */
public record ExecutionContext(CommandRegistry registry, Router router, HelpRenderer renderer,
                               PrintStream out, PrintStream err) {
}
