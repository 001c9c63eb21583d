package io.github.manjago.switchboard.route;

import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.core.TokenStream;

/**
 * First pipeline stage: finds the command the leading tokens name.
 * 
 * Tokens naming groups and the command are consumed; the rest of the
 * stream is left untouched.
 */
public interface Router {
    
    RouteResult route(CommandRegistry registry, TokenStream stream);
}
