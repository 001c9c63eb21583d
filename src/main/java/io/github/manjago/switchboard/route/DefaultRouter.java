package io.github.manjago.switchboard.route;

import io.github.manjago.switchboard.command.Command;
import io.github.manjago.switchboard.command.CommandGroup;
import io.github.manjago.switchboard.command.CommandRegistry;
import io.github.manjago.switchboard.command.GroupPath;
import io.github.manjago.switchboard.command.Routable;
import io.github.manjago.switchboard.core.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the command tree one token at a time.
 * 
 * Each token is passed once through the alias table and then matched
 * exactly against the current group's children. No prefix matching and
 * no backtracking.
 */
public class DefaultRouter implements Router {
    
    private static final Logger log = LoggerFactory.getLogger(DefaultRouter.class);
    
    @Override
    public RouteResult route(CommandRegistry registry, TokenStream stream) {
        GroupPath path = GroupPath.of(registry.root());
        
        while (true) {
            String token = stream.peek();
            if (token == null) {
                log.debug("Tokens exhausted at {}", path);
                return new RouteResult.RoutingFailure(path, null);
            }
            
            String name = registry.aliases().resolve(token);
            Routable match = path.bottom().child(name);
            if (match == null) {
                log.debug("No child '{}' in {}", name, path);
                return new RouteResult.RoutingFailure(path, token);
            }
            stream.pop();
            
            if (match instanceof CommandGroup group) {
                path = path.append(group);
            } else if (match instanceof Command command) {
                log.debug("Routed to '{}'", path.resolve(command).invocation());
                return new RouteResult.Resolved(path.resolve(command));
            }
        }
    }
}
