package io.github.manjago.switchboard.command;

/**
 * What a command does once its options and parameters are bound.
 * 
 * Runs outside the interpretation pipeline and may block for as long as
 * it needs.
 */
@FunctionalInterface
public interface CommandAction {
    
    /**
     * @param command the bound invocation
     * @param context registry, renderer and output streams of this run
     * @throws CommandFailure to stop with a message and exit status
     */
    void execute(BoundCommand command, ExecutionContext context) throws CommandFailure;
    
    /**
     * Action that does nothing.
     */
    CommandAction NOOP = (command, context) -> {};
}
