package io.github.manjago.switchboard.core;

/**
 * Syntactic rewrite pass applied to the token stream before routing.
 * 
 * Implementations must be deterministic and idempotent: running a
 * manipulator twice leaves the stream as it was after the first run.
 * Manipulators run in registration order.
 */
@FunctionalInterface
public interface StreamManipulator {
    
    /**
     * Rewrite the stream in place.
     * 
     * @param stream tokens of the current invocation
     */
    void manipulate(TokenStream stream);
}
