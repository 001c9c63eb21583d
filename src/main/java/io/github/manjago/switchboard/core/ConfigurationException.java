package io.github.manjago.switchboard.core;

/**
 * Thrown when the integrator assembles an invalid registry.
 * 
 * Raised at build time, before any token is read: duplicate option
 * spellings, malformed parameter signatures, alias chains and the like.
 * Never shown to the end user as a usage error.
 */
public class ConfigurationException extends RuntimeException {
    
    public ConfigurationException(String message) {
        super(message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
