package io.github.manjago.switchboard.param;

import io.github.manjago.switchboard.core.TokenStream;

/**
 * Third pipeline stage: binds the remaining positional tokens.
 */
public interface ParameterFiller {
    
    /**
     * @param signature slots of the routed command
     * @param stream tokens left after option recognition; consumed by this call
     * @throws ParameterException if the token count does not fit
     */
    BoundParameters fill(ParameterSignature signature, TokenStream stream) throws ParameterException;
}
