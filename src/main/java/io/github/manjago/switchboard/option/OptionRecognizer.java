package io.github.manjago.switchboard.option;

import io.github.manjago.switchboard.core.TokenStream;

/**
 * Second pipeline stage: extracts options from the token stream.
 * 
 * Recognized tokens (and consumed values) are removed from the stream;
 * everything else stays, in order, for parameter filling.
 */
public interface OptionRecognizer {
    
    /**
     * @param registry options visible to the routed command
     * @param stream tokens left after routing
     * @return values of the options that were given
     * @throws OptionException on the first misuse found
     */
    OptionValues recognize(OptionRegistry registry, TokenStream stream) throws OptionException;
}
