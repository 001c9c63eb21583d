package io.github.manjago.switchboard.param;

import io.github.manjago.switchboard.core.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy positional assignment in one pass.
 * 
 * Required slots take the first tokens, optional slots the next ones
 * (keeping their defaults when tokens run out), and the variadic slot,
 * if any, collects the rest. No backtracking, no reordering.
 */
public class DefaultParameterFiller implements ParameterFiller {
    
    private static final Logger log = LoggerFactory.getLogger(DefaultParameterFiller.class);
    
    @Override
    public BoundParameters fill(ParameterSignature signature, TokenStream stream) throws ParameterException {
        int required = signature.required().size();
        int optional = signature.optional().size();
        int given = stream.size();
        
        if (given < required) {
            throw ParameterException.notEnoughArguments(required, given);
        }
        if (signature.variadic() == null && given > required + optional) {
            throw ParameterException.tooManyArguments(required + optional, given);
        }
        
        Map<String, String> values = new LinkedHashMap<>();
        for (Parameter p : signature.required()) {
            values.put(p.name(), stream.pop());
        }
        for (Parameter p : signature.optional()) {
            values.put(p.name(), stream.isEmpty() ? p.defaultValue() : stream.pop());
        }
        
        List<String> collected = new ArrayList<>();
        Parameter variadic = signature.variadic();
        while (!stream.isEmpty()) {
            collected.add(stream.pop());
        }
        
        log.debug("Bound {} positional token(s) to {}", given, signature);
        return new BoundParameters(values, variadic != null ? variadic.name() : null, collected);
    }
}
