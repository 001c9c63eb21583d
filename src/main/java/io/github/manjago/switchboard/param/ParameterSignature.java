package io.github.manjago.switchboard.param;

import io.github.manjago.switchboard.core.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered positional slots of a command: required, then optional, then at
 * most one variadic slot, which must be last.
 * 
 * The ordering is checked on construction; a malformed signature is a
 * {@link ConfigurationException} and is never reordered.
 */
public final class ParameterSignature {
    
    /** Signature with no slots */
    public static final ParameterSignature EMPTY = new ParameterSignature(List.of());
    
    private final List<Parameter> parameters;
    private final int requiredCount;
    private final int optionalCount;
    private final Parameter variadic;
    
    public ParameterSignature(List<Parameter> parameters) {
        this.parameters = List.copyOf(parameters);
        
        int required = 0;
        int optional = 0;
        Parameter collector = null;
        Set<String> names = new HashSet<>();
        
        for (Parameter p : this.parameters) {
            if (!names.add(p.name())) {
                throw new ConfigurationException("Duplicate parameter name: " + p.name());
            }
            if (collector != null) {
                throw new ConfigurationException("Parameter '" + p.name()
                        + "' follows variadic parameter '" + collector.name() + "'");
            }
            switch (p.kind()) {
                case REQUIRED -> {
                    if (optional > 0) {
                        throw new ConfigurationException("Required parameter '" + p.name()
                                + "' follows an optional parameter");
                    }
                    required++;
                }
                case OPTIONAL -> optional++;
                case VARIADIC -> collector = p;
            }
        }
        
        this.requiredCount = required;
        this.optionalCount = optional;
        this.variadic = collector;
    }
    
    public static ParameterSignature of(Parameter... parameters) {
        return new ParameterSignature(List.of(parameters));
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public @NotNull List<Parameter> parameters() {
        return parameters;
    }
    
    public @NotNull List<Parameter> required() {
        return parameters.subList(0, requiredCount);
    }
    
    public @NotNull List<Parameter> optional() {
        return parameters.subList(requiredCount, requiredCount + optionalCount);
    }
    
    public @Nullable Parameter variadic() {
        return variadic;
    }
    
    public boolean isEmpty() {
        return parameters.isEmpty();
    }
    
    /**
     * Usage line fragment, e.g. {@code <name> [<greeting>]}.
     */
    public String usage() {
        StringBuilder sb = new StringBuilder();
        for (Parameter p : parameters) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(p.usage());
        }
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return "ParameterSignature(" + usage() + ")";
    }
    
    public static class Builder {
        private final List<Parameter> parameters = new ArrayList<>();
        
        public Builder required(String name) { parameters.add(Parameter.required(name)); return this; }
        public Builder optional(String name, String defaultValue) { parameters.add(Parameter.optional(name, defaultValue)); return this; }
        public Builder variadic(String name) { parameters.add(Parameter.variadic(name)); return this; }
        
        public ParameterSignature build() {
            return new ParameterSignature(parameters);
        }
    }
}
