package io.github.manjago.switchboard.param;

import io.github.manjago.switchboard.core.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One positional slot of a {@link ParameterSignature}.
 * 
 * @param name slot name, unique within the signature
 * @param kind required, optional or variadic
 * @param defaultValue value bound when an optional slot gets no token;
 *                     always null for other kinds
 */
public record Parameter(@NotNull String name, @NotNull Kind kind, @Nullable String defaultValue) {
    
    public enum Kind {
        REQUIRED,
        OPTIONAL,
        VARIADIC
    }
    
    public Parameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.OPTIONAL && defaultValue != null) {
            throw new ConfigurationException("Only optional parameters carry a default: " + name);
        }
    }
    
    public static Parameter required(String name) {
        return new Parameter(name, Kind.REQUIRED, null);
    }
    
    /**
     * @param defaultValue may be null, meaning "no value"
     */
    public static Parameter optional(String name, @Nullable String defaultValue) {
        return new Parameter(name, Kind.OPTIONAL, defaultValue);
    }
    
    public static Parameter variadic(String name) {
        return new Parameter(name, Kind.VARIADIC, null);
    }
    
    /**
     * Usage form: {@code <name>}, {@code [<name>]} or {@code [<name>] ...}.
     */
    public String usage() {
        return switch (kind) {
            case REQUIRED -> "<" + name + ">";
            case OPTIONAL -> "[<" + name + ">]";
            case VARIADIC -> "[<" + name + ">] ...";
        };
    }
}
