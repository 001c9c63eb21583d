package io.github.manjago.switchboard.option;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Boolean option: present or absent, takes no value.
 */
public final class Flag implements Option {
    
    private final List<String> names;
    private final String description;
    
    public Flag(String... names) {
        this(names, "");
    }
    
    public Flag(String[] names, String description) {
        this.names = Option.checkNames(names);
        this.description = description == null ? "" : description;
    }
    
    /**
     * Flag with a short and a long spelling.
     */
    public static Flag of(String shortName, String longName, String description) {
        return new Flag(new String[] {shortName, longName}, description);
    }
    
    @Override
    public @NotNull List<String> names() {
        return names;
    }
    
    @Override
    public @NotNull String description() {
        return description;
    }
    
    @Override
    public String toString() {
        return "Flag" + names;
    }
}
