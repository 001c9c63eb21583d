package io.github.manjago.switchboard.option;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Option that takes exactly one value from the following token.
 * 
 * @param <T> type the raw value is converted to
 */
public final class KeyedOption<T> implements Option {
    
    private final List<String> names;
    private final String description;
    private final ValueType<T> type;
    
    public KeyedOption(String[] names, String description, ValueType<T> type) {
        this.names = Option.checkNames(names);
        this.description = description == null ? "" : description;
        this.type = type;
    }
    
    public static <T> KeyedOption<T> of(String shortName, String longName, ValueType<T> type, String description) {
        return new KeyedOption<>(new String[] {shortName, longName}, description, type);
    }
    
    public static KeyedOption<String> of(String shortName, String longName, String description) {
        return of(shortName, longName, ValueType.STRING, description);
    }
    
    @Override
    public @NotNull List<String> names() {
        return names;
    }
    
    @Override
    public @NotNull String description() {
        return description;
    }
    
    public @NotNull ValueType<T> type() {
        return type;
    }
    
    /**
     * Convert a raw token to this option's value type.
     * 
     * @throws OptionException if the token does not parse
     */
    T convert(String raw) throws OptionException {
        try {
            return type.parse(raw);
        } catch (IllegalArgumentException e) {
            throw OptionException.invalidValue(displayName(), type.name(), raw);
        }
    }
    
    @Override
    public String toString() {
        return "KeyedOption" + names + "<" + type.name() + ">";
    }
}
