package io.github.manjago.switchboard.option;

import io.github.manjago.switchboard.core.ConfigurationException;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Named conversion from a raw token to a typed option value.
 * 
 * Conversion signals failure with {@link IllegalArgumentException}
 * (which covers {@link NumberFormatException} and invalid paths).
 * 
 * @param <T> converted type
 */
public final class ValueType<T> {
    
    public static final ValueType<String> STRING = new ValueType<>("string", Function.identity());
    public static final ValueType<Integer> INT = new ValueType<>("int", Integer::parseInt);
    public static final ValueType<Long> LONG = new ValueType<>("long", Long::parseLong);
    public static final ValueType<Double> DOUBLE = new ValueType<>("double", ValueType::parseDouble);
    public static final ValueType<Boolean> BOOL = new ValueType<>("bool", ValueType::parseBool);
    public static final ValueType<Path> PATH = new ValueType<>("path", Path::of);
    
    private static final Map<String, ValueType<?>> BY_NAME = Map.of(
        STRING.name, STRING,
        INT.name, INT,
        LONG.name, LONG,
        DOUBLE.name, DOUBLE,
        BOOL.name, BOOL,
        PATH.name, PATH
    );
    
    private final String name;
    private final Function<String, T> parser;
    
    public ValueType(String name, Function<String, T> parser) {
        this.name = name;
        this.parser = parser;
    }
    
    public @NotNull String name() {
        return name;
    }
    
    /**
     * @throws IllegalArgumentException if raw is not a valid value of this type
     */
    public T parse(String raw) {
        return parser.apply(raw);
    }
    
    /**
     * Look up a built-in type by name ({@code string}, {@code int}, {@code long},
     * {@code double}, {@code bool}, {@code path}).
     */
    public static @NotNull ValueType<?> byName(String name) {
        ValueType<?> type = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (type == null) {
            throw new ConfigurationException("Unknown value type: " + name);
        }
        return type;
    }
    
    private static Double parseDouble(String raw) {
        double value = Double.parseDouble(raw);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite number: " + raw);
        }
        return value;
    }
    
    private static Boolean parseBool(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> Boolean.TRUE;
            case "false", "no", "0" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Not a boolean: " + raw);
        };
    }
    
    @Override
    public String toString() {
        return name;
    }
}
