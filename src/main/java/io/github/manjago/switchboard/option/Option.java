package io.github.manjago.switchboard.option;

import io.github.manjago.switchboard.core.ConfigurationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A command-line option: either a {@link Flag} or a {@link KeyedOption}.
 * 
 * Every option has one or more spellings, e.g. {@code -n} and {@code --name}.
 * Options are immutable definitions; recognized values live in
 * {@link OptionValues}, one instance per invocation.
 */
public sealed interface Option permits Flag, KeyedOption {
    
    /**
     * @return accepted spellings, in declaration order
     */
    @NotNull List<String> names();
    
    @NotNull String description();
    
    /**
     * Longest spelling, used when reporting this option by name.
     */
    default @NotNull String displayName() {
        String best = names().get(0);
        for (String name : names()) {
            if (name.length() > best.length()) {
                best = name;
            }
        }
        return best;
    }
    
    // ========== Token syntax ==========
    
    Pattern NEGATIVE_NUMBER = Pattern.compile("^-\\d+(\\.\\d+)?$");
    
    /**
     * Whether a raw token follows the option-prefix convention.
     * 
     * A lone {@code -} and negative numbers such as {@code -5} are not options.
     */
    @Contract(pure = true)
    static boolean isOptionToken(@NotNull String token) {
        return token.length() > 1
                && token.charAt(0) == '-'
                && !NEGATIVE_NUMBER.matcher(token).matches();
    }
    
    /**
     * Validate and copy a list of spellings.
     */
    static List<String> checkNames(String... names) {
        if (names.length == 0) {
            throw new ConfigurationException("Option needs at least one spelling");
        }
        for (String name : names) {
            if (name == null || !isOptionToken(name) || name.equals("--") || name.contains("=")) {
                throw new ConfigurationException("Invalid option spelling: " + name);
            }
        }
        List<String> list = List.of(names);
        if (list.stream().distinct().count() != list.size()) {
            throw new ConfigurationException("Option repeats a spelling: " + list);
        }
        return list;
    }
}
