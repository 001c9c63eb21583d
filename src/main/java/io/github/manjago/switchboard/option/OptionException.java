package io.github.manjago.switchboard.option;

import org.jetbrains.annotations.Nullable;

/**
 * Misuse of options on the command line.
 */
public class OptionException extends Exception {
    
    public enum Kind {
        /** Token looks like an option but no visible option has that spelling */
        UNRECOGNIZED_OPTION,
        
        /** Keyed option is last, or followed by another option */
        EXPECTED_VALUE,
        
        /** Value does not convert to the option's type */
        INVALID_VALUE,
        
        /** An option group's restriction is violated */
        GROUP_MISUSE
    }
    
    private final Kind kind;
    private final String optionName;
    private final String expectedType;
    private final OptionGroup group;
    
    private OptionException(Kind kind, String message, String optionName,
                            String expectedType, OptionGroup group) {
        super(message);
        this.kind = kind;
        this.optionName = optionName;
        this.expectedType = expectedType;
        this.group = group;
    }
    
    public static OptionException unrecognizedOption(String name) {
        return new OptionException(Kind.UNRECOGNIZED_OPTION,
                "Unrecognized option: " + name, name, null, null);
    }
    
    public static OptionException expectedValue(String name) {
        return new OptionException(Kind.EXPECTED_VALUE,
                "Expected a value to follow: " + name, name, null, null);
    }
    
    public static OptionException invalidValue(String name, String expectedType, String raw) {
        return new OptionException(Kind.INVALID_VALUE,
                "Invalid value for " + name + ": '" + raw + "' (expected " + expectedType + ")",
                name, expectedType, null);
    }
    
    public static OptionException groupMisuse(OptionGroup group) {
        String rule = switch (group.restriction()) {
            case AT_MOST_ONE -> "at most one of";
            case AT_LEAST_ONE -> "at least one of";
            case EXACTLY_ONE -> "exactly one of";
        };
        return new OptionException(Kind.GROUP_MISUSE,
                "Must pass " + rule + " the following: " + group.describe(), null, null, group);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    /**
     * @return the offending spelling; null for group misuse
     */
    public @Nullable String getOptionName() {
        return optionName;
    }
    
    /**
     * @return expected type name; only set for invalid values
     */
    public @Nullable String getExpectedType() {
        return expectedType;
    }
    
    /**
     * @return violated group; only set for group misuse
     */
    public @Nullable OptionGroup getGroup() {
        return group;
    }
}
