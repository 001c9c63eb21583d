package io.github.manjago.switchboard.option;

import io.github.manjago.switchboard.core.ConfigurationException;

import java.util.Collection;
import java.util.List;

/**
 * A set of options whose combined use is constrained.
 */
public final class OptionGroup {
    
    public enum Restriction {
        /** Zero or one of the options */
        AT_MOST_ONE,
        
        /** One or more of the options */
        AT_LEAST_ONE,
        
        /** Exactly one of the options */
        EXACTLY_ONE;
        
        boolean allows(int count) {
            return switch (this) {
                case AT_MOST_ONE -> count <= 1;
                case AT_LEAST_ONE -> count >= 1;
                case EXACTLY_ONE -> count == 1;
            };
        }
    }
    
    private final Restriction restriction;
    private final List<Option> options;
    
    public OptionGroup(Restriction restriction, List<? extends Option> options) {
        if (options.isEmpty()) {
            throw new ConfigurationException("Option group needs at least one option");
        }
        this.restriction = restriction;
        this.options = List.copyOf(options);
    }
    
    public static OptionGroup atMostOne(Option... options) {
        return new OptionGroup(Restriction.AT_MOST_ONE, List.of(options));
    }
    
    public static OptionGroup atLeastOne(Option... options) {
        return new OptionGroup(Restriction.AT_LEAST_ONE, List.of(options));
    }
    
    public static OptionGroup exactlyOne(Option... options) {
        return new OptionGroup(Restriction.EXACTLY_ONE, List.of(options));
    }
    
    public Restriction restriction() {
        return restriction;
    }
    
    public List<Option> options() {
        return options;
    }
    
    /**
     * @param present options that were given on the command line
     * @return true if the group's restriction holds
     */
    public boolean isSatisfiedBy(Collection<? extends Option> present) {
        int count = 0;
        for (Option option : options) {
            if (present.contains(option)) {
                count++;
            }
        }
        return restriction.allows(count);
    }
    
    /**
     * Spellings of the member options, e.g. {@code --json, --yaml}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (Option option : options) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(option.displayName());
        }
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return restriction + "(" + describe() + ")";
    }
}
