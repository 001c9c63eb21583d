package io.github.manjago.switchboard.param;

/**
 * Positional tokens do not fit the command's parameter signature.
 */
public class ParameterException extends Exception {
    
    public enum Kind {
        NOT_ENOUGH_ARGUMENTS,
        TOO_MANY_ARGUMENTS
    }
    
    private final Kind kind;
    private final int minimum;
    private final int maximum;
    private final int actual;
    
    private ParameterException(Kind kind, String message, int minimum, int maximum, int actual) {
        super(message);
        this.kind = kind;
        this.minimum = minimum;
        this.maximum = maximum;
        this.actual = actual;
    }
    
    public static ParameterException notEnoughArguments(int minimum, int actual) {
        return new ParameterException(Kind.NOT_ENOUGH_ARGUMENTS,
                "Expected at least " + minimum + " argument" + (minimum == 1 ? "" : "s") + ", got " + actual,
                minimum, -1, actual);
    }
    
    public static ParameterException tooManyArguments(int maximum, int actual) {
        return new ParameterException(Kind.TOO_MANY_ARGUMENTS,
                "Expected at most " + maximum + " argument" + (maximum == 1 ? "" : "s") + ", got " + actual,
                -1, maximum, actual);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    /**
     * @return number of required parameters, or -1 if not applicable
     */
    public int getMinimum() {
        return minimum;
    }
    
    /**
     * @return required plus optional parameters, or -1 if not applicable
     */
    public int getMaximum() {
        return maximum;
    }
    
    public int getActual() {
        return actual;
    }
}
