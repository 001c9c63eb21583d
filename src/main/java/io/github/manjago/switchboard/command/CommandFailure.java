package io.github.manjago.switchboard.command;

import org.jetbrains.annotations.Nullable;

/**
 * Domain failure raised by a {@link CommandAction}.
 * 
 * Carries an optional message for stderr and the process exit status.
 */
public class CommandFailure extends Exception {
    
    public static final int DEFAULT_STATUS = 1;
    
    private final int exitStatus;
    
    public CommandFailure() {
        this(null, DEFAULT_STATUS);
    }
    
    public CommandFailure(@Nullable String message) {
        this(message, DEFAULT_STATUS);
    }
    
    public CommandFailure(@Nullable String message, int exitStatus) {
        super(message);
        this.exitStatus = exitStatus;
    }
    
    public CommandFailure(@Nullable String message, Throwable cause) {
        super(message, cause);
        this.exitStatus = DEFAULT_STATUS;
    }
    
    public int getExitStatus() {
        return exitStatus;
    }
}
