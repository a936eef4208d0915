package alpha.grouprouter.hook;

import alpha.grouprouter.RouterSetupException;

import java.io.Serial;

/**
 * Thrown by a routing operation if a hook threw an exception.<p>
 * 
 * The exception thrown by the hook is the cause.
 */
public class HookFailedException extends RouterSetupException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code HookFailedException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public HookFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
