package alpha.grouprouter;

import java.io.Serial;

/**
 * Base type of all exceptions thrown by the library when the application's
 * routing setup is invalid.<p>
 * 
 * These exceptions are not recoverable; they indicate incorrect setup code. A
 * host application may catch this type during startup in order to report the
 * failure before aborting.
 */
public abstract class RouterSetupException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Initializes this object.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    protected RouterSetupException(String message) {
        super(message);
    }
    
    /**
     * Initializes this object.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    protected RouterSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
