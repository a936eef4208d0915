package alpha.grouprouter.route;

import alpha.grouprouter.RouterSetupException;

import java.io.Serial;

/**
 * Thrown by {@code Router.use()} if an argument is not one of the accepted
 * kinds of {@link Use}.
 */
public class IllegalUseArgumentException extends RouterSetupException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs an {@code IllegalUseArgumentException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public IllegalUseArgumentException(String message) {
        super(message);
    }
}
