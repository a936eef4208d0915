package alpha.grouprouter.handler;

import alpha.grouprouter.App;
import alpha.grouprouter.Config;

/**
 * Handles an exception thrown by a {@link Handler}.<p>
 * 
 * Each application has exactly one error handler, configured through
 * {@link Config#errorHandler()}. When an application is mounted into another,
 * the parent's error handler chain is extended with the mounted application's
 * handler for requests targeting the mounted subtree, see
 * {@link App#errorHandlers(String)}.<p>
 * 
 * The error handler must be thread-safe, as it may be called concurrently.
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Rethrows the exception.<p>
     * 
     * This is the handler used by {@link Config#DEFAULT}. What happens next is
     * up to the server.
     */
    ErrorHandler BASE = (exc, ctx) -> {
        throw exc;
    };
    
    /**
     * Handles the exception.
     * 
     * @param exc thrown by a handler
     * @param context of exchange
     * 
     * @throws Exception
     *             if the exception could not be handled
     */
    void apply(Exception exc, Context context) throws Exception;
}
