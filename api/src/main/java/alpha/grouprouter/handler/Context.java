package alpha.grouprouter.handler;

/**
 * The exchange a {@link Handler} is invoked with.<p>
 * 
 * The context is created and driven by the HTTP server which dispatches
 * requests to the registered handlers. This library only records handlers,
 * it never invokes them, and so it never creates a context.
 */
public interface Context
{
    /**
     * Yields control to the next handler in the chain.
     * 
     * @throws Exception
     *             if the next handler fails
     */
    void next() throws Exception;
}
