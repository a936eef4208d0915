package alpha.grouprouter.handler;

import alpha.grouprouter.Router;

/**
 * A request handler or middleware.<p>
 * 
 * The same type is used for a route's primary handler and for the middleware
 * that run before it. A middleware is expected to call {@link Context#next()}
 * when it wishes the chain to continue.
 * 
 * <pre>
 *   Handler timed = ctx -&gt; {
 *       long start = System.nanoTime();
 *       ctx.next();
 *       metrics.record(System.nanoTime() - start);
 *   };
 *   app.use(timed);
 * </pre>
 * 
 * @see Router
 */
@FunctionalInterface
public interface Handler
{
    /**
     * Handles the exchange.
     * 
     * @param context of exchange
     * 
     * @throws Exception
     *             for whatever reason, the error will be passed to the
     *             application's {@link ErrorHandler}s
     */
    void handle(Context context) throws Exception;
}
