package alpha.grouprouter.hook;

import alpha.grouprouter.route.Registration;

/**
 * Called when a route is registered or named.
 * 
 * @see Hooks#onRoute(RouteHook)
 * @see Hooks#onName(RouteHook)
 */
@FunctionalInterface
public interface RouteHook
{
    /**
     * Observes the registration.
     * 
     * @param registration the route, middleware or static entry
     * 
     * @throws Exception
     *             to reject the registration, which aborts the operation
     */
    void accept(Registration registration) throws Exception;
}
