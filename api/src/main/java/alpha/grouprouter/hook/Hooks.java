package alpha.grouprouter.hook;

import alpha.grouprouter.App;
import alpha.grouprouter.Group;
import alpha.grouprouter.Router;

/**
 * Extension points of an application's routing setup.<p>
 * 
 * Hooks are called synchronously by the thread performing the triggering
 * operation, and in the order they were added. If a hook throws an exception,
 * the remaining hooks are not called and the triggering operation throws a
 * {@link HookFailedException}. Whatever the operation did before calling the
 * hooks is not rolled back; setup is expected to abort.<p>
 * 
 * Naming hooks are called while holding the application-wide naming lock.
 * 
 * {@snippet :
 *   app.hooks().onGroupName(g -> {
 *       if (!g.name().endsWith(".")) {
 *           throw new IllegalArgumentException("Group name must end with '.'");
 *       }
 *   });
 * }
 * 
 * @see App#hooks()
 */
public interface Hooks
{
    /**
     * Adds a hook called each time a route, middleware or static entry is
     * registered.
     * 
     * @param hook to add
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code hook} is {@code null}
     */
    Hooks onRoute(RouteHook hook);
    
    /**
     * Adds a hook called each time a route is named.
     * 
     * @param hook to add
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code hook} is {@code null}
     * @see Router#name(String)
     */
    Hooks onName(RouteHook hook);
    
    /**
     * Adds a hook called each time a group is created.<p>
     * 
     * If the hook fails, the group is discarded.
     * 
     * @param hook to add
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code hook} is {@code null}
     * @see Router#group(String, alpha.grouprouter.handler.Handler...)
     */
    Hooks onGroup(GroupHook hook);
    
    /**
     * Adds a hook called each time a group is named.<p>
     * 
     * The hook receives the group's fully-qualified name.
     * 
     * @param hook to add
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code hook} is {@code null}
     * @see Group
     */
    Hooks onGroupName(GroupHook hook);
    
    /**
     * Adds a hook called each time <i>this</i> application is mounted into
     * another.
     * 
     * @param hook to add
     * @return this (for chaining/fluency)
     * @throws NullPointerException if {@code hook} is {@code null}
     */
    Hooks onMount(MountHook hook);
}
