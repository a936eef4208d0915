package alpha.grouprouter;

import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.route.IllegalUseArgumentException;
import alpha.grouprouter.route.PathComposer;
import alpha.grouprouter.route.Registration;
import alpha.grouprouter.route.RouteBuilder;
import alpha.grouprouter.route.StaticConfig;
import alpha.grouprouter.route.Use;

import java.nio.file.Path;
import java.util.List;

import static alpha.grouprouter.HttpConstants.Method.CONNECT;
import static alpha.grouprouter.HttpConstants.Method.DELETE;
import static alpha.grouprouter.HttpConstants.Method.GET;
import static alpha.grouprouter.HttpConstants.Method.HEAD;
import static alpha.grouprouter.HttpConstants.Method.OPTIONS;
import static alpha.grouprouter.HttpConstants.Method.PATCH;
import static alpha.grouprouter.HttpConstants.Method.POST;
import static alpha.grouprouter.HttpConstants.Method.PUT;
import static alpha.grouprouter.HttpConstants.Method.TRACE;

/**
 * Registers routes, middleware, static files and mounted applications under a
 * path prefix.<p>
 * 
 * All paths given to a router are relative to its prefix and will be composed
 * into a normalized absolute path using {@link PathComposer}. The empty path
 * denotes the prefix itself.
 * 
 * {@snippet :
 *   App app = App.create();
 *   Group api = app.group("/api", authenticate);
 *   Group v1  = api.group("/v1");
 *   v1.get("/users", listUsers)    // GET /api/v1/users
 *     .post("/users", createUser); // POST /api/v1/users
 * }
 * 
 * All registering methods return the router they were called on, for
 * chaining.<p>
 * 
 * The router is meant to be used during the application's setup phase. Only
 * {@link #name(String)} is internally synchronized; concurrent registrations
 * through the same router require external coordination.
 * 
 * @see App
 * @see Group
 */
public interface Router
{
    /**
     * Registers a route for the given methods.
     * 
     * @param methods    of route
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument or element is {@code null}
     * @throws IllegalArgumentException
     *             if {@code methods} is empty
     */
    Router add(List<String> methods, String path, Handler handler, Handler... middleware);
    
    /**
     * Registers a route for all methods of the application's
     * {@link Config#requestMethods() configuration}.<p>
     * 
     * The methods are read from the application's current configuration at
     * the time of the call.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    Router all(String path, Handler handler, Handler... middleware);
    
    /**
     * Registers middleware, or mounts an application.<p>
     * 
     * The arguments are resolved as follows:
     * 
     * <ol>
     *   <li>A {@link Use.Prefix} sets the prefix (default: the empty path),
     *       a {@link Use.Prefixes} sets many prefixes, a {@link Use.Mount}
     *       sets the application to mount and each {@link Use.Middleware} is
     *       appended to the middleware.</li>
     *   <li>If an application was given, it is mounted at the first prefix
     *       and the call returns. Nothing else is registered; neither the
     *       middleware nor the other prefixes.</li>
     *   <li>Otherwise, the middleware are registered for each prefix, matching
     *       requests of any method, see {@link Registration#ANY_METHOD}.</li>
     * </ol>
     * 
     * Mounting makes every registration of the mounted application, present
     * and future, visible in this router's application under the mount path.
     * Also, the mounted application's error handler is added to the error
     * handler chain of requests targeting the mounted subtree, see
     * {@link App#errorHandlers(String)}.
     * 
     * @param first argument
     * @param more arguments
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws IllegalUseArgumentException
     *             if an argument is {@code null}
     * @throws IllegalArgumentException
     *             if an application is mounted into itself
     */
    Router use(Use first, Use... more);
    
    /**
     * Registers middleware matching all requests of this router's prefix.
     * 
     * @param first middleware
     * @param more middleware
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws IllegalUseArgumentException
     *             if an argument is {@code null}
     * 
     * @see #use(Use, Use...)
     */
    default Router use(Handler first, Handler... more) {
        Use[] args = new Use[more.length];
        for (int i = 0; i < more.length; ++i) {
            args[i] = more[i] == null ? null : Use.handler(more[i]);
        }
        return use(first == null ? null : Use.handler(first), args);
    }
    
    /**
     * Registers middleware under a prefix.
     * 
     * @param prefix relative to this router
     * @param first middleware
     * @param more middleware
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code prefix} is {@code null}
     * @throws IllegalUseArgumentException
     *             if a middleware is {@code null}
     * 
     * @see #use(Use, Use...)
     */
    default Router use(String prefix, Handler first, Handler... more) {
        Use[] args = new Use[1 + more.length];
        args[0] = first == null ? null : Use.handler(first);
        for (int i = 0; i < more.length; ++i) {
            args[i + 1] = more[i] == null ? null : Use.handler(more[i]);
        }
        return use(Use.prefix(prefix), args);
    }
    
    /**
     * Registers the same middleware under many prefixes.
     * 
     * @param prefixes relative to this router
     * @param first middleware
     * @param more middleware
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code prefixes} or an element is {@code null}
     * @throws IllegalUseArgumentException
     *             if a middleware is {@code null}
     * 
     * @see #use(Use, Use...)
     */
    default Router use(List<String> prefixes, Handler first, Handler... more) {
        Use[] args = new Use[1 + more.length];
        args[0] = first == null ? null : Use.handler(first);
        for (int i = 0; i < more.length; ++i) {
            args[i + 1] = more[i] == null ? null : Use.handler(more[i]);
        }
        return use(Use.prefixes(prefixes), args);
    }
    
    /**
     * Mounts an application under a prefix.
     * 
     * @param prefix relative to this router
     * @param subApp to mount
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if an application is mounted into itself
     * 
     * @see #use(Use, Use...)
     */
    default Router use(String prefix, App subApp) {
        return use(Use.prefix(prefix), Use.app(subApp));
    }
    
    /**
     * Registers a static file server using {@link StaticConfig#DEFAULT}.
     * 
     * @param prefix relative to this router
     * @param root directory to serve files from
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    default Router staticFiles(String prefix, Path root) {
        return staticFiles(prefix, root, StaticConfig.DEFAULT);
    }
    
    /**
     * Registers a static file server.
     * 
     * @param prefix relative to this router
     * @param root directory to serve files from
     * @param config options
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    Router staticFiles(String prefix, Path root, StaticConfig config);
    
    /**
     * Names something.<p>
     * 
     * What is named depends on the implementation. An {@link App} names the
     * most recently registered route. A {@link Group} names itself if nothing
     * has yet been registered through it, otherwise the most recently
     * registered route.
     * 
     * @param name to give
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws alpha.grouprouter.route.NoRouteToNameException
     *             if a route is to be named, but no route has been registered
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a naming hook fails
     */
    Router name(String name);
    
    /**
     * Creates a group.<p>
     * 
     * If handlers are given, they are registered as middleware under the
     * group's prefix, on behalf of this router.
     * 
     * @param prefix relative to this router
     * @param handlers middleware (optional)
     * 
     * @return a new group
     * 
     * @throws NullPointerException
     *             if any argument or element is {@code null}
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a group hook fails
     */
    Group group(String prefix, Handler... handlers);
    
    /**
     * Creates a builder of routes of one path.
     * 
     * @param path relative to this router
     * 
     * @return a new builder
     * 
     * @throws NullPointerException
     *             if {@code path} is {@code null}
     */
    RouteBuilder route(String path);
    
    /**
     * Registers a GET route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router get(String path, Handler handler, Handler... middleware) {
        return add(List.of(GET), path, handler, middleware);
    }
    
    /**
     * Registers a HEAD route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router head(String path, Handler handler, Handler... middleware) {
        return add(List.of(HEAD), path, handler, middleware);
    }
    
    /**
     * Registers a POST route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router post(String path, Handler handler, Handler... middleware) {
        return add(List.of(POST), path, handler, middleware);
    }
    
    /**
     * Registers a PUT route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router put(String path, Handler handler, Handler... middleware) {
        return add(List.of(PUT), path, handler, middleware);
    }
    
    /**
     * Registers a DELETE route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router delete(String path, Handler handler, Handler... middleware) {
        return add(List.of(DELETE), path, handler, middleware);
    }
    
    /**
     * Registers a CONNECT route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router connect(String path, Handler handler, Handler... middleware) {
        return add(List.of(CONNECT), path, handler, middleware);
    }
    
    /**
     * Registers an OPTIONS route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router options(String path, Handler handler, Handler... middleware) {
        return add(List.of(OPTIONS), path, handler, middleware);
    }
    
    /**
     * Registers a TRACE route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router trace(String path, Handler handler, Handler... middleware) {
        return add(List.of(TRACE), path, handler, middleware);
    }
    
    /**
     * Registers a PATCH route.
     * 
     * @param path       relative to this router
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default Router patch(String path, Handler handler, Handler... middleware) {
        return add(List.of(PATCH), path, handler, middleware);
    }
}
