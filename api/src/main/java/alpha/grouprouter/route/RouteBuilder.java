package alpha.grouprouter.route;

import alpha.grouprouter.Router;
import alpha.grouprouter.handler.Handler;

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
 * Registers handlers of many methods on one fixed path.<p>
 * 
 * A builder is created using {@link Router#route(String)}. Creating the
 * builder registers nothing.
 * 
 * {@snippet :
 *   app.route("/user/:id")
 *      .get(getUser)
 *      .put(replaceUser)
 *      .delete(removeUser);
 * }
 * 
 * The registrations have no group, see {@link Registration#group()}, and they
 * do not affect the naming mode of the group that created the builder.
 */
public interface RouteBuilder
{
    /**
     * {@return the normalized absolute path of this builder}
     */
    String path();
    
    /**
     * Registers a route for the given methods.
     * 
     * @param methods    of route
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
    RouteBuilder add(List<String> methods, Handler handler, Handler... middleware);
    
    /**
     * Registers a route for all methods of the application's configuration.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    RouteBuilder all(Handler handler, Handler... middleware);
    
    /**
     * Returns a new builder for a path relative to this builder.
     * 
     * @param path relative to this builder
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
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder get(Handler handler, Handler... middleware) {
        return add(List.of(GET), handler, middleware);
    }
    
    /**
     * Registers a HEAD route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder head(Handler handler, Handler... middleware) {
        return add(List.of(HEAD), handler, middleware);
    }
    
    /**
     * Registers a POST route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder post(Handler handler, Handler... middleware) {
        return add(List.of(POST), handler, middleware);
    }
    
    /**
     * Registers a PUT route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder put(Handler handler, Handler... middleware) {
        return add(List.of(PUT), handler, middleware);
    }
    
    /**
     * Registers a DELETE route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder delete(Handler handler, Handler... middleware) {
        return add(List.of(DELETE), handler, middleware);
    }
    
    /**
     * Registers a CONNECT route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder connect(Handler handler, Handler... middleware) {
        return add(List.of(CONNECT), handler, middleware);
    }
    
    /**
     * Registers an OPTIONS route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder options(Handler handler, Handler... middleware) {
        return add(List.of(OPTIONS), handler, middleware);
    }
    
    /**
     * Registers a TRACE route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder trace(Handler handler, Handler... middleware) {
        return add(List.of(TRACE), handler, middleware);
    }
    
    /**
     * Registers a PATCH route.
     * 
     * @param handler    primary handler
     * @param middleware zero or more
     * @return this (for chaining/fluency)
     * @throws NullPointerException if any argument is {@code null}
     */
    default RouteBuilder patch(Handler handler, Handler... middleware) {
        return add(List.of(PATCH), handler, middleware);
    }
}
