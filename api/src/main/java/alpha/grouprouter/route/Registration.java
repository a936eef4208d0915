package alpha.grouprouter.route;

import alpha.grouprouter.App;
import alpha.grouprouter.Group;
import alpha.grouprouter.handler.Handler;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * An entry of an application's registration table.<p>
 * 
 * A registration is produced by each verb method of a router (a route), by
 * each prefix of a {@code use()} call which does not mount (a middleware) and
 * by {@code staticFiles()} (a static file server). The registrations of an
 * application can be enumerated using {@link App#routes()}.<p>
 * 
 * Only the name of a registration mutates after it has been created, see
 * {@link App#name(String)}.
 * 
 * @see App#namedRoute(String)
 */
public interface Registration
{
    /**
     * The method token of middleware registrations.<p>
     * 
     * Middleware apply to requests of any method.
     */
    String ANY_METHOD = "USE";
    
    /**
     * The kind of registration.
     */
    enum Kind {
        /** Has a primary handler and zero or more middleware. */
        ROUTE,
        /** Has no primary handler; one or more middleware. */
        MIDDLEWARE,
        /** Serves files; has neither handler nor middleware. */
        STATIC
    }
    
    /**
     * {@return the kind of registration}
     */
    Kind kind();
    
    /**
     * {@return the method tokens, in registration order}<p>
     * 
     * For a middleware, this is a singleton list of {@link #ANY_METHOD}.
     */
    List<String> methods();
    
    /**
     * {@return the normalized absolute path}
     * 
     * @see PathComposer
     */
    String path();
    
    /**
     * {@return the group that registered this entry}<p>
     * 
     * Entries registered through a {@link RouteBuilder} have no group.
     */
    Optional<Group> group();
    
    /**
     * {@return the primary handler}<p>
     * 
     * Only routes have a primary handler.
     */
    Optional<Handler> handler();
    
    /**
     * {@return the middleware, in execution order}
     */
    List<Handler> middleware();
    
    /**
     * {@return the root directory of a static registration}
     */
    Optional<Path> root();
    
    /**
     * {@return the options of a static registration}
     */
    Optional<StaticConfig> staticConfig();
    
    /**
     * {@return the fully-qualified name}<p>
     * 
     * The name is qualified with the name of the group that registered the
     * entry.
     */
    Optional<String> name();
}
