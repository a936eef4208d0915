package alpha.grouprouter;

import alpha.grouprouter.handler.ErrorHandler;
import alpha.grouprouter.hook.Hooks;
import alpha.grouprouter.route.Registration;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import static java.util.Objects.requireNonNull;

/**
 * An application; the owner of a registration table.<p>
 * 
 * The application is itself a {@link Router} of the root prefix "/". All
 * registering methods delegate to the {@linkplain #root() root group}, except
 * {@link #name(String)} which always names the most recently registered
 * route.
 * 
 * {@snippet :
 *   App app = App.create();
 *   app.use(logRequests)
 *      .get("/", home).name("home");
 *   
 *   Group api = app.group("/api").name("api.");
 *   api.get("/users", listUsers).name("users"); // "api.users"
 *   
 *   App admin = App.create();
 *   admin.get("/stats", stats);
 *   app.use("/admin", admin);                   // GET /admin/stats
 * }
 * 
 * The application does not match nor serve requests. The registrations are
 * meant to be handed to a server through {@link #routes()}.
 * 
 * @implSpec
 * Methods of this interface, except the registering methods inherited from
 * {@code Router}, are thread-safe.
 * 
 * @see Group
 */
public interface App extends Router
{
    /**
     * Creates a new {@code App} using {@link Config#DEFAULT}.
     * 
     * @return a new {@code App}
     */
    static App create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Creates a new {@code App}.
     * 
     * @param config application configuration
     * 
     * @return a new {@code App}
     * 
     * @throws NullPointerException
     *             if {@code config} is {@code null}
     */
    static App create(Config config) {
        requireNonNull(config);
        var loader = ServiceLoader.load(AppFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config);
    }
    
    /**
     * {@return the current configuration}
     */
    Config config();
    
    /**
     * Replaces the configuration.<p>
     * 
     * The new configuration is observed by all subsequent operations.
     * 
     * @param newConfig new configuration
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code newConfig} is {@code null}
     */
    App reconfigure(Config newConfig);
    
    /**
     * {@return the hooks of this application}
     */
    Hooks hooks();
    
    /**
     * {@return the root group}<p>
     * 
     * The root group has prefix "/" and no parent.
     */
    Group root();
    
    /**
     * {@return all groups of this application, in creation order}<p>
     * 
     * The first element is the root group. Groups discarded by a failing hook
     * are not included.
     */
    List<Group> groups();
    
    /**
     * Returns all registrations of this application, in registration order.<p>
     * 
     * A mounted application contributes its registrations, with the paths
     * prefixed by the mount path, at the position of the mount. The mounted
     * application's registrations are read at the time of this call, and so
     * registrations added to the mounted application after it was mounted are
     * included.
     * 
     * @return an unmodifiable snapshot
     */
    List<Registration> routes();
    
    /**
     * Finds a registration by its fully-qualified name.<p>
     * 
     * If many registrations have the same name, the first one of
     * {@link #routes()} is returned.
     * 
     * @param name of registration
     * 
     * @return the registration, if found
     * 
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     */
    Optional<Registration> namedRoute(String name);
    
    /**
     * {@return all applications mounted directly into this application, in
     * mount order}
     */
    List<Mounted> mounts();
    
    /**
     * Returns the error handler chain of a request path.<p>
     * 
     * The last element is always the error handler of this application's
     * configuration. If the path targets the subtree of a mounted application,
     * then that application's chain precedes it. Mounts are searched
     * recursively, and the longest matching mount path wins.
     * 
     * @param path of request
     * 
     * @return the handlers, most specific first
     * 
     * @throws NullPointerException
     *             if {@code path} is {@code null}
     */
    List<ErrorHandler> errorHandlers(String path);
    
    /**
     * Names the most recently registered route.<p>
     * 
     * The name is qualified with the name of the group that registered the
     * route (if any). Naming is performed under the application-wide naming
     * lock, which is held for the duration of the
     * {@linkplain Hooks#onName(alpha.grouprouter.hook.RouteHook) naming hooks}.
     * 
     * @param name of route
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws alpha.grouprouter.route.NoRouteToNameException
     *             if no route has been registered
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a naming hook fails
     */
    @Override
    App name(String name);
    
    /**
     * An application mounted into another.
     * 
     * @param prefix absolute mount path
     * @param app mounted
     */
    record Mounted(String prefix, App app) {
        /**
         * Initializes this object.
         * 
         * @param prefix absolute mount path
         * @param app mounted
         * 
         * @throws NullPointerException if any argument is {@code null}
         */
        public Mounted {
            requireNonNull(prefix);
            requireNonNull(app);
        }
    }
}
