package alpha.grouprouter.core;

import alpha.grouprouter.App;
import alpha.grouprouter.Group;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.route.NoRouteToNameException;
import alpha.grouprouter.route.PathComposer;
import alpha.grouprouter.route.Registration;
import alpha.grouprouter.route.StaticConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;

import static alpha.grouprouter.HttpConstants.Method.GET;
import static alpha.grouprouter.HttpConstants.Method.HEAD;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * The registration table of an application.<p>
 * 
 * The table holds two kinds of entries in registration order; registrations
 * and mounted applications. The table also remembers the most recent
 * registration, which is the target of route naming.<p>
 * 
 * Appending to the table is not atomic relative to other appends, and so
 * concurrent registrations require external coordination. Reading the table
 * never fails.
 */
final class RouteTable
{
    private static final System.Logger LOG
            = System.getLogger(RouteTable.class.getPackageName());
    
    private static final List<String> STATIC_METHODS = List.of(GET, HEAD);
    
    private final DefaultApp owner;
    // DefaultRegistration or App.Mounted
    private final List<Object> entries;
    private volatile DefaultRegistration latest;
    
    RouteTable(DefaultApp owner) {
        this.owner   = owner;
        this.entries = new CopyOnWriteArrayList<>();
        this.latest  = null;
    }
    
    /**
     * Registers a route.
     * 
     * @param methods of route
     * @param path absolute and normalized
     * @param group owner (nullable)
     * @param handler primary
     * @param middleware zero or more
     * 
     * @return the registration
     * 
     * @throws IllegalArgumentException
     *             if {@code methods} is empty
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a hook fails (nothing is registered)
     */
    Registration register(
            List<String> methods, String path, Group group,
            Handler handler, List<Handler> middleware) {
        requireNonNull(handler, "handler");
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("No methods for route: " + path);
        }
        return append(DefaultRegistration.route(
                methods, path, group, handler, middleware));
    }
    
    /**
     * Registers middleware of any method.
     * 
     * @param path absolute and normalized
     * @param group owner (nullable)
     * @param middleware one or more
     * 
     * @return the registration
     * 
     * @throws IllegalArgumentException
     *             if {@code middleware} is empty
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a hook fails (nothing is registered)
     */
    Registration registerMiddleware(
            String path, Group group, List<Handler> middleware) {
        if (middleware.isEmpty()) {
            throw new IllegalArgumentException(
                    "Missing handler/middleware in route: " + path);
        }
        return append(DefaultRegistration.middleware(path, group, middleware));
    }
    
    /**
     * Registers a static file server.
     * 
     * @param path absolute and normalized
     * @param group owner (nullable)
     * @param root directory
     * @param config options
     * 
     * @return the registration
     * 
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a hook fails (nothing is registered)
     */
    Registration registerStatic(
            String path, Group group, Path root, StaticConfig config) {
        requireNonNull(root, "root");
        requireNonNull(config, "config");
        return append(DefaultRegistration.files(
                STATIC_METHODS, path, group, root, config));
    }
    
    private Registration append(DefaultRegistration r) {
        owner.hooksImpl().executeOnRoute(r);
        entries.add(r);
        latest = r;
        LOG.log(DEBUG, () -> "Registered: " + r);
        return r;
    }
    
    /**
     * Names the most recently registered route.<p>
     * 
     * The name is qualified with the name of the group that registered the
     * route.
     * 
     * @param literal name
     * 
     * @throws NoRouteToNameException
     *             if nothing has been registered
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a hook fails (the name is not rolled back)
     */
    void name(String literal) {
        requireNonNull(literal);
        final Lock mutex = owner.mutex();
        mutex.lock();
        try {
            final DefaultRegistration r = latest;
            if (r == null) {
                throw new NoRouteToNameException(literal);
            }
            String qualified = r.group()
                    .flatMap(Group::name)
                    .map(n -> n + literal)
                    .orElse(literal);
            r.name(qualified);
            LOG.log(DEBUG, () -> "Named route: " + r);
            owner.hooksImpl().executeOnName(r);
        } finally {
            mutex.unlock();
        }
    }
    
    /**
     * Mounts an application.
     * 
     * @param path absolute and normalized
     * @param subApp to mount
     * 
     * @throws IllegalArgumentException
     *             if {@code subApp} is not mountable, or
     *             if the mount creates a cycle
     * @throws alpha.grouprouter.hook.HookFailedException
     *             if a mount hook of {@code subApp} fails (the mount stays)
     */
    void mount(String path, App subApp) {
        if (!(subApp instanceof DefaultApp)) {
            throw new IllegalArgumentException(
                    "Application type not supported: " + subApp.getClass());
        }
        final DefaultApp sub = (DefaultApp) subApp;
        if (sub.reaches(owner)) {
            throw new IllegalArgumentException(
                    "Can not mount an application into itself: " + path);
        }
        entries.add(new App.Mounted(path, sub));
        LOG.log(DEBUG, () -> "Mounted " + sub + " at " + path);
        sub.hooksImpl().executeOnMount(owner, path);
    }
    
    /**
     * Returns all registrations, including those of mounted applications.
     * 
     * @return an unmodifiable snapshot
     */
    List<Registration> routes() {
        var all = new ArrayList<Registration>();
        for (Object e : entries) {
            if (e instanceof DefaultRegistration) {
                all.add((DefaultRegistration) e);
            } else {
                var m = (App.Mounted) e;
                for (Registration r : m.app().routes()) {
                    all.add(new Remounted(
                            PathComposer.compose(m.prefix(), r.path()), r));
                }
            }
        }
        return unmodifiableList(all);
    }
    
    /**
     * Returns all mounted applications.
     * 
     * @return an unmodifiable snapshot
     */
    List<App.Mounted> mounts() {
        var all = new ArrayList<App.Mounted>();
        for (Object e : entries) {
            if (e instanceof App.Mounted) {
                all.add((App.Mounted) e);
            }
        }
        return unmodifiableList(all);
    }
    
    /**
     * Finds a registration by name.
     * 
     * @param name of registration
     * 
     * @return the first match
     */
    Optional<Registration> find(String name) {
        requireNonNull(name);
        return routes().stream()
                .filter(r -> r.name().filter(name::equals).isPresent())
                .findFirst();
    }
    
    /**
     * A registration of a mounted application, as seen from the parent.<p>
     * 
     * All values except the path are read from the origin.
     */
    private record Remounted(String path, Registration origin)
            implements Registration
    {
        @Override
        public Kind kind() {
            return origin.kind();
        }
        
        @Override
        public List<String> methods() {
            return origin.methods();
        }
        
        @Override
        public Optional<Group> group() {
            return origin.group();
        }
        
        @Override
        public Optional<Handler> handler() {
            return origin.handler();
        }
        
        @Override
        public List<Handler> middleware() {
            return origin.middleware();
        }
        
        @Override
        public Optional<Path> root() {
            return origin.root();
        }
        
        @Override
        public Optional<StaticConfig> staticConfig() {
            return origin.staticConfig();
        }
        
        @Override
        public Optional<String> name() {
            return origin.name();
        }
        
        @Override
        public String toString() {
            return DefaultRegistration.toString(this);
        }
    }
}
