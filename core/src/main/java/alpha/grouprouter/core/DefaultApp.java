package alpha.grouprouter.core;

import alpha.grouprouter.App;
import alpha.grouprouter.Config;
import alpha.grouprouter.Group;
import alpha.grouprouter.Router;
import alpha.grouprouter.handler.ErrorHandler;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.hook.Hooks;
import alpha.grouprouter.route.PathComposer;
import alpha.grouprouter.route.Registration;
import alpha.grouprouter.route.RouteBuilder;
import alpha.grouprouter.route.StaticConfig;
import alpha.grouprouter.route.Use;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link App}.<p>
 * 
 * The application is the sole owner of its groups, table and hooks. A group
 * references the application and its parent group, never its children.
 */
final class DefaultApp implements App
{
    private static final System.Logger LOG
            = System.getLogger(DefaultApp.class.getPackageName());
    
    private volatile Config config;
    private final DefaultHooks hooks;
    private final RouteTable table;
    private final ReentrantLock mutex;
    private final List<Group> groups;
    private final DefaultGroup root;
    
    DefaultApp(Config config) {
        this.config = requireNonNull(config);
        this.hooks  = new DefaultHooks();
        this.table  = new RouteTable(this);
        this.mutex  = new ReentrantLock();
        this.groups = new CopyOnWriteArrayList<>();
        this.root   = new DefaultGroup(this, "/", null);
        groups.add(root);
        LOG.log(DEBUG, () -> "Created app with " + config);
    }
    
    RouteTable table() {
        return table;
    }
    
    DefaultHooks hooksImpl() {
        return hooks;
    }
    
    /**
     * {@return the application-wide naming lock}
     */
    Lock mutex() {
        return mutex;
    }
    
    void adopt(DefaultGroup g) {
        groups.add(g);
    }
    
    /**
     * Returns {@code true} if the given application is this application, or
     * mounted anywhere below it.
     * 
     * @param target application to look for
     * 
     * @return see JavaDoc
     */
    boolean reaches(App target) {
        if (this == target) {
            return true;
        }
        for (Mounted m : table.mounts()) {
            if (((DefaultApp) m.app()).reaches(target)) {
                return true;
            }
        }
        return false;
    }
    
    @Override
    public Config config() {
        return config;
    }
    
    @Override
    public App reconfigure(Config newConfig) {
        config = requireNonNull(newConfig);
        LOG.log(DEBUG, () -> "Reconfigured with " + newConfig);
        return this;
    }
    
    @Override
    public Hooks hooks() {
        return hooks;
    }
    
    @Override
    public Group root() {
        return root;
    }
    
    @Override
    public List<Group> groups() {
        return List.copyOf(groups);
    }
    
    @Override
    public List<Registration> routes() {
        return table.routes();
    }
    
    @Override
    public Optional<Registration> namedRoute(String name) {
        return table.find(name);
    }
    
    @Override
    public List<Mounted> mounts() {
        return table.mounts();
    }
    
    @Override
    public List<ErrorHandler> errorHandlers(String path) {
        final String p = PathComposer.normalize(path);
        Mounted best = null;
        for (Mounted m : table.mounts()) {
            if (covers(m.prefix(), p) &&
                (best == null || m.prefix().length() > best.prefix().length())) {
                best = m;
            }
        }
        var chain = new ArrayList<ErrorHandler>();
        if (best != null) {
            chain.addAll(best.app().errorHandlers(relative(best.prefix(), p)));
        }
        chain.add(config.errorHandler());
        return unmodifiableList(chain);
    }
    
    private static boolean covers(String prefix, String path) {
        return prefix.equals("/") ||
               path.equals(prefix) ||
               path.startsWith(prefix + "/");
    }
    
    private static String relative(String prefix, String path) {
        return prefix.equals("/") ? path :
                PathComposer.normalize(path.substring(prefix.length()));
    }
    
    @Override
    public App name(String name) {
        table.name(name);
        return this;
    }
    
    @Override
    public Router add(List<String> methods, String path, Handler handler, Handler... middleware) {
        root.add(methods, path, handler, middleware);
        return this;
    }
    
    @Override
    public Router all(String path, Handler handler, Handler... middleware) {
        root.all(path, handler, middleware);
        return this;
    }
    
    @Override
    public Router use(Use first, Use... more) {
        root.use(first, more);
        return this;
    }
    
    @Override
    public Router staticFiles(String prefix, Path root, StaticConfig config) {
        this.root.staticFiles(prefix, root, config);
        return this;
    }
    
    @Override
    public Group group(String prefix, Handler... handlers) {
        return root.group(prefix, handlers);
    }
    
    @Override
    public RouteBuilder route(String path) {
        return root.route(path);
    }
    
    @Override
    public String toString() {
        return "App{groups=" + groups.size() + '}';
    }
}
