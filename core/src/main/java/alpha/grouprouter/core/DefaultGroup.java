package alpha.grouprouter.core;

import alpha.grouprouter.App;
import alpha.grouprouter.Group;
import alpha.grouprouter.Router;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.route.IllegalUseArgumentException;
import alpha.grouprouter.route.RouteBuilder;
import alpha.grouprouter.route.StaticConfig;
import alpha.grouprouter.route.Use;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

import static alpha.grouprouter.route.PathComposer.compose;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Group}.<p>
 * 
 * The prefix, parent and application are immutable. The name is written only
 * while holding the application's naming lock. The flag {@code
 * anyRouteDefined} is written by the registering methods, which are not
 * synchronized.
 */
final class DefaultGroup implements Group
{
    private static final System.Logger LOG
            = System.getLogger(DefaultGroup.class.getPackageName());
    
    private final DefaultApp app;
    private final String prefix;
    // Null for root
    private final DefaultGroup parent;
    private volatile String name;
    private boolean anyRouteDefined;
    
    DefaultGroup(DefaultApp app, String prefix, DefaultGroup parent) {
        this.app    = app;
        this.prefix = prefix;
        this.parent = parent;
    }
    
    @Override
    public String prefix() {
        return prefix;
    }
    
    @Override
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }
    
    @Override
    public Optional<Group> parent() {
        return Optional.ofNullable(parent);
    }
    
    @Override
    public App app() {
        return app;
    }
    
    @Override
    public boolean anyRouteDefined() {
        return anyRouteDefined;
    }
    
    @Override
    public Snapshot snapshot() {
        return new Snapshot(prefix, name, parent == null ? null : parent.name);
    }
    
    @Override
    public Router add(List<String> methods, String path, Handler handler, Handler... middleware) {
        app.table().register(
                methods, compose(prefix, path), this, handler, List.of(middleware));
        anyRouteDefined = true;
        return this;
    }
    
    @Override
    public Router all(String path, Handler handler, Handler... middleware) {
        // Read anew on each call; the app may have been reconfigured
        return add(app.config().requestMethods(), path, handler, middleware);
    }
    
    @Override
    public Router use(Use first, Use... more) {
        var args = new Arguments();
        args.accept(0, first);
        for (int i = 0; i < more.length; ++i) {
            args.accept(i + 1, more[i]);
        }
        
        if (args.subApp == null && args.handlers.isEmpty()) {
            throw new IllegalUseArgumentException(
                    "Expected at least one middleware or an application.");
        }
        
        List<String> prefixes = args.prefixes.isEmpty() ?
                List.of(args.prefix) : args.prefixes;
        
        for (String p : prefixes) {
            if (args.subApp != null) {
                mount(p, args.subApp);
                return this;
            }
            app.table().registerMiddleware(compose(prefix, p), this, args.handlers);
            // Per prefix; a later prefix may be rejected by a hook
            anyRouteDefined = true;
        }
        return this;
    }
    
    private void mount(String path, App subApp) {
        app.table().mount(compose(prefix, path), subApp);
        anyRouteDefined = true;
    }
    
    /**
     * Sorts the arguments of a use-call.
     */
    private static final class Arguments implements Use.Classifier {
        String prefix = "";
        List<String> prefixes = List.of();
        App subApp;
        final List<Handler> handlers = new ArrayList<>();
        
        void accept(int pos, Use arg) {
            if (arg == null) {
                throw new IllegalUseArgumentException(
                        "Invalid use() argument at position " + pos + ": null");
            }
            arg.classify(this);
        }
        
        @Override
        public void prefix(String path) {
            prefix = path;
        }
        
        @Override
        public void prefixes(List<String> paths) {
            prefixes = paths;
        }
        
        @Override
        public void mount(App subApp) {
            this.subApp = subApp;
        }
        
        @Override
        public void middleware(Handler handler) {
            handlers.add(handler);
        }
    }
    
    @Override
    public Router staticFiles(String prefix, Path root, StaticConfig config) {
        app.table().registerStatic(compose(this.prefix, prefix), this, root, config);
        anyRouteDefined = true;
        return this;
    }
    
    @Override
    public Router name(String name) {
        requireNonNull(name);
        if (anyRouteDefined) {
            app.table().name(name);
            return this;
        }
        
        final Lock mutex = app.mutex();
        mutex.lock();
        try {
            this.name = parent == null ? name : nameOrEmpty(parent) + name;
            LOG.log(DEBUG, () -> "Named group " + prefix + ": " + this.name);
            app.hooksImpl().executeOnGroupName(snapshot());
        } finally {
            mutex.unlock();
        }
        return this;
    }
    
    private static String nameOrEmpty(DefaultGroup g) {
        String n = g.name;
        return n == null ? "" : n;
    }
    
    @Override
    public Group group(String prefix, Handler... handlers) {
        final String path = compose(this.prefix, prefix);
        if (handlers.length > 0) {
            // On behalf of this group, but not a verb; naming mode unaffected
            app.table().registerMiddleware(path, this, List.of(handlers));
        }
        var child = new DefaultGroup(app, path, this);
        app.hooksImpl().executeOnGroup(child.snapshot());
        app.adopt(child);
        LOG.log(DEBUG, () -> "Created group: " + path);
        return child;
    }
    
    @Override
    public RouteBuilder route(String path) {
        return new DefaultRouteBuilder(app, compose(prefix, path));
    }
    
    @Override
    public String toString() {
        return "Group{prefix=" + prefix + ", name=" + name + '}';
    }
}
