package alpha.grouprouter.core;

import alpha.grouprouter.Group;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.route.Registration;
import alpha.grouprouter.route.StaticConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Default implementation of {@link Registration}.<p>
 * 
 * All fields are final, except the name, which is written by the
 * {@link RouteTable} while holding the application's naming lock.
 */
final class DefaultRegistration implements Registration
{
    private final Kind          kind;
    private final List<String>  methods;
    private final String        path;
    // All nullable
    private final Group         group;
    private final Handler       handler;
    private final List<Handler> middleware;
    private final Path          root;
    private final StaticConfig  staticConfig;
    private volatile String     name;
    
    static DefaultRegistration route(
            List<String> methods, String path, Group group,
            Handler handler, List<Handler> middleware) {
        return new DefaultRegistration(Kind.ROUTE,
                methods, path, group, handler, middleware, null, null);
    }
    
    static DefaultRegistration middleware(
            String path, Group group, List<Handler> middleware) {
        return new DefaultRegistration(Kind.MIDDLEWARE,
                List.of(ANY_METHOD), path, group, null, middleware, null, null);
    }
    
    static DefaultRegistration files(
            List<String> methods, String path, Group group,
            Path root, StaticConfig config) {
        return new DefaultRegistration(Kind.STATIC,
                methods, path, group, null, List.of(), root, config);
    }
    
    private DefaultRegistration(
            Kind kind, List<String> methods, String path, Group group,
            Handler handler, List<Handler> middleware,
            Path root, StaticConfig staticConfig)
    {
        this.kind         = kind;
        this.methods      = List.copyOf(methods);
        this.path         = path;
        this.group        = group;
        this.handler      = handler;
        this.middleware   = List.copyOf(middleware);
        this.root         = root;
        this.staticConfig = staticConfig;
    }
    
    @Override
    public Kind kind() {
        return kind;
    }
    
    @Override
    public List<String> methods() {
        return methods;
    }
    
    @Override
    public String path() {
        return path;
    }
    
    @Override
    public Optional<Group> group() {
        return Optional.ofNullable(group);
    }
    
    @Override
    public Optional<Handler> handler() {
        return Optional.ofNullable(handler);
    }
    
    @Override
    public List<Handler> middleware() {
        return middleware;
    }
    
    @Override
    public Optional<Path> root() {
        return Optional.ofNullable(root);
    }
    
    @Override
    public Optional<StaticConfig> staticConfig() {
        return Optional.ofNullable(staticConfig);
    }
    
    @Override
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }
    
    void name(String qualified) {
        name = qualified;
    }
    
    @Override
    public String toString() {
        return toString(this);
    }
    
    static String toString(Registration r) {
        var s = String.join("|", r.methods()) + ' ' + r.path();
        return r.name().map(n -> s + " (" + n + ')').orElse(s);
    }
}
