package alpha.grouprouter.core;

import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.route.PathComposer;
import alpha.grouprouter.route.RouteBuilder;

import java.util.List;

/**
 * Default implementation of {@link RouteBuilder}.<p>
 * 
 * Registers without a group.
 */
final class DefaultRouteBuilder implements RouteBuilder
{
    private final DefaultApp app;
    private final String path;
    
    DefaultRouteBuilder(DefaultApp app, String path) {
        this.app  = app;
        this.path = path;
    }
    
    @Override
    public String path() {
        return path;
    }
    
    @Override
    public RouteBuilder add(List<String> methods, Handler handler, Handler... middleware) {
        app.table().register(methods, path, null, handler, List.of(middleware));
        return this;
    }
    
    @Override
    public RouteBuilder all(Handler handler, Handler... middleware) {
        return add(app.config().requestMethods(), handler, middleware);
    }
    
    @Override
    public RouteBuilder route(String path) {
        return new DefaultRouteBuilder(app, PathComposer.compose(this.path, path));
    }
    
    @Override
    public String toString() {
        return "RouteBuilder{path=" + path + '}';
    }
}
