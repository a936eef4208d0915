package alpha.grouprouter.core;

import alpha.grouprouter.App;
import alpha.grouprouter.Config;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.hook.HookFailedException;
import alpha.grouprouter.hook.MountHook;
import alpha.grouprouter.route.NoRouteToNameException;
import alpha.grouprouter.route.Registration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static alpha.grouprouter.HttpConstants.Method.GET;
import static alpha.grouprouter.HttpConstants.Method.POST;
import static alpha.grouprouter.route.Registration.Kind.MIDDLEWARE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Small tests for {@link RouteTable}, mostly driven through the application.
 */
final class RouteTableTest
{
    private static final Handler H = ctx -> {};
    
    private final DefaultApp app = new DefaultApp(Config.DEFAULT);
    
    private final RouteTable testee = app.table();
    
    @Test
    void registration_order() {
        app.get("/a", H);
        app.group("/g").post("/b", H);
        app.use(H);
        
        assertThat(testee.routes())
            .extracting(Registration::path)
            .containsExactly("/a", "/g/b", "/");
    }
    
    @Test
    void routes_is_snapshot() {
        app.get("/a", H);
        List<Registration> before = app.routes();
        app.get("/b", H);
        assertThat(before).hasSize(1);
        assertThatThrownBy(() -> before.add(null))
            .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
    
    @Test
    void register_directly() {
        var r = testee.register(List.of(GET, POST), "/x", null, H, List.of());
        assertThat(r.group()).isEmpty();
        assertThat(app.routes()).containsExactly(r);
    }
    
    @Test
    void register_middleware_requires_handler() {
        assertThatThrownBy(() -> testee.registerMiddleware("/x", null, List.of()))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing handler/middleware in route: /x");
    }
    
    // Naming
    // ----
    
    @Test
    void nothing_to_name() {
        assertThatThrownBy(() -> app.name("x"))
            .isExactlyInstanceOf(NoRouteToNameException.class)
            .hasMessage("No route registered to name \"x\".");
    }
    
    @Test
    void name_targets_latest_route() {
        app.get("/a", H);
        app.get("/b", H);
        app.name("b");
        
        assertThat(app.routes())
            .extracting(r -> r.name().orElse(null))
            .containsExactly(null, "b");
        assertThat(app.namedRoute("b"))
            .map(Registration::path)
            .contains("/b");
    }
    
    @Test
    void name_targets_middleware() {
        app.use(H);
        app.name("mw");
        assertThat(app.namedRoute("mw"))
            .map(Registration::kind)
            .contains(MIDDLEWARE);
    }
    
    @Test
    void name_qualified_by_owner_group() {
        var users = app.group("/users");
        users.name("users.");
        users.get("/", H);
        // Named through another group, qualified by the owner
        app.name("index");
        assertThat(app.namedRoute("users.index")).isPresent();
    }
    
    @Test
    void rename_replaces() {
        app.get("/a", H).name("x");
        app.name("y");
        assertThat(app.namedRoute("x")).isEmpty();
        assertThat(app.namedRoute("y")).isPresent();
    }
    
    @Test
    void namedRoute_unknown() {
        app.get("/a", H).name("a");
        assertThat(app.namedRoute("b")).isEmpty();
    }
    
    // Mounting
    // ----
    
    @Test
    void mounted_routes_are_flattened() {
        var sub = new DefaultApp(Config.DEFAULT);
        sub.get("/x", H).name("x");
        app.get("/before", H);
        app.use("/sub", sub);
        app.get("/after", H);
        
        assertThat(app.routes())
            .extracting(Registration::path)
            .containsExactly("/before", "/sub/x", "/after");
        var remounted = app.routes().get(1);
        var origin = sub.routes().get(0);
        assertThat(remounted.methods()).isEqualTo(origin.methods());
        assertThat(remounted.handler()).isEqualTo(origin.handler());
        assertThat(remounted.name()).contains("x");
        assertThat(remounted).hasToString("GET /sub/x (x)");
    }
    
    @Test
    void mounted_routes_read_live() {
        var sub = new DefaultApp(Config.DEFAULT);
        app.use("/sub", sub);
        sub.get("/late", H);
        assertThat(app.routes())
            .extracting(Registration::path)
            .containsExactly("/sub/late");
        assertThat(app.namedRoute("late")).isEmpty();
        sub.name("late");
        assertThat(app.namedRoute("late")).isPresent();
    }
    
    @Test
    void nested_mounts_compose() {
        var b = new DefaultApp(Config.DEFAULT);
        var c = new DefaultApp(Config.DEFAULT);
        c.get("/x", H);
        b.use("/c", c);
        app.use("/b", b);
        assertThat(app.routes())
            .extracting(Registration::path)
            .containsExactly("/b/c/x");
    }
    
    @Test
    void mounting_into_itself() {
        assertThatThrownBy(() -> app.use("/self", app))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Can not mount an application into itself: /self");
    }
    
    @Test
    void mounting_cycle() {
        var sub = new DefaultApp(Config.DEFAULT);
        app.use("/sub", sub);
        assertThatThrownBy(() -> sub.use("/parent", app))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Can not mount an application into itself: /parent");
        assertThat(sub.mounts()).isEmpty();
    }
    
    @Test
    void same_app_mounted_twice() {
        var sub = new DefaultApp(Config.DEFAULT);
        sub.get("/x", H);
        app.use("/a", sub);
        app.use("/b", sub);
        assertThat(app.routes())
            .extracting(Registration::path)
            .containsExactly("/a/x", "/b/x");
    }
    
    @Test
    void foreign_app() {
        assertThatThrownBy(() -> app.use("/x", mock(App.class)))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Application type not supported: ");
    }
    
    @Test
    void mount_hook_of_sub_app() throws Exception {
        var sub = new DefaultApp(Config.DEFAULT);
        MountHook parentHook = mock(MountHook.class),
                  subHook = mock(MountHook.class);
        app.hooks().onMount(parentHook);
        sub.hooks().onMount(subHook);
        app.group("/g").use("/sub", sub);
        
        verify(subHook).accept(app, "/g/sub");
        verify(parentHook, never()).accept(any(), anyString());
    }
    
    @Test
    void failed_mount_hook_keeps_mount() throws Exception {
        var sub = new DefaultApp(Config.DEFAULT);
        MountHook hook = mock(MountHook.class);
        doThrow(new Exception("no")).when(hook).accept(any(), anyString());
        sub.hooks().onMount(hook);
        
        assertThatThrownBy(() -> app.use("/sub", sub))
            .isExactlyInstanceOf(HookFailedException.class)
            .hasMessage("Hook onMount failed for: /sub");
        assertThat(app.mounts()).hasSize(1);
    }
}
