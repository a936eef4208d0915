package alpha.grouprouter.core;

import alpha.grouprouter.App;
import alpha.grouprouter.Config;
import alpha.grouprouter.handler.ErrorHandler;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.route.Use;
import org.junit.jupiter.api.Test;

import static alpha.grouprouter.HttpConstants.Method.GET;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link DefaultApp}.
 */
final class DefaultAppTest
{
    private static final Handler H = ctx -> {};
    
    @Test
    void create_through_service_loader() {
        App testee = App.create();
        assertThat(testee).isExactlyInstanceOf(DefaultApp.class);
        assertThat(testee.config()).isSameAs(Config.DEFAULT);
    }
    
    @Test
    void create_with_config() {
        var cfg = Config.configuration().requestMethods(GET).build();
        assertThat(App.create(cfg).config()).isSameAs(cfg);
    }
    
    @Test
    void root_group() {
        App testee = App.create();
        var root = testee.root();
        assertThat(root.prefix()).isEqualTo("/");
        assertThat(root.parent()).isEmpty();
        assertThat(root.app()).isSameAs(testee);
        assertThat(testee.groups()).containsExactly(root);
    }
    
    @Test
    void verbs_delegate_to_root() {
        App testee = App.create();
        testee.get("/x", H);
        assertThat(testee.root().anyRouteDefined()).isTrue();
        assertThat(testee.routes().get(0).group()).containsSame(testee.root());
    }
    
    @Test
    void groups_of_app_are_children_of_root() {
        App testee = App.create();
        var g = testee.group("/g");
        assertThat(g.parent()).containsSame(testee.root());
    }
    
    @Test
    void app_name_always_names_route() {
        App testee = App.create();
        testee.get("/x", H);
        testee.group("/g");
        testee.name("x");
        assertThat(testee.namedRoute("x")).isPresent();
        assertThat(testee.root().name()).isEmpty();
    }
    
    // Error handlers
    // ----
    
    private static final ErrorHandler
            PARENT = (exc, ctx) -> {},
            SUB    = (exc, ctx) -> {},
            DEEP   = (exc, ctx) -> {};
    
    private static DefaultApp app(ErrorHandler eh) {
        return new DefaultApp(Config.configuration().errorHandler(eh).build());
    }
    
    @Test
    void error_handler_of_app() {
        var testee = app(PARENT);
        assertThat(testee.errorHandlers("/anything")).containsExactly(PARENT);
    }
    
    @Test
    void error_handlers_of_mounted_app() {
        var testee = app(PARENT);
        testee.use("/api", app(SUB));
        
        assertThat(testee.errorHandlers("/api/users")).containsExactly(SUB, PARENT);
        assertThat(testee.errorHandlers("/api")).containsExactly(SUB, PARENT);
        assertThat(testee.errorHandlers("/apix")).containsExactly(PARENT);
        assertThat(testee.errorHandlers("/")).containsExactly(PARENT);
    }
    
    @Test
    void error_handlers_longest_mount() {
        var testee = app(PARENT);
        testee.use("/a", app(SUB));
        testee.use("/a/b", app(DEEP));
        assertThat(testee.errorHandlers("/a/b/c")).containsExactly(DEEP, PARENT);
        assertThat(testee.errorHandlers("/a/c")).containsExactly(SUB, PARENT);
    }
    
    @Test
    void error_handlers_nested_mounts() {
        var testee = app(PARENT);
        var sub = app(SUB);
        sub.use("/deep", app(DEEP));
        testee.use("/sub", sub);
        assertThat(testee.errorHandlers("/sub/deep/x")).containsExactly(DEEP, SUB, PARENT);
    }
    
    @Test
    void error_handlers_root_mount() {
        var testee = app(PARENT);
        testee.use(Use.app(app(SUB)));
        assertThat(testee.errorHandlers("/x")).containsExactly(SUB, PARENT);
    }
    
    @Test
    void error_handlers_follow_reconfiguration() {
        var testee = app(PARENT);
        testee.reconfigure(Config.configuration().errorHandler(SUB).build());
        assertThat(testee.errorHandlers("/")).containsExactly(SUB);
    }
}
