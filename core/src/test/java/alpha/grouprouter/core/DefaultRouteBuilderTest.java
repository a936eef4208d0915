package alpha.grouprouter.core;

import alpha.grouprouter.Config;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.route.Registration;
import alpha.grouprouter.route.RouteBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static alpha.grouprouter.HttpConstants.Method.DELETE;
import static alpha.grouprouter.HttpConstants.Method.GET;
import static alpha.grouprouter.HttpConstants.Method.POST;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link DefaultRouteBuilder}.
 */
final class DefaultRouteBuilderTest
{
    private static final Handler H = ctx -> {};
    
    private final DefaultApp app = new DefaultApp(Config.DEFAULT);
    
    @Test
    void chained_verbs_share_path() {
        RouteBuilder testee = app.route("/items");
        testee.get(H).post(H).delete(H);
        
        assertThat(testee.path()).isEqualTo("/items");
        assertThat(app.routes())
            .extracting(Registration::methods)
            .containsExactly(List.of(GET), List.of(POST), List.of(DELETE));
        assertThat(app.routes())
            .allSatisfy(r -> {
                assertThat(r.path()).isEqualTo("/items");
                assertThat(r.group()).isEmpty();
            });
    }
    
    @Test
    void nested_route() {
        RouteBuilder testee = app.group("/api").route("/users").route(":id");
        testee.put(H);
        assertThat(testee.path()).isEqualTo("/api/users/:id");
        assertThat(app.routes().get(0).path()).isEqualTo("/api/users/:id");
    }
    
    @Test
    void all_uses_configured_methods() {
        app.reconfigure(Config.configuration().requestMethods(GET).build());
        app.route("/x").all(H);
        assertThat(app.routes().get(0).methods()).containsExactly(GET);
    }
    
    @Test
    void app_name_targets_builder_route() {
        app.route("/x").get(H);
        app.name("x");
        assertThat(app.namedRoute("x")).isPresent();
    }
}
