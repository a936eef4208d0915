package alpha.grouprouter;

import alpha.grouprouter.handler.ErrorHandler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static alpha.grouprouter.HttpConstants.Method.GET;
import static alpha.grouprouter.HttpConstants.Method.POST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Config}.
 */
final class ConfigTest
{
    @Test
    void defaults() {
        assertThat(Config.DEFAULT.requestMethods())
            .isEqualTo(HttpConstants.Method.ALL)
            .hasSize(9);
        assertThat(Config.DEFAULT.errorHandler()).isSameAs(ErrorHandler.BASE);
    }
    
    @Test
    void configuration_starts_from_default() {
        assertThat(Config.configuration().build().requestMethods())
            .isEqualTo(Config.DEFAULT.requestMethods());
    }
    
    @Test
    void builder_is_immutable() {
        var b = Config.configuration();
        var narrow = b.requestMethods(GET, POST).build();
        assertThat(narrow.requestMethods()).containsExactly(GET, POST);
        assertThat(b.build().requestMethods()).hasSize(9);
        assertThat(Config.DEFAULT.requestMethods()).hasSize(9);
    }
    
    @Test
    void methods_list_copied() {
        var source = new java.util.ArrayList<>(List.of(GET));
        var c = Config.configuration().requestMethods(source).build();
        source.add(POST);
        assertThat(c.requestMethods()).containsExactly(GET);
    }
    
    @Test
    void no_methods() {
        assertThatThrownBy(() -> Config.configuration().requestMethods(List.of()))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("No request methods.");
    }
    
    @Test
    void base_error_handler_rethrows() {
        var exc = new IllegalStateException("boom");
        assertThatThrownBy(() -> ErrorHandler.BASE.apply(exc, null))
            .isSameAs(exc);
    }
}
