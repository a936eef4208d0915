package alpha.grouprouter.route;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static alpha.grouprouter.route.PathComposer.compose;
import static alpha.grouprouter.route.PathComposer.normalize;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link PathComposer}.
 */
final class PathComposerTest
{
    @Test
    void child_appended() {
        assertThat(compose("/api", "/v1")).isEqualTo("/api/v1");
    }
    
    @Test
    void child_without_slash() {
        assertThat(compose("/api", "v1")).isEqualTo("/api/v1");
    }
    
    @Test
    void empty_child_is_parent() {
        assertThat(compose("/api", "")).isEqualTo("/api");
        assertThat(compose("/", "")).isEqualTo("/");
    }
    
    @Test
    void root_parent() {
        assertThat(compose("/", "/users")).isEqualTo("/users");
        assertThat(compose("/", "/")).isEqualTo("/");
    }
    
    // compose(compose(a, b), c) == compose(a, compose(b, c))
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "/     | /a    | /b  ",
        "/api  | v1    | /x/ ",
        "/api/ | /v1// | y   ",
        "/     | /     | /   ",
        "/a    | b     | c   " })
    void associative(String a, String b, String c) {
        assertThat(compose(compose(a, b), c))
            .isEqualTo(compose(a, compose(b, c)));
    }
    
    @Test
    void associative_empty_middle() {
        assertThat(compose(compose("/a", ""), "/c"))
            .isEqualTo(compose("/a", compose("", "/c")))
            .isEqualTo("/a/c");
    }
    
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "''        | /",
        "/         | /",
        "//        | /",
        "a         | /a",
        "/a/       | /a",
        "//a///b// | /a/b",
        "/a/:id    | /a/:id" })
    void normalized(String path, String expected) {
        assertThat(normalize(path)).isEqualTo(expected);
    }
    
    @Test
    void null_args() {
        assertThatThrownBy(() -> compose(null, "/a"))
            .isExactlyInstanceOf(NullPointerException.class)
            .hasMessage("parentPrefix");
        assertThatThrownBy(() -> compose("/a", null))
            .isExactlyInstanceOf(NullPointerException.class)
            .hasMessage("childPath");
    }
}
