package alpha.grouprouter.route;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link StaticConfig}.
 */
final class StaticConfigTest
{
    @Test
    void defaults() {
        var c = StaticConfig.DEFAULT;
        assertThat(c.index()).isEqualTo("index.html");
        assertThat(c.browse()).isFalse();
        assertThat(c.download()).isFalse();
        assertThat(c.byteRange()).isFalse();
        assertThat(c.compress()).isFalse();
        assertThat(c.maxAge()).isZero();
    }
    
    @Test
    void builder_is_immutable() {
        var b = StaticConfig.DEFAULT.toBuilder();
        var browsing = b.browse(true).maxAge(Duration.ofMinutes(1)).build();
        assertThat(browsing.browse()).isTrue();
        assertThat(browsing.maxAge()).isEqualTo(Duration.ofMinutes(1));
        assertThat(b.build().browse()).isFalse();
        assertThat(StaticConfig.DEFAULT.browse()).isFalse();
    }
    
    @Test
    void derived_from_derived() {
        var first = StaticConfig.DEFAULT.toBuilder().index("home.html").build();
        var second = first.toBuilder().compress(true).build();
        assertThat(second.index()).isEqualTo("home.html");
        assertThat(second.compress()).isTrue();
        assertThat(first.compress()).isFalse();
    }
    
    @Test
    void blank_index() {
        assertThatThrownBy(() -> StaticConfig.DEFAULT.toBuilder().index(" "))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Index is blank.");
    }
    
    @Test
    void negative_max_age() {
        assertThatThrownBy(() -> StaticConfig.DEFAULT.toBuilder()
                    .maxAge(Duration.ofSeconds(-1)))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Negative max age: PT-1S");
    }
}
