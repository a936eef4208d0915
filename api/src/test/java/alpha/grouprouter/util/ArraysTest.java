package alpha.grouprouter.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Arrays}.
 */
final class ArraysTest
{
    @Test
    void listOf_order() {
        assertThat(Arrays.listOf("a", "b", "c")).containsExactly("a", "b", "c");
    }
    
    @Test
    void listOf_unmodifiable() {
        assertThatThrownBy(() -> Arrays.listOf("a").add("b"))
            .isExactlyInstanceOf(UnsupportedOperationException.class);
    }
    
    @Test
    void listOf_null() {
        assertThatThrownBy(() -> Arrays.listOf("a", (String) null))
            .isExactlyInstanceOf(NullPointerException.class);
    }
}
