package alpha.grouprouter.util;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Utils for working with the "first, more..." argument convention.
 */
public final class Arrays {
    private Arrays() {
        // Empty
    }
    
    /**
     * Copies the given arguments into an unmodifiable list.
     * 
     * @param first arg
     * @param more args
     * @param <T> type of element
     * 
     * @return an unmodifiable list
     * 
     * @throws NullPointerException
     *             if any argument or element is {@code null}
     */
    @SafeVarargs
    public static <T> List<T> listOf(T first, T... more) {
        var l = new ArrayList<T>(1 + more.length);
        l.add(requireNonNull(first));
        for (T t : more) {
            l.add(requireNonNull(t));
        }
        return unmodifiableList(l);
    }
}
