package alpha.grouprouter.route;

import static java.util.Objects.requireNonNull;

/**
 * Composes the absolute path of a registration from a group's prefix and a
 * path relative to the group.<p>
 * 
 * A normalized path begins with exactly one '/', never contains clustered
 * forward slashes, and never ends with a '/' unless the path is the root
 * {@code "/"} itself. For example:
 * 
 * <pre>
 *   compose("/api", "/v1")     = "/api/v1"
 *   compose("/api/", "v1/")    = "/api/v1"
 *   compose("/api", "")        = "/api"
 *   compose("", "")            = "/"
 *   compose("/", "//users//")  = "/users"
 * </pre>
 * 
 * Composition is associative; {@code compose(compose(a, b), c)} is equal to
 * {@code compose(a, compose(b, c))}. Path parameter tokens such as
 * {@code ":id"} or {@code "*"} carry no special meaning and are kept as-is.
 */
public final class PathComposer
{
    private PathComposer() {
        // Empty
    }
    
    /**
     * Composes a parent prefix and a child path into a normalized absolute
     * path.<p>
     * 
     * If {@code childPath} is empty, the normalized {@code parentPrefix} is
     * returned.
     * 
     * @param parentPrefix the group's prefix (may be empty)
     * @param childPath relative to parent (may be empty)
     * 
     * @return a normalized absolute path
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static String compose(String parentPrefix, String childPath) {
        requireNonNull(parentPrefix, "parentPrefix");
        requireNonNull(childPath, "childPath");
        return childPath.isEmpty() ?
                normalize(parentPrefix) :
                normalize(parentPrefix + '/' + childPath);
    }
    
    /**
     * Normalizes the given path.
     * 
     * @param path to normalize (may be empty)
     * 
     * @return a normalized absolute path
     * 
     * @throws NullPointerException
     *             if {@code path} is {@code null}
     */
    public static String normalize(String path) {
        final int len = path.length();
        StringBuilder b = new StringBuilder(len + 1).append('/');
        for (int i = 0; i < len; ++i) {
            char c = path.charAt(i);
            if (c == '/' && b.charAt(b.length() - 1) == '/') {
                continue;
            }
            b.append(c);
        }
        int last = b.length() - 1;
        if (last > 0 && b.charAt(last) == '/') {
            b.setLength(last);
        }
        return b.toString();
    }
}
