package alpha.grouprouter.route;

import alpha.grouprouter.App;
import alpha.grouprouter.Router;
import alpha.grouprouter.handler.Handler;
import alpha.grouprouter.util.Arrays;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An argument of {@link Router#use(Use, Use...)}.<p>
 * 
 * The arguments of a {@code use()} call are one of four kinds:
 * 
 * <ul>
 *   <li>{@link Prefix}, the path relative to the group where the middleware
 *       applies (a repeated prefix replaces the former)</li>
 *   <li>{@link Prefixes}, many paths where the same middleware applies</li>
 *   <li>{@link Mount}, an application to mount</li>
 *   <li>{@link Middleware}, a handler to register (order is preserved)</li>
 * </ul>
 * 
 * {@snippet :
 *   group.use(prefixes("/a", "/b"), handler(auth), handler(audit));
 *   group.use(prefix("/admin"), app(adminApp));
 * }
 * 
 * Most applications will find the convenience overloads of {@code use()}
 * sufficient.
 */
public sealed interface Use
{
    /**
     * Creates a {@link Prefix}.
     * 
     * @param path relative to the group
     * @return a use-argument
     * @throws NullPointerException if {@code path} is {@code null}
     */
    static Use prefix(String path) {
        return new Prefix(path);
    }
    
    /**
     * Creates a {@link Prefixes}.
     * 
     * @param first path relative to the group
     * @param more paths relative to the group
     * @return a use-argument
     * @throws NullPointerException if any argument is {@code null}
     */
    static Use prefixes(String first, String... more) {
        return new Prefixes(Arrays.listOf(first, more));
    }
    
    /**
     * Creates a {@link Prefixes}.
     * 
     * @param paths relative to the group
     * @return a use-argument
     * @throws NullPointerException if {@code paths} or an element is {@code null}
     */
    static Use prefixes(List<String> paths) {
        return new Prefixes(paths);
    }
    
    /**
     * Creates a {@link Mount}.
     * 
     * @param subApp application to mount
     * @return a use-argument
     * @throws NullPointerException if {@code subApp} is {@code null}
     */
    static Use app(App subApp) {
        return new Mount(subApp);
    }
    
    /**
     * Creates a {@link Middleware}.
     * 
     * @param handler to register
     * @return a use-argument
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    static Use handler(Handler handler) {
        return new Middleware(handler);
    }
    
    /**
     * Passes this argument to the classifier method of its kind.
     * 
     * @param c classifier
     */
    void classify(Classifier c);
    
    /**
     * Receives use-arguments by kind.
     */
    interface Classifier {
        /**
         * Receives a prefix.
         * 
         * @param path relative to the group
         */
        void prefix(String path);
        
        /**
         * Receives a list of prefixes.
         * 
         * @param paths relative to the group
         */
        void prefixes(List<String> paths);
        
        /**
         * Receives an application to mount.
         * 
         * @param subApp to mount
         */
        void mount(App subApp);
        
        /**
         * Receives a middleware.
         * 
         * @param handler to register
         */
        void middleware(Handler handler);
    }
    
    /**
     * A path relative to the group.
     * 
     * @param path relative to the group (may be empty)
     */
    record Prefix(String path) implements Use {
        /**
         * Initializes this object.
         * 
         * @param path relative to the group (may be empty)
         * @throws NullPointerException if {@code path} is {@code null}
         */
        public Prefix {
            requireNonNull(path);
        }
        
        @Override
        public void classify(Classifier c) {
            c.prefix(path);
        }
    }
    
    /**
     * Paths relative to the group.
     * 
     * @param paths relative to the group
     */
    record Prefixes(List<String> paths) implements Use {
        /**
         * Initializes this object.
         * 
         * @param paths relative to the group
         * @throws NullPointerException if {@code paths} or an element is {@code null}
         */
        public Prefixes {
            paths = List.copyOf(paths);
        }
        
        @Override
        public void classify(Classifier c) {
            c.prefixes(paths);
        }
    }
    
    /**
     * An application to mount.
     * 
     * @param subApp to mount
     */
    record Mount(App subApp) implements Use {
        /**
         * Initializes this object.
         * 
         * @param subApp to mount
         * @throws NullPointerException if {@code subApp} is {@code null}
         */
        public Mount {
            requireNonNull(subApp);
        }
        
        @Override
        public void classify(Classifier c) {
            c.mount(subApp);
        }
    }
    
    /**
     * A middleware handler.
     * 
     * @param handler the middleware
     */
    record Middleware(Handler handler) implements Use {
        /**
         * Initializes this object.
         * 
         * @param handler the middleware
         * @throws NullPointerException if {@code handler} is {@code null}
         */
        public Middleware {
            requireNonNull(handler);
        }
        
        @Override
        public void classify(Classifier c) {
            c.middleware(handler);
        }
    }
}
