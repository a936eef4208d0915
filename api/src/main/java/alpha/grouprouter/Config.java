package alpha.grouprouter;

import alpha.grouprouter.HttpConstants.Method;
import alpha.grouprouter.handler.ErrorHandler;

import java.util.List;

/**
 * Application configuration.<p>
 * 
 * {@link Config#toBuilder()} allows for any configuration object to be used
 * as a template for a new instance. The static method
 * {@link #configuration()} is a shortcut for
 * {@code Config.}{@link #DEFAULT}{@code .toBuilder()}:
 * 
 * {@snippet :
 *    App app = App.create(configuration()
 *            .requestMethods("GET", "POST")
 *            .build());
 * }
 * 
 * An application reads its configuration each time it needs a value. A
 * configuration swapped using {@link App#reconfigure(Config)} is therefore
 * observed by all subsequent calls, for example {@link Router#all(String,
 * alpha.grouprouter.handler.Handler, alpha.grouprouter.handler.Handler...)
 * Router.all()}.
 * 
 * @implSpec
 * The implementation is immutable.
 */
public interface Config
{
    /**
     * The configuration used by {@link App#create()}.<p>
     * 
     * This instance contains the following values:
     * 
     * Request methods = GET, HEAD, POST, PUT, DELETE, CONNECT, OPTIONS,
     * TRACE, PATCH<br>
     * Error handler = {@link ErrorHandler#BASE}
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns a builder with {@link #DEFAULT} values.
     * 
     * @return a builder
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * {@return the request methods recognized by the application}<p>
     * 
     * This is the set of methods a route registered using {@code all()} will
     * be registered for. The returned list is unmodifiable, never empty and
     * ordered as given to the builder.<p>
     * 
     * The {@link #DEFAULT} configuration returns {@link Method#ALL}.
     */
    List<String> requestMethods();
    
    /**
     * {@return the application's error handler}<p>
     * 
     * The {@link #DEFAULT} configuration returns {@link ErrorHandler#BASE}.
     */
    ErrorHandler errorHandler();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable; each setter returns a new builder.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param first method
         * @param more methods
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if any argument or element is {@code null}
         * 
         * @see Config#requestMethods()
         */
        Builder requestMethods(String first, String... more);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code newVal} or an element is {@code null}
         * @throws IllegalArgumentException
         *             if {@code newVal} is empty
         * 
         * @see Config#requestMethods()
         */
        Builder requestMethods(List<String> newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * 
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code newVal} is {@code null}
         * 
         * @see Config#errorHandler()
         */
        Builder errorHandler(ErrorHandler newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a new configuration
         */
        Config build();
    }
}
