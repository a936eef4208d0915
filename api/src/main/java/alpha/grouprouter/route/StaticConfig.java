package alpha.grouprouter.route;

import alpha.grouprouter.Router;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Options of a static file registration.<p>
 * 
 * The options are recorded together with the registration, see
 * {@link Router#staticFiles(String, Path, StaticConfig)}. How they are
 * honored is up to the file server.
 * 
 * {@snippet :
 *   group.staticFiles("/assets", Path.of("public"), StaticConfig.DEFAULT
 *           .toBuilder()
 *           .browse(true)
 *           .maxAge(Duration.ofHours(1))
 *           .build());
 * }
 * 
 * @implSpec
 * The implementation is immutable.
 */
public interface StaticConfig
{
    /**
     * Index = "index.html"<br>
     * Browse = false<br>
     * Download = false<br>
     * Byte range = false<br>
     * Compress = false<br>
     * Max age = zero
     */
    StaticConfig DEFAULT = DefaultStaticConfig.DefaultBuilder.ROOT.build();
    
    /**
     * {@return the name of the file served for a directory}
     */
    String index();
    
    /**
     * {@return whether to list the content of a directory}
     */
    boolean browse();
    
    /**
     * {@return whether to serve all files as attachments}
     */
    boolean download();
    
    /**
     * {@return whether to support byte range requests}
     */
    boolean byteRange();
    
    /**
     * {@return whether to compress file content}
     */
    boolean compress();
    
    /**
     * {@return the "Cache-Control: max-age" value of responses}<p>
     * 
     * {@code Duration.ZERO} means no header.
     */
    Duration maxAge();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder
     */
    Builder toBuilder();
    
    /**
     * Builder of a {@link StaticConfig}.<p>
     * 
     * The builder is immutable; each setter returns a new builder.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @throws IllegalArgumentException if {@code newVal} is blank
         */
        Builder index(String newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         */
        Builder browse(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         */
        Builder download(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         */
        Builder byteRange(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         */
        Builder compress(boolean newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @throws IllegalArgumentException if {@code newVal} is negative
         */
        Builder maxAge(Duration newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a new configuration
         */
        StaticConfig build();
    }
}
