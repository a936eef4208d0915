package alpha.grouprouter;

import java.util.List;

/**
 * Namespace of constants related to the HTTP protocol.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * HTTP request methods.<p>
     * 
     * The method token is a case-sensitive string and can be anything. The
     * constants declared in this class are the ones registered in the
     * <a href="https://www.iana.org/assignments/http-methods">IANA method registry</a>
     * that the library recognizes by default, see
     * {@link Config#requestMethods()}.
     */
    public static final class Method {
        private Method() {
            // Private
        }
        
        /**
         * Used to retrieve a server resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.1">RFC 7231 §4.3.1</a>
         */
        public static final String GET = "GET";
        
        /**
         * Same as {@link #GET}, except the response must exclude the message
         * body.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.2">RFC 7231 §4.3.2</a>
         */
        public static final String HEAD = "HEAD";
        
        /**
         * Submits an entity to the target resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.3">RFC 7231 §4.3.3</a>
         */
        public static final String POST = "POST";
        
        /**
         * Replaces the target resource with the request payload.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.4">RFC 7231 §4.3.4</a>
         */
        public static final String PUT = "PUT";
        
        /**
         * Removes the target resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.5">RFC 7231 §4.3.5</a>
         */
        public static final String DELETE = "DELETE";
        
        /**
         * Establishes a tunnel to the server identified by the target
         * resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.6">RFC 7231 §4.3.6</a>
         */
        public static final String CONNECT = "CONNECT";
        
        /**
         * Describes the communication options for the target resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.7">RFC 7231 §4.3.7</a>
         */
        public static final String OPTIONS = "OPTIONS";
        
        /**
         * Performs a message loop-back test along the path to the target
         * resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.8">RFC 7231 §4.3.8</a>
         */
        public static final String TRACE = "TRACE";
        
        /**
         * Applies partial modifications to the target resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc5789">RFC 5789</a>
         */
        public static final String PATCH = "PATCH";
        
        /**
         * All methods declared in this class, in declaration order.
         */
        public static final List<String> ALL = List.of(
                GET, HEAD, POST, PUT, DELETE, CONNECT, OPTIONS, TRACE, PATCH);
    }
}
