package alpha.grouprouter.route;

import alpha.grouprouter.RouterSetupException;

import java.io.Serial;

/**
 * Thrown when a name is given to the most recently registered route, but no
 * route has been registered.
 */
public class NoRouteToNameException extends RouterSetupException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code NoRouteToNameException}.
     * 
     * @param name the rejected name
     */
    public NoRouteToNameException(String name) {
        super("No route registered to name \"" + name + "\".");
    }
}
