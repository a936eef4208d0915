package alpha.grouprouter.core;

import alpha.grouprouter.App;
import alpha.grouprouter.AppFactory;
import alpha.grouprouter.Config;

/**
 * Default {@code AppFactory}.
 */
public class DefaultAppFactory implements AppFactory
{
    /**
     * Constructs this object.
     */
    public DefaultAppFactory() {
        // Empty
    }
    
    @Override
    public App create(Config config) {
        return new DefaultApp(config);
    }
}
