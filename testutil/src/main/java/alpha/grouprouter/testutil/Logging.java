package alpha.grouprouter.testutil;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Handler;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static alpha.grouprouter.testutil.LogRecords.toJUL;

/**
 * Configures the JUL loggers that back the platform loggers of the library.<p>
 * 
 * A logger is addressed by the package of a component class, which is also
 * how the library names its loggers. JUL holds its loggers weakly, so every
 * logger touched by this class is also held here for the lifetime of the JVM.
 */
public final class Logging {
    private Logging() {
        // Empty
    }
    
    private static final Set<Logger> HELD = ConcurrentHashMap.newKeySet();
    
    private static volatile Handler console;
    
    /**
     * Sets the level of the component's package logger.<p>
     * 
     * The first call also installs a handler on the root logger which prints
     * records of any level to {@code System.out}, one line each.
     * 
     * @param component whose package names the logger
     * @param level to set
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static void setLevel(Class<?> component, System.Logger.Level level) {
        logger(component).setLevel(toJUL(level));
        installConsole();
    }
    
    /**
     * Adds a handler to the component's package logger.
     * 
     * @param component whose package names the logger
     * @param handler to add
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static void addHandler(Class<?> component, Handler handler) {
        logger(component).addHandler(handler);
    }
    
    /**
     * Removes a handler from the component's package logger, if present.
     * 
     * @param component whose package names the logger
     * @param handler to remove
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        logger(component).removeHandler(handler);
    }
    
    private static Logger logger(Class<?> component) {
        var l = Logger.getLogger(component.getPackageName());
        HELD.add(l);
        return l;
    }
    
    private static synchronized void installConsole() {
        if (console != null) {
            return;
        }
        var h = new StreamHandler(System.out, new LogRecords.OneLineFormatter()) {
            @Override
            public synchronized void publish(java.util.logging.LogRecord r) {
                super.publish(r);
                flush();
            }
        };
        h.setLevel(java.util.logging.Level.ALL);
        Logger.getLogger("").addHandler(h);
        console = h;
    }
}
