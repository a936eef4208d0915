package alpha.grouprouter.testutil;

import org.assertj.core.groups.Tuple;

import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static java.time.temporal.ChronoUnit.MILLIS;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Conversions between the platform logger's vocabulary and JUL's.
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Returns a level and message pair, comparable with the result of
     * extracting {@code getLevel} and {@code getMessage} from a JUL record.
     * 
     * @param level platform level
     * @param msg expected message
     * @return an AssertJ tuple
     * 
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     */
    public static Tuple rec(System.Logger.Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Maps a platform level to the JUL level it is published as.<p>
     * 
     * The mapping is the one applied by the JDK's default logger finder,
     * for example {@code DEBUG} is published as {@code FINE}.
     * 
     * @param level platform level
     * @return the JUL level
     * 
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     */
    static Level toJUL(System.Logger.Level level) {
        switch (level) {
            case ALL:     return Level.ALL;
            case TRACE:   return Level.FINER;
            case DEBUG:   return Level.FINE;
            case INFO:    return Level.INFO;
            case WARNING: return Level.WARNING;
            case ERROR:   return Level.SEVERE;
            case OFF:     return Level.OFF;
            default:
                throw new AssertionError("Unknown level: " + level);
        }
    }
    
    /**
     * One line per record; time, thread, level, logger and message.
     */
    static final class OneLineFormatter extends Formatter {
        @Override
        public String format(LogRecord r) {
            var line = r.getInstant().truncatedTo(MILLIS) + " [" +
                       Thread.currentThread().getName() + "] " +
                       r.getLevel().getName() + ' ' +
                       r.getLoggerName() + ": " +
                       formatMessage(r) + '\n';
            return r.getThrown() == null ? line :
                    line + r.getThrown() + '\n';
        }
    }
}
