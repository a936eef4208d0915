package alpha.grouprouter.testutil;

import java.util.Arrays;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.stream.Stream;

import static alpha.grouprouter.testutil.LogRecords.rec;
import static alpha.grouprouter.testutil.LogRecords.toJUL;
import static java.util.Comparator.comparing;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Captures the records published by one or more package loggers, for
 * assertions.<p>
 * 
 * A record reaches the recorder only if the logger's level lets it through,
 * see {@link Logging#setLevel(Class, System.Logger.Level)}.<p>
 * 
 * {@code assertRemove} consumes the matched record, so that a test can first
 * tick off the records it provoked and then assert that nothing troublesome
 * is left:
 * <pre>
 *     recorder.assertRemove(DEBUG, "Hook onRoute rejected")
 *             .assertNoProblem();
 * </pre>
 */
public final class LogRecorder
{
    /**
     * Starts recording the package loggers of the given components.<p>
     * 
     * The recording must be stopped with {@link #stopRecording()}.
     * 
     * @param first component
     * @param more components
     * 
     * @return a new recorder
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static LogRecorder startRecording(Class<?> first, Class<?>... more) {
        var sinks = Stream.concat(Stream.of(first), Arrays.stream(more))
                .map(Sink::new)
                .toArray(Sink[]::new);
        for (Sink s : sinks) {
            Logging.addHandler(s.component, s);
        }
        return new LogRecorder(sinks);
    }
    
    private final Sink[] sinks;
    
    private LogRecorder(Sink[] sinks) {
        this.sinks = sinks;
    }
    
    /**
     * Removes the earliest record with the given level whose message starts
     * with the given text.
     * 
     * @param level of record
     * @param messageStartsWith prefix of message
     * 
     * @return this for chaining
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if no record matches
     */
    public LogRecorder assertRemove(System.Logger.Level level, String messageStartsWith) {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        Predicate<LogRecord> match = r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith);
        for (Sink s : sinks) {
            if (s.records.removeIf(firstOnly(match))) {
                return this;
            }
        }
        return fail("No " + level + " record starting with: " + messageStartsWith);
    }
    
    /**
     * Asserts that exactly one record has the given level and message.
     * 
     * @param level of record
     * @param message of record
     * 
     * @return this for chaining
     * 
     * @throws AssertionError
     *             if there is no such record, or more than one
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(LogRecord::getLevel, LogRecord::getMessage)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * Asserts that no record is above {@code INFO} and that no record carries
     * a throwable.
     * 
     * @return this for chaining
     * 
     * @throws AssertionError
     *             if a record is a problem
     */
    public LogRecorder assertNoProblem() {
        int info = java.util.logging.Level.INFO.intValue();
        assertThat(records())
            .noneMatch(r -> r.getLevel().intValue() > info)
            .noneMatch(r -> r.getThrown() != null);
        return this;
    }
    
    /**
     * Detaches the recorder from all loggers.
     */
    public void stopRecording() {
        for (Sink s : sinks) {
            Logging.removeHandler(s.component, s);
        }
    }
    
    private Stream<LogRecord> records() {
        return Stream.of(sinks)
                .flatMap(s -> s.records.stream())
                .sorted(comparing(LogRecord::getInstant));
    }
    
    private static Predicate<LogRecord> firstOnly(Predicate<LogRecord> test) {
        boolean[] hit = {false};
        return r -> {
            if (!hit[0] && test.test(r)) {
                hit[0] = true;
                return true;
            }
            return false;
        };
    }
    
    private static final class Sink extends Handler {
        final Class<?> component;
        final Deque<LogRecord> records = new ConcurrentLinkedDeque<>();
        
        Sink(Class<?> component) {
            this.component = requireNonNull(component);
            setLevel(java.util.logging.Level.ALL);
        }
        
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }
        
        @Override
        public void flush() {
            // Nothing buffered
        }
        
        @Override
        public void close() {
            // Nothing to release
        }
    }
}
