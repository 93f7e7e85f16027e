package alpha.handlerkit.testutil;

import alpha.handlerkit.Config;
import org.assertj.core.api.AbstractThrowableAssert;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static alpha.handlerkit.testutil.LogRecords.messageOf;
import static alpha.handlerkit.testutil.LogRecords.rec;
import static alpha.handlerkit.testutil.LogRecords.toJUL;
import static java.util.Comparator.comparing;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static java.util.stream.Stream.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A utility for asserting and optionally awaiting log records.<p>
 * 
 * Records are matched on level, message and thrown. The message of a record
 * logged through a request context's logger is matched without its request
 * prefix; see {@link LogRecords#messageOf(LogRecord)}.<p>
 * 
 * Methods with an "assert" prefix throws an {@code AssertionError} if the
 * record can not be found.<p>
 * 
 * Methods with an "await" word in the name will block waiting on a log record
 * if it hasn't already been published. The timeout happens after 3 seconds.
 * Awaiting is needed when the record
 * is logged by a servlet container's worker thread, which may still be running
 * after the client has received the response.<p>
 * 
 * Methods with "remove" in their name will remove the earliest matching
 * record, so that it will not be matched again. Typically, a test removes all
 * expected warnings and errors and then asserts that no other problem was
 * logged:
 * 
 * <pre>{@code
 *     recorder.assertRemove(WARNING, "Request failed with 404")
 *             .assertNoProblem();
 * }</pre>
 * 
 * Create a log recorder using {@link #startRecording()}.
 */
public final class LogRecorder
{
    /**
     * Starts recording all records of the library.<p>
     * 
     * An invocation of this method behaves in exactly the same way as the
     * invocation
     * <pre>
     *     LogRecorder.{@link #startRecording(Class, Class[])
     *       startRecording}(Config.class);
     * </pre>
     * 
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        return startRecording(Config.class);
    }
    
    /**
     * Starts recording log records from the loggers of the packages that the
     * given components belong to.<p>
     * 
     * Recording should eventually be stopped using {@link #stopRecording()}.
     * 
     * @param firstComponent at least one
     * @param more may be provided
     * 
     * @return a new log recorder
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static LogRecorder startRecording(Class<?> firstComponent, Class<?>... more) {
        RecordHandler[] h = Stream.concat(of(firstComponent), of(more))
                .map(RecordHandler::new)
                .toArray(RecordHandler[]::new);
        return new LogRecorder(h);
    }
    
    private static final long TIMEOUT_SEC = 3;
    
    private final RecordHandler[] handlers;
    
    private LogRecorder(RecordHandler[] handlers) {
        this.handlers = handlers;
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public LogRecorder assertRemove(
            System.Logger.Level level, String messageStartsWith) {
        assertRemoveIf(matcher(level, messageStartsWith));
        return this;
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * @param thr record's thrown predicate
     * 
     * @return an assert object of the throwable
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public AbstractThrowableAssert<?, ? extends Throwable>
           assertRemove(System.Logger.Level level, String messageStartsWith,
           Class<? extends Throwable> thr)
    {
        var rec = assertRemoveIf(matcher(level, messageStartsWith, thr));
        return assertThat(rec.getThrown());
    }
    
    /**
     * Awaits the arrival of a matching record, then removes it.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     * @throws AssertionError
     *             on timeout (record not observed)
     */
    public LogRecorder assertAwaitRemove(
            System.Logger.Level level, String messageStartsWith)
            throws InterruptedException {
        var test = matcher(level, messageStartsWith);
        assertAwait(test);
        assertRemoveIf(test);
        return this;
    }
    
    /**
     * Awaits the arrival of a matching record, then removes it.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * @param thr record's thrown predicate
     * 
     * @return an assert object of the throwable
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     * @throws AssertionError
     *             on timeout (record not observed)
     */
    public AbstractThrowableAssert<?, ? extends Throwable>
           assertAwaitRemove(
               System.Logger.Level level, String messageStartsWith,
               Class<? extends Throwable> thr)
           throws InterruptedException
    {
        var test = matcher(level, messageStartsWith, thr);
        assertAwait(test);
        return assertThat(assertRemoveIf(test).getThrown());
    }
    
    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     * 
     * @return this for chaining/fluency
     * 
     * @throws AssertionError
     *             if a record has a throwable
     *             or a level greater than {@code INFO}
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .noneMatch(v -> v.getLevel().intValue() > java.util.logging.Level.INFO.intValue())
            .noneMatch(v -> v.getThrown() != null);
        return this;
    }
    
    /**
     * Asserts that only one record has the given values.<p>
     * 
     * The record's throwable, if present, has no effect.
     * 
     * @param level record's level predicate
     * @param message record's message predicate (request prefix excluded)
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if not exactly one record is found
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(
                LogRecord::getLevel,
                LogRecords::messageOf)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * Stop recording log records.
     */
    public void stopRecording() {
        Stream.of(handlers).forEach(RecordHandler::uninstall);
    }
    
    private Stream<LogRecord> records() {
        return Stream.of(handlers)
                .flatMap(RecordHandler::recordsStream)
                .sorted(comparing(LogRecord::getInstant));
    }
    
    private static Predicate<LogRecord> matcher(
            System.Logger.Level level, String messageStartsWith) {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        return r -> r.getLevel().equals(jul) &&
                    messageOf(r) != null &&
                    messageOf(r).startsWith(messageStartsWith);
    }
    
    private static Predicate<LogRecord> matcher(
            System.Logger.Level level, String messageStartsWith,
            Class<? extends Throwable> thr) {
        requireNonNull(thr);
        return matcher(level, messageStartsWith)
                .and(r -> thr.isInstance(r.getThrown()));
    }
    
    /**
     * Removes and returns the earliest record matching the given predicate.
     * 
     * @param test record predicate
     * 
     * @return the record (never {@code null})
     * 
     * @throws AssertionError
     *             if no record matched the predicate
     */
    private LogRecord assertRemoveIf(Predicate<LogRecord> test) {
        LogRecord match = null;
        search: for (var h : handlers) {
            var it = h.recordsDeque().iterator();
            while (it.hasNext()) {
                var r = it.next();
                if (test.test(r)) {
                    it.remove();
                    match = r;
                    break search;
                }
            }
        }
        assertNotNull(match, "No matching log record.");
        return match;
    }
    
    private void assertAwait(Predicate<LogRecord> test)
            throws InterruptedException {
        var latch = new CountDownLatch(1);
        for (RecordHandler h : handlers) {
            h.monitor(rec -> {
                if (latch.getCount() > 0 && test.test(rec)) {
                    latch.countDown();
                }
            });
            if (latch.getCount() == 0) {
                return;
            }
        }
        assertTrue(latch.await(TIMEOUT_SEC, SECONDS), "Log record not observed.");
    }
    
    private static final class RecordHandler extends Handler {
        // Keeps the logger, and so this handler, from being collected
        private final Logger logger;
        private final Deque<LogRecord> deq;
        private final List<Consumer<LogRecord>> mon;
        
        RecordHandler(Class<?> component) {
            deq = new ConcurrentLinkedDeque<>();
            mon = new ArrayList<>();
            super.setLevel(java.util.logging.Level.ALL);
            logger = Logging.addHandler(component, this);
        }
        
        /**
         * Synchronously replay all until-now observed records to the given
         * consumer and then subscribe the consumer to future records as they
         * arrive.
         * 
         * @param consumer code to execute with the records
         */
        synchronized void monitor(Consumer<LogRecord> consumer) {
            requireNonNull(consumer);
            recordsStream().forEach(consumer);
            mon.add(consumer);
        }
        
        void uninstall() {
            logger.removeHandler(this);
        }
        
        Deque<LogRecord> recordsDeque() {
            return deq;
        }
        
        Stream<LogRecord> recordsStream() {
            return deq.stream();
        }
        
        @Override
        public synchronized void publish(LogRecord record) {
            deq.add(record);
            mon.forEach(c -> c.accept(record));
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            // Empty
        }
    }
}
