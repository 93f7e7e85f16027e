package alpha.handlerkit.testutil;

import org.assertj.core.groups.Tuple;

import java.util.logging.LogRecord;

import static java.lang.System.Logger.Level;
import static java.lang.reflect.Modifier.isFinal;
import static java.lang.reflect.Modifier.isStatic;
import static java.util.Arrays.stream;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Utils for JUL's {@link LogRecord} and related types.
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Create an AssertJ Tuple consisting of a log- level and message.
     * 
     * @param level of log record
     * @param msg of log record
     * @return a tuple
     * 
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     */
    public static Tuple rec(Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Returns the message of the record, stripped of the request prefix.<p>
     * 
     * Records logged through a request context's logger have a message that
     * starts with something like "[#12 GET /path] ". This method returns what
     * follows the prefix. A message without the prefix is returned as-is.
     * 
     * @param rec log record
     * @return the message, without request prefix
     */
    public static String messageOf(LogRecord rec) {
        String m = rec.getMessage();
        if (m == null || !m.startsWith("[#")) {
            return m;
        }
        int end = m.indexOf("] ");
        return end == -1 ? m : m.substring(end + 2);
    }
    
    /**
     * Convert {@code System.Logger.Level} to {@code java.util.logging.Level}.
     *
     * @param level to convert
     * @return the converted value
     * @throws NullPointerException if {@code level} is {@code null}
     */
    static java.util.logging.Level toJUL(System.Logger.Level level) {
        requireNonNull(level);
        return stream(java.util.logging.Level.class.getFields())
                .filter(f ->
                        f.getType() == java.util.logging.Level.class &&
                                isStatic(f.getModifiers()) &&
                                isFinal(f.getModifiers()))
                .map(f -> {
                    try {
                        return (java.util.logging.Level) f.get(null);
                    } catch (IllegalAccessException e) {
                        throw new AssertionError(e);
                    }
                })
                .filter(l -> l.intValue() == level.getSeverity())
                .findAny().orElseThrow(() -> new IllegalArgumentException(
                        "No JUL match for this level: " + level));
    }
}
