package alpha.handlerkit.testutil;

import java.util.logging.Handler;
import java.util.logging.Logger;

import static alpha.handlerkit.testutil.LogRecords.toJUL;
import static java.lang.System.Logger.Level;

/**
 * Logging utilities.
 */
public final class Logging {
    private Logging() {
        // Empty
    }
    
    /**
     * Set logging level for the package of a given component.<p>
     * 
     * The level is set on the logger only, not on any of its handlers. A test
     * that lowers the level to observe, say, {@code DEBUG} records should use a
     * {@link LogRecorder}, whose handlers accept all levels.
     * 
     * @param component to extract package from
     * @param level to set
     * 
     * @return the previous level (may be {@code null})
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static java.util.logging.Level setLevel(Class<?> component, Level level) {
        Logger l = Logger.getLogger(component.getPackageName());
        var old = l.getLevel();
        l.setLevel(toJUL(level));
        return old;
    }
    
    /**
     * Reset the logging level of the package of a given component.
     * 
     * @param component to extract package from
     * @param level to set (may be {@code null}, to inherit the parent's level)
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void resetLevel(Class<?> component, java.util.logging.Level level) {
        Logger.getLogger(component.getPackageName()).setLevel(level);
    }
    
    /**
     * Add handler to the logger of the package that the component belongs to.<p>
     * 
     * The returned logger must be strongly referenced for as long as the
     * handler is meant to stay installed. The JUL log manager references its
     * loggers weakly.
     * 
     * @param component to extract package from
     * @param handler to add
     * 
     * @return the logger
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static Logger addHandler(Class<?> component, Handler handler) {
        var l = Logger.getLogger(component.getPackageName());
        l.addHandler(handler);
        return l;
    }
}
