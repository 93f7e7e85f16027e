package alpha.handlerkit.handler;

import java.util.List;

/**
 * Reports classified errors to someone who cares.<p>
 *
 * The notifier is called exactly once for each failed request, after the
 * response has been resolved, regardless of how it was resolved.<p>
 *
 * Reporting is fire-and-forget. The implementation must not block the request
 * thread for a significant amount of time (sending email should happen on
 * another thread), must not retry, and must not throw. A failure to report is
 * logged by the implementation and then forgotten.<p>
 *
 * The implementation must be thread-safe.
 */
@FunctionalInterface
public interface Notifier
{
    /**
     * Reports an error.
     *
     * @param error the classified error (never {@code null})
     * @param metadata of the failed request (never {@code null})
     */
    void report(HttpError error, RequestMetadata metadata);

    /**
     * Returns a notifier that does nothing.
     *
     * @return see JavaDoc
     */
    static Notifier noOp() {
        return (error, metadata) -> {};
    }

    /**
     * Returns a notifier that reports to all given notifiers, in order.<p>
     *
     * If a notifier throws an exception, the exception is logged and the
     * remaining notifiers are still called.
     *
     * @param notifiers to delegate to
     *
     * @return a composite notifier
     *
     * @throws NullPointerException if any notifier is {@code null}
     */
    static Notifier composite(Notifier... notifiers) {
        return new CompositeNotifier(List.of(notifiers));
    }
}
