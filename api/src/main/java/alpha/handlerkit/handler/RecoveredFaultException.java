package alpha.handlerkit.handler;

import java.io.Serial;

/**
 * Wraps an unexpected fault recovered at the top of the request thread.<p>
 *
 * A fault is an unchecked exception other than {@link HttpError}, or an
 * {@code Error} thrown by a {@link Handler}; for example a
 * {@code NullPointerException} or an {@code IndexOutOfBoundsException}. The
 * fault is the cause of this exception, so its stack trace is retained for
 * the log and the error notification.<p>
 *
 * This exception is unclassified, and therefore becomes a
 * {@value alpha.handlerkit.HttpConstants.StatusCode#FIVE_HUNDRED} (Internal
 * Server Error).
 */
public final class RecoveredFaultException extends Exception
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     *
     * @param fault the recovered fault
     */
    public RecoveredFaultException(Throwable fault) {
        super("Recovered fault: " + fault, fault);
    }
}
