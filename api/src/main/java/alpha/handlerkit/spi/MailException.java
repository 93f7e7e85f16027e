package alpha.handlerkit.spi;

import java.io.Serial;

/**
 * Thrown by a {@link MailSender} if a mail was not accepted for delivery.
 */
public class MailException extends Exception
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public MailException(String message) {
        super(message);
    }

    /**
     * Constructs this object.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public MailException(String message, Throwable cause) {
        super(message, cause);
    }
}
