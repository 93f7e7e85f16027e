package alpha.handlerkit.spi;

import java.io.Serial;

/**
 * Thrown by a {@link TemplateRenderer} if rendering fails.
 */
public class TemplateException extends Exception
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Constructs this object.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public TemplateException(String message) {
        super(message);
    }

    /**
     * Constructs this object.
     *
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
