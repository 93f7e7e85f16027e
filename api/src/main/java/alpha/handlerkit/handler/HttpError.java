package alpha.handlerkit.handler;

import alpha.handlerkit.HttpConstants.ReasonPhrase;

import java.io.Serial;

import static alpha.handlerkit.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.handlerkit.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.handlerkit.HttpConstants.StatusCode.FOUR_HUNDRED_FIVE;
import static alpha.handlerkit.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.handlerkit.HttpConstants.StatusCode.FOUR_HUNDRED_THREE;
import static alpha.handlerkit.HttpConstants.StatusCode.isClientError;
import static alpha.handlerkit.HttpConstants.StatusCode.isServerError;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * A classified failure; an exception annotated with the HTTP status code the
 * client will receive.<p>
 *
 * A {@link Handler} throws this exception to signal a specific outcome to the
 * client:
 *
 * <pre>{@code
 *   Handler showOrder = ctx -> {
 *       var order = orders.find(ctx.request().getParameter("id"))
 *                         .orElseThrow(HttpError::notFound);
 *       ctx.emitJson(order);
 *   };
 * }</pre>
 *
 * Any other failure thrown by the handler is classified as
 * {@value alpha.handlerkit.HttpConstants.StatusCode#FIVE_HUNDRED} by
 * {@link ErrorClassifier#classify(Throwable)}.<p>
 *
 * The message and the cause are used for logging and notification only; they
 * are never written to the response. By default, the client receives nothing
 * but the status code. An {@linkplain OverrideHandlers override handler} may
 * render a richer response.<p>
 *
 * The class is not final. An application may declare its own types for
 * recurring problems, for example a {@code PreconditionFailedException}
 * passing 412 to the super constructor.
 */
public class HttpError extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Returns a {@value alpha.handlerkit.HttpConstants.StatusCode#FOUR_HUNDRED_FOUR}
     * (Not Found) error.
     *
     * @return see JavaDoc
     */
    public static HttpError notFound() {
        return new HttpError(FOUR_HUNDRED_FOUR, ReasonPhrase.NOT_FOUND);
    }

    /**
     * Returns a {@value alpha.handlerkit.HttpConstants.StatusCode#FOUR_HUNDRED_THREE}
     * (Forbidden) error.
     *
     * @return see JavaDoc
     */
    public static HttpError forbidden() {
        return new HttpError(FOUR_HUNDRED_THREE, ReasonPhrase.FORBIDDEN);
    }

    /**
     * Returns a {@value alpha.handlerkit.HttpConstants.StatusCode#FOUR_HUNDRED_FIVE}
     * (Method Not Allowed) error.
     *
     * @return see JavaDoc
     */
    public static HttpError methodNotAllowed() {
        return new HttpError(FOUR_HUNDRED_FIVE, ReasonPhrase.METHOD_NOT_ALLOWED);
    }

    /**
     * Returns a {@value alpha.handlerkit.HttpConstants.StatusCode#FOUR_HUNDRED}
     * (Bad Request) error.
     *
     * @param detail what is wrong with the request
     *
     * @return see JavaDoc
     *
     * @throws NullPointerException if {@code detail} is {@code null}
     */
    public static HttpError badRequest(String detail) {
        return badRequest(detail, null);
    }

    /**
     * Returns a {@value alpha.handlerkit.HttpConstants.StatusCode#FOUR_HUNDRED}
     * (Bad Request) error.
     *
     * @param detail what is wrong with the request
     * @param cause of the error (may be {@code null})
     *
     * @return see JavaDoc
     *
     * @throws NullPointerException if {@code detail} is {@code null}
     */
    public static HttpError badRequest(String detail, Throwable cause) {
        return new HttpError(FOUR_HUNDRED, requireNonNull(detail), cause);
    }

    /**
     * Returns a {@value alpha.handlerkit.HttpConstants.StatusCode#FIVE_HUNDRED}
     * (Internal Server Error) error.
     *
     * @param message description of the failure
     * @param cause of the failure (may be {@code null})
     *
     * @return see JavaDoc
     *
     * @throws NullPointerException if {@code message} is {@code null}
     */
    public static HttpError internalServerError(String message, Throwable cause) {
        return new HttpError(FIVE_HUNDRED, requireNonNull(message), cause);
    }

    /**
     * Returns an error of any status code.
     *
     * @param statusCode of the response
     * @param message description of the failure
     *
     * @return see JavaDoc
     *
     * @throws IllegalArgumentException
     *             if {@code statusCode} is not a 4XX or 5XX code
     */
    public static HttpError of(int statusCode, String message) {
        return new HttpError(statusCode, message);
    }

    private final int statusCode;

    /**
     * Constructs this object.
     *
     * @param statusCode of the response
     * @param message description of the failure
     *
     * @throws IllegalArgumentException
     *             if {@code statusCode} is not a 4XX or 5XX code
     */
    public HttpError(int statusCode, String message) {
        this(statusCode, message, null);
    }

    /**
     * Constructs this object.
     *
     * @param statusCode of the response
     * @param message description of the failure
     * @param cause of the failure (may be {@code null})
     *
     * @throws IllegalArgumentException
     *             if {@code statusCode} is not a 4XX or 5XX code
     */
    public HttpError(int statusCode, String message, Throwable cause) {
        super(message, cause);
        if (!isClientError(statusCode) && !isServerError(statusCode)) {
            throw new IllegalArgumentException(
                    "Not an error status code: " + statusCode);
        }
        this.statusCode = statusCode;
    }

    /**
     * {@return the status code of the response}
     */
    public final int statusCode() {
        return statusCode;
    }

    /**
     * Returns the level at which this error is logged.<p>
     *
     * A server error is logged on {@code ERROR}, a client error on
     * {@code WARNING}.
     *
     * @return see JavaDoc
     */
    public System.Logger.Level severity() {
        return isServerError(statusCode) ? ERROR : WARNING;
    }

    @Override
    public String toString() {
        return getClass().getName() + "{statusCode=" + statusCode +
                ", message=" + getMessage() + "}";
    }
}
