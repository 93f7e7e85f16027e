package alpha.handlerkit.handler;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Registry of the handlers that replace the default error response of a
 * specific status code.<p>
 *
 * By default, a failed request receives a response with nothing but the
 * classified status code. An override handler may instead render something
 * more helpful, such as a "page not found" page. The override handler is
 * called with the same {@link RequestContext} as the failed handler.<p>
 *
 * There are three overrides:
 *
 * <table>
 *   <caption>Override handlers</caption>
 *   <tr><th>Status code</th><th>Registration</th></tr>
 *   <tr><td>500</td><td>{@link #setErrorHandler(Handler)}</td></tr>
 *   <tr><td>404</td><td>{@link #setNotFoundHandler(Handler)}</td></tr>
 *   <tr><td>403</td><td>{@link #setForbiddenHandler(Handler)}</td></tr>
 * </table>
 *
 * If the override handler itself fails, the client receives the default
 * response. The failure does not go to another override.<p>
 *
 * One instance is created by the serving process and shared by all requests.
 * Registrations are expected to happen during startup, but may happen at any
 * time. A new registration replaces the previous one, and there is no way to
 * unregister. Each registration is safely published; a request observes either
 * the previous or the new handler.
 */
public final class OverrideHandlers
{
    private volatile Handler error,
                             forbidden,
                             notFound;

    /**
     * Sets the handler called for a
     * {@value alpha.handlerkit.HttpConstants.StatusCode#FIVE_HUNDRED}.
     *
     * @param handler the override
     *
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public void setErrorHandler(Handler handler) {
        error = requireNonNull(handler);
    }

    /**
     * Sets the handler called for a
     * {@value alpha.handlerkit.HttpConstants.StatusCode#FOUR_HUNDRED_THREE}.
     *
     * @param handler the override
     *
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public void setForbiddenHandler(Handler handler) {
        forbidden = requireNonNull(handler);
    }

    /**
     * Sets the handler called for a
     * {@value alpha.handlerkit.HttpConstants.StatusCode#FOUR_HUNDRED_FOUR}.
     *
     * @param handler the override
     *
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public void setNotFoundHandler(Handler handler) {
        notFound = requireNonNull(handler);
    }

    /**
     * {@return the 500 override, if registered}
     */
    public Optional<Handler> errorHandler() {
        return Optional.ofNullable(error);
    }

    /**
     * {@return the 403 override, if registered}
     */
    public Optional<Handler> forbiddenHandler() {
        return Optional.ofNullable(forbidden);
    }

    /**
     * {@return the 404 override, if registered}
     */
    public Optional<Handler> notFoundHandler() {
        return Optional.ofNullable(notFound);
    }
}
