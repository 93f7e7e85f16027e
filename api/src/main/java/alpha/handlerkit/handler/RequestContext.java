package alpha.handlerkit.handler;

import alpha.handlerkit.spi.FormDecodeException;
import alpha.handlerkit.spi.FormDecoder;
import alpha.handlerkit.spi.TemplateRenderer;
import jakarta.servlet.http.HttpServletRequest;

import java.util.List;
import java.util.Optional;

/**
 * Is the per-request façade given to a {@link Handler}.<p>
 *
 * The context bundles the inbound request, the response and a request-scoped
 * logger. The response is reachable only through the outcome-producing
 * methods of this interface: {@link #redirect(String, boolean)},
 * {@link #emitJson(Object)}, {@link #renderTemplate(List, Object)} and
 * {@link #status(int)}.<p>
 *
 * Each of these methods is a <i>terminal write</i>, and at most one terminal
 * write may occur per request. Invoking a second one throws an
 * {@code IllegalStateException}; this is a programming error, recovered like
 * any other fault.<p>
 *
 * The body-writing methods respond 200 (OK). When called by an override
 * handler (see {@link OverrideHandlers}), they instead respond with the status
 * code of the error being handled.<p>
 *
 * None of the methods return a failure. They either complete normally, or
 * throw an {@link HttpError}, which allows handler code to end with a terminal
 * write as its last statement and leave failures to the caller:
 *
 * <pre>{@code
 *   Handler login = ctx -> {
 *       var form = ctx.loadFormData(Login.class);
 *       sessions.open(form);
 *       ctx.redirect("/home");
 *   };
 * }</pre>
 *
 * The context is created for one request, used by one thread, and must not
 * be retained after the handler returns.
 */
public interface RequestContext
{
    /**
     * {@return the inbound request}<p>
     *
     * The request is owned by the servlet container. It should only be read
     * from.
     */
    HttpServletRequest request();

    /**
     * {@return an identifier of this request, unique within the process}
     */
    long id();

    /**
     * {@return the request method}
     */
    String method();

    /**
     * {@return {@code true} if the request method is POST}
     */
    boolean isPost();

    /**
     * {@return {@code true} if the request method is GET}
     */
    boolean isGet();

    /**
     * Returns the request path, including the query if there is one.<p>
     *
     * For example, {@code "/search?q=cats"}.
     *
     * @return see JavaDoc
     */
    String path();

    /**
     * Returns the first value of a request header.
     *
     * @param name of header (case-insensitive)
     *
     * @return the value if present
     */
    Optional<String> header(String name);

    /**
     * Returns a logger scoped to this request.<p>
     *
     * The message of each record is prefixed with the request's
     * {@linkplain #id() id}, method and path.
     *
     * @return see JavaDoc
     */
    System.Logger logger();

    /**
     * {@return a snapshot of request details used for error notifications}
     */
    RequestMetadata metadata();

    /**
     * Sets a response header.<p>
     *
     * This method does not write the response, and may be called any number of
     * times before the terminal write.
     *
     * @param name of header
     * @param value of header
     *
     * @throws IllegalStateException if the response is written
     */
    void setHeader(String name, String value);

    /**
     * Redirects the client.<p>
     *
     * The response is a
     * {@value alpha.handlerkit.HttpConstants.StatusCode#THREE_HUNDRED_ONE}
     * (Moved Permanently) if {@code permanent} is {@code true}, otherwise
     * {@value alpha.handlerkit.HttpConstants.StatusCode#THREE_HUNDRED_TWO}
     * (Found). A relative path is resolved against the request path.
     *
     * @param path target of the redirect
     * @param permanent whether the redirect is permanent
     *
     * @throws NullPointerException if {@code path} is {@code null}
     * @throws IllegalStateException if the response is already written
     * @throws HttpError (500) if {@code path} is not a valid URI reference
     */
    void redirect(String path, boolean permanent);

    /**
     * Redirects the client temporarily.
     *
     * @param path target of the redirect
     *
     * @see #redirect(String, boolean)
     */
    default void redirect(String path) {
        redirect(path, false);
    }

    /**
     * Redirects the client permanently.
     *
     * @param path target of the redirect
     *
     * @see #redirect(String, boolean)
     */
    default void redirectPermanently(String path) {
        redirect(path, true);
    }

    /**
     * Writes a response with the given status code and no body.
     *
     * @param code status code
     *
     * @throws IllegalStateException if the response is already written
     */
    void status(int code);

    /**
     * Writes the given data as a JSON response body.<p>
     *
     * The data is serialized before anything is written. If serialization
     * fails, nothing is written.
     *
     * @param data to serialize
     *
     * @throws IllegalStateException if the response is already written
     * @throws HttpError (500) if serialization fails
     */
    void emitJson(Object data);

    /**
     * Renders templates into an HTML response body.<p>
     *
     * The templates are rendered before anything is written. If rendering
     * fails, nothing is written.
     *
     * @param names of templates
     * @param data passed to the templates
     *
     * @throws IllegalStateException if the response is already written
     * @throws HttpError (500) if rendering fails, or no renderer is configured
     *
     * @see TemplateRenderer
     */
    void renderTemplate(List<String> names, Object data);

    /**
     * Decodes the request parameters into a new instance of the given type.<p>
     *
     * The parameters are the query parameters and the URL-encoded form
     * parameters of the body.<p>
     *
     * Parameters that do not match a property of the type are ignored. Forms
     * routinely carry fields the application does not model, such as a
     * submit-button name or a CSRF token. All other decoding problems are
     * reported.
     *
     * @param type to decode into
     * @param <T> type to decode into
     *
     * @return the decoded value
     *
     * @throws HttpError (400) if the parameters do not decode, with a
     *         {@link FormDecodeException} cause
     *
     * @see FormDecoder
     */
    <T> T loadFormData(Class<T> type);

    /**
     * Decodes the JSON request body into a new instance of the given type.
     *
     * @param type to decode into
     * @param <T> type to decode into
     *
     * @return the decoded value
     *
     * @throws HttpError (400) if the body is not valid JSON for the type,
     *                   (500) if the body can not be read
     */
    <T> T loadJsonBody(Class<T> type);
}
