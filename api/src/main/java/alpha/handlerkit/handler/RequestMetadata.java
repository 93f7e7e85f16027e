package alpha.handlerkit.handler;

import static java.util.Objects.requireNonNull;

/**
 * Details of a failed request, as passed to a {@link Notifier}.<p>
 *
 * The metadata is a snapshot. It remains valid after the request has
 * completed.
 *
 * @param id of request
 * @param method of request
 * @param path of request, including the query
 * @param remoteAddress of the client
 * @param userAgent of the client (empty if not provided)
 */
public record RequestMetadata(
        long id, String method, String path, String remoteAddress, String userAgent)
{
    /**
     * Constructs this object.
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public RequestMetadata {
        requireNonNull(method);
        requireNonNull(path);
        requireNonNull(remoteAddress);
        requireNonNull(userAgent);
    }
}
