package alpha.handlerkit.handler;

/**
 * Application code serving one request.<p>
 *
 * The handler produces the response through the given {@link RequestContext},
 * for example by calling {@link RequestContext#emitJson(Object)}, and then
 * returns normally. Returning normally means success; nothing more is written
 * to the response.<p>
 *
 * To fail, the handler throws. An {@link HttpError} decides the status code of
 * the response, any other exception becomes a
 * {@value alpha.handlerkit.HttpConstants.StatusCode#FIVE_HUNDRED}:
 *
 * <pre>{@code
 *   Handler deleteItem = ctx -> {
 *       if (!ctx.isPost()) {
 *           throw HttpError.methodNotAllowed();
 *       }
 *       items.delete(ctx.loadFormData(ItemRef.class));
 *       ctx.redirect("/items");
 *   };
 * }</pre>
 *
 * Unchecked exceptions other than {@code HttpError} are regarded as faults
 * (bugs). They are recovered too, wrapped in a
 * {@link RecoveredFaultException}.<p>
 *
 * A handler is called concurrently by many request threads and must be
 * thread-safe. The request context, however, is confined to the request
 * thread.
 */
@FunctionalInterface
public interface Handler
{
    /**
     * Serves a request.
     *
     * @param ctx the request context (never {@code null})
     *
     * @throws Exception a failure to be classified and recovered from
     */
    void handle(RequestContext ctx) throws Exception;
}
