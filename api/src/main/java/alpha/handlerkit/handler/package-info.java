/**
 * Types used by application code to serve a request and to fail doing so.<p>
 *
 * A {@link alpha.handlerkit.handler.Handler} serves a request through a
 * {@link alpha.handlerkit.handler.RequestContext}, and fails by throwing. The
 * failure is classified into an {@link alpha.handlerkit.handler.HttpError} by
 * the {@link alpha.handlerkit.handler.ErrorClassifier}, answered with a bare
 * status code or by one of the
 * {@link alpha.handlerkit.handler.OverrideHandlers}, and finally reported to
 * the {@link alpha.handlerkit.handler.Notifier}.
 */
package alpha.handlerkit.handler;
