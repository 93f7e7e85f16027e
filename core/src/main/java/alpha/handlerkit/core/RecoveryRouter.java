package alpha.handlerkit.core;

import alpha.handlerkit.handler.Handler;
import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.Notifier;
import alpha.handlerkit.handler.OverrideHandlers;

import java.util.Optional;

import static alpha.handlerkit.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.handlerkit.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.handlerkit.HttpConstants.StatusCode.FOUR_HUNDRED_THREE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Resolves the response of a failed request.<p>
 *
 * The error is first logged, then resolved by an override handler registered
 * for the exact status code (500, 404 or 403), or else by a response carrying
 * nothing but the status code. Finally, the {@link Notifier} is called, no
 * matter how the response was resolved.<p>
 *
 * A failing override handler is logged, after which the client receives the
 * bare status code of the original error. Overrides never cascade; the
 * failure of a 404 override will not be handled by the 500 override.
 */
final class RecoveryRouter
{
    private final OverrideHandlers overrides;
    private final Notifier notifier;

    RecoveryRouter(OverrideHandlers overrides, Notifier notifier) {
        this.overrides = overrides;
        this.notifier = notifier;
    }

    /**
     * Resolves the response.<p>
     *
     * This method does not throw an exception caused by the override handler
     * or the notifier. A {@code VirtualMachineError} does propagate, after the
     * notifier has been called.
     *
     * @param ctx the context of the failed request
     * @param error the classified failure
     */
    void handle(DefaultRequestContext ctx, HttpError error) {
        ctx.logger().log(error.severity(),
                "Request failed with " + error.statusCode() + ": " +
                error.getMessage(), error.getCause());
        try {
            resolve(ctx, error);
        } finally {
            notify(ctx, error);
        }
    }

    private void resolve(DefaultRequestContext ctx, HttpError error) {
        final int code = error.statusCode();
        Optional<Handler> override = overrideFor(code);
        if (override.isPresent() && ctx.reopen(code)) {
            HttpError failed = HandlerAdapter.execute(override.get(), ctx);
            if (failed == null) {
                return;
            }
            ctx.logger().log(WARNING,
                    "Override handler for " + code + " failed, " +
                    "falling back to the default response.", failed);
        }
        if (ctx.reopen(code)) {
            ctx.status(code);
        } else {
            ctx.logger().log(DEBUG, () ->
                "Response already committed, can not write " + code + ".");
        }
    }

    private Optional<Handler> overrideFor(int code) {
        return switch (code) {
            case FIVE_HUNDRED       -> overrides.errorHandler();
            case FOUR_HUNDRED_FOUR  -> overrides.notFoundHandler();
            case FOUR_HUNDRED_THREE -> overrides.forbiddenHandler();
            default                 -> Optional.empty();
        };
    }

    private void notify(DefaultRequestContext ctx, HttpError error) {
        try {
            notifier.report(error, ctx.metadata());
        } catch (RuntimeException e) {
            ctx.logger().log(ERROR, "Notifier failed.", e);
        }
    }
}
