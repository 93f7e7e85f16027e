package alpha.handlerkit.core;

import alpha.handlerkit.handler.Handler;
import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.RecoveredFaultException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.Serial;

import static alpha.handlerkit.handler.ErrorClassifier.classify;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.TRACE;

/**
 * Adapts a {@link Handler} into a servlet.<p>
 *
 * For each request, the adapter creates a new request context, sets the
 * configured compatibility headers, and calls the handler. If the handler
 * completes normally, the adapter writes nothing more. If the handler throws,
 * the failure is classified and routed to the recovery logic, which writes the
 * error response and notifies the application's {@link
 * alpha.handlerkit.handler.Notifier Notifier}.<p>
 *
 * Unexpected faults, i.e. unchecked exceptions other than {@link HttpError}
 * and errors, are recovered. They are wrapped in a {@link
 * RecoveredFaultException} and handled as any other unclassified failure.
 * Such a fault never reaches the servlet container, unless it is a {@code
 * VirtualMachineError} other than {@code StackOverflowError}. The adapter
 * then tries to respond 500 and to notify before rethrowing it.<p>
 *
 * Instances are created by {@link Application#adapt(Handler)}. The adapter is
 * thread-safe, and the container may call it concurrently.
 */
public final class HandlerAdapter extends HttpServlet
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final transient Handler handler;
    private final transient Application app;
    private final transient RecoveryRouter router;

    HandlerAdapter(Handler handler, Application app, RecoveryRouter router) {
        this.handler = handler;
        this.app = app;
        this.router = router;
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse rsp) {
        var ctx = new DefaultRequestContext(req, rsp, app);
        ctx.applyCompatibilityHeaders();
        final HttpError err;
        try {
            err = execute(handler, ctx);
        } catch (VirtualMachineError e) {
            // Best effort, the JVM may not survive
            recover(ctx, classify(new RecoveredFaultException(e)));
            throw e;
        }
        if (err == null) {
            ctx.logger().log(TRACE, "Handler completed normally.");
            return;
        }
        recover(ctx, err);
    }

    private void recover(DefaultRequestContext ctx, HttpError err) {
        try {
            router.handle(ctx, err);
        } catch (RuntimeException e) {
            ctx.logger().log(ERROR, "Recovery failed.", e);
        }
    }

    /**
     * Calls the handler.<p>
     *
     * Unless the handler completes normally, the returned error is the
     * classified failure.
     *
     * @param h handler
     * @param ctx request context
     *
     * @return the classified failure, or {@code null} on success
     *
     * @throws VirtualMachineError
     *             if the handler throws it, except {@code StackOverflowError}
     */
    static HttpError execute(Handler h, DefaultRequestContext ctx) {
        try {
            h.handle(ctx);
            return null;
        } catch (HttpError e) {
            return e;
        } catch (RuntimeException e) {
            return classify(new RecoveredFaultException(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return classify(e);
        } catch (Exception e) {
            return classify(e);
        } catch (StackOverflowError e) {
            // The stack has unwound
            return classify(new RecoveredFaultException(e));
        } catch (VirtualMachineError e) {
            ctx.logger().log(ERROR, "Fatal error, not recovered.", e);
            throw e;
        } catch (Error e) {
            return classify(new RecoveredFaultException(e));
        }
    }

    @Override
    public String toString() {
        return HandlerAdapter.class.getSimpleName() + "{handler=" + handler + "}";
    }
}
