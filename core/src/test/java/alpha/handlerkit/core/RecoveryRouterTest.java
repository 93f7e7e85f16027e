package alpha.handlerkit.core;

import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.OverrideHandlers;
import alpha.handlerkit.testutil.LogRecorder;
import alpha.handlerkit.testutil.Logging;
import alpha.handlerkit.testutil.RecordingNotifier;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static java.lang.System.Logger.Level.ALL;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Small tests of {@link RecoveryRouter}.<p>
 * 
 * Most routing is tested through a real container, see {@code OverrideTest}.
 * These tests cover what a container makes hard to provoke.
 */
final class RecoveryRouterTest
{
    private HttpServletResponse rsp;
    private DefaultRequestContext ctx;
    private OverrideHandlers overrides;
    private RecordingNotifier notifier;
    private RecoveryRouter testee;
    private LogRecorder logs;
    private java.util.logging.Level oldLevel;
    
    @BeforeEach
    void beforeEach() throws IOException {
        rsp = ServletMocks.response(new ServletMocks.Body());
        ctx = new DefaultRequestContext(
                ServletMocks.request("GET", "/x", null), rsp,
                Application.builder().build());
        overrides = new OverrideHandlers();
        notifier = new RecordingNotifier();
        testee = new RecoveryRouter(overrides, notifier);
        oldLevel = Logging.setLevel(RecoveryRouter.class, ALL);
        logs = LogRecorder.startRecording();
    }
    
    @AfterEach
    void afterEach() {
        logs.stopRecording();
        Logging.resetLevel(RecoveryRouter.class, oldLevel);
    }
    
    @Test
    void committed_givesUp() throws InterruptedException {
        when(rsp.isCommitted()).thenReturn(true);
        testee.handle(ctx, HttpError.notFound());
        verify(rsp, never()).setStatus(anyInt());
        logs.assertRemove(WARNING, "Request failed with 404: Not Found")
            .assertRemove(DEBUG, "Response already committed, can not write 404.");
        assertThat(notifier.take().error().statusCode()).isEqualTo(404);
        notifier.assertNoMore();
    }
    
    @Test
    void committed_overrideNotCalled() throws InterruptedException {
        when(rsp.isCommitted()).thenReturn(true);
        overrides.setNotFoundHandler(c -> { throw new AssertionError("Not expected"); });
        testee.handle(ctx, HttpError.notFound());
        notifier.take();
        notifier.assertNoMore();
    }
    
    @Test
    void stackOverflowInOverride_fallsBack() throws InterruptedException {
        overrides.setNotFoundHandler(c -> { throw new StackOverflowError(); });
        testee.handle(ctx, HttpError.notFound());
        verify(rsp).setStatus(404);
        logs.assertRemove(WARNING, "Override handler for 404 failed", HttpError.class);
        assertThat(notifier.take().error().statusCode()).isEqualTo(404);
        notifier.assertNoMore();
    }
    
    @Test
    void virtualMachineError_propagates_afterNotification()
            throws InterruptedException {
        var oom = new OutOfMemoryError("test");
        overrides.setErrorHandler(c -> { throw oom; });
        var err = HttpError.internalServerError("Database down", null);
        assertThatThrownBy(() -> testee.handle(ctx, err)).isSameAs(oom);
        assertThat(notifier.take().error()).isSameAs(err);
        notifier.assertNoMore();
    }
}
