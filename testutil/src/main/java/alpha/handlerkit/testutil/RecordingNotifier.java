package alpha.handlerkit.testutil;

import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.Notifier;
import alpha.handlerkit.handler.RequestMetadata;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * A notifier that records its reports.<p>
 * 
 * The notifier is called by the servlet container's worker thread, possibly
 * after the client has received the response. {@link #take()} therefore waits
 * for a report to arrive.
 */
public final class RecordingNotifier implements Notifier
{
    /**
     * A recorded report.
     * 
     * @param error reported
     * @param metadata reported
     */
    public record Report(HttpError error, RequestMetadata metadata) {
        // Empty
    }
    
    private final BlockingQueue<Report> reports = new LinkedBlockingQueue<>();
    
    @Override
    public void report(HttpError error, RequestMetadata metadata) {
        reports.add(new Report(error, metadata));
    }
    
    /**
     * Removes and returns the earliest report, waiting at most 3 seconds for
     * it to arrive.
     * 
     * @return the report
     * 
     * @throws InterruptedException if interrupted while waiting
     * @throws AssertionError if no report arrived
     */
    public Report take() throws InterruptedException {
        var r = reports.poll(3, SECONDS);
        assertThat(r).as("Notifier report").isNotNull();
        return r;
    }
    
    /**
     * Asserts that there are no more reports.<p>
     * 
     * Should be called after {@link #take()}, which guarantees that the
     * notifier has run for the request.
     * 
     * @throws AssertionError if there are more reports
     */
    public void assertNoMore() {
        assertThat(List.copyOf(reports)).isEmpty();
    }
}
