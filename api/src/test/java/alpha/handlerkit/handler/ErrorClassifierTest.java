package alpha.handlerkit.handler;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static alpha.handlerkit.handler.ErrorClassifier.classify;
import static java.lang.System.Logger.Level.ERROR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link ErrorClassifier}.
 */
final class ErrorClassifierTest
{
    @Test
    void httpError_isReturnedAsIs() {
        var err = HttpError.of(418, "Teapot");
        assertThat(classify(err)).isSameAs(err);
    }
    
    @Test
    void subclass_isReturnedAsIs() {
        class Conflict extends HttpError {
            Conflict() {
                super(409, "Version mismatch");
            }
        }
        var err = new Conflict();
        assertThat(classify(err)).isSameAs(err);
    }
    
    @Test
    void other_isInternalServerError() {
        var io = new IOException("disk");
        var err = classify(io);
        assertThat(err.statusCode()).isEqualTo(500);
        assertThat(err).hasMessage("java.io.IOException: disk")
                       .hasCause(io);
        assertThat(err.severity()).isEqualTo(ERROR);
    }
    
    @Test
    void noMessage() {
        assertThat(classify(new IllegalStateException()))
                .hasMessage("java.lang.IllegalStateException");
    }
    
    @Test
    void recoveredFault() {
        var npe = new NullPointerException("x");
        var err = classify(new RecoveredFaultException(npe));
        assertThat(err.statusCode()).isEqualTo(500);
        assertThat(err.getCause()).hasCause(npe);
        assertThat(err).hasMessage(
                "alpha.handlerkit.handler.RecoveredFaultException: " +
                "Recovered fault: java.lang.NullPointerException: x");
    }
    
    @Test
    void nullFailure() {
        assertThatThrownBy(() -> classify(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
