package alpha.handlerkit.handler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link HttpError}.
 */
final class HttpErrorTest
{
    @Test
    void factories() {
        assertThat(HttpError.notFound().statusCode()).isEqualTo(404);
        assertThat(HttpError.notFound()).hasMessage("Not Found");
        assertThat(HttpError.forbidden().statusCode()).isEqualTo(403);
        assertThat(HttpError.methodNotAllowed().statusCode()).isEqualTo(405);
        assertThat(HttpError.badRequest("Bad date").statusCode()).isEqualTo(400);
        var cause = new RuntimeException();
        assertThat(HttpError.internalServerError("Oops", cause))
                .hasMessage("Oops")
                .hasCause(cause);
    }
    
    @Test
    void severity() {
        assertThat(HttpError.notFound().severity()).isEqualTo(WARNING);
        assertThat(HttpError.of(503, "Later").severity()).isEqualTo(ERROR);
    }
    
    @ParameterizedTest
    @ValueSource(ints = {0, 200, 302, 399, 600})
    void notAnErrorCode(int code) {
        assertThatThrownBy(() -> HttpError.of(code, "msg"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Not an error status code: " + code);
    }
    
    @Test
    void toString_() {
        assertThat(HttpError.of(409, "Taken"))
                .hasToString("alpha.handlerkit.handler.HttpError{statusCode=409, message=Taken}");
    }
}
