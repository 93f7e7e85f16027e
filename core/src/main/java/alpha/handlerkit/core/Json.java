package alpha.handlerkit.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Holder of the object mapper used for request and response bodies, and for
 * converting form values.<p>
 *
 * Unknown JSON properties in a request body are ignored. Dates are written as
 * ISO-8601 strings.
 */
final class Json
{
    private Json() {
        // Empty
    }

    private static final ObjectMapper M = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    static ObjectMapper mapper() {
        return M;
    }
}
