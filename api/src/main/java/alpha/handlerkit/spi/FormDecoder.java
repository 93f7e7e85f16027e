package alpha.handlerkit.spi;

import java.util.Map;

/**
 * Decodes request parameters into a typed value.<p>
 *
 * The decoder does not stop at the first problem. It decodes what it can and
 * then throws a {@link FormDecodeException} listing all problems found,
 * together with the partially decoded value.<p>
 *
 * A parameter that does not match a property of the target type must be
 * reported as {@link FieldError.Kind#UNKNOWN_FIELD}. The caller decides
 * whether to care; the request context does not.<p>
 *
 * The implementation must be thread-safe.
 */
@FunctionalInterface
public interface FormDecoder
{
    /**
     * Decodes parameters.
     *
     * @param values parameter values by name
     * @param type to decode into
     * @param <T> type to decode into
     *
     * @return a new instance of the type
     *
     * @throws FormDecodeException if there was at least one problem
     */
    <T> T decode(Map<String, String[]> values, Class<T> type) throws FormDecodeException;
}
