package alpha.handlerkit.spi;

import java.io.Serial;
import java.util.List;
import java.util.Optional;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * Thrown by a {@link FormDecoder} if at least one field did not decode.<p>
 *
 * The exception carries all problems found and the value decoded from the
 * remaining fields, if the value could be created.
 */
public final class FormDecodeException extends Exception
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final transient List<FieldError> errors;
    private final transient Object value;

    /**
     * Constructs this object.
     *
     * @param errors all problems found
     * @param value partially decoded value (may be {@code null})
     *
     * @throws NullPointerException
     *             if {@code errors} is {@code null} or has a {@code null} element
     * @throws IllegalArgumentException
     *             if {@code errors} is empty
     */
    public FormDecodeException(List<FieldError> errors, Object value) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
        this.value = value;
    }

    private static String describe(List<FieldError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("No errors.");
        }
        return errors.stream().map(FieldError::toString).collect(joining("; "));
    }

    /**
     * {@return all problems found (never empty)}
     */
    public List<FieldError> errors() {
        return errors;
    }

    /**
     * Returns the partially decoded value.<p>
     *
     * All fields without a problem are populated.
     *
     * @return the value, if it could be created
     */
    public Optional<Object> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns an exception without the problems of the given kind.
     *
     * @param kind of problems to exclude
     *
     * @return a new exception, or empty if only problems of the given kind
     *         were found
     */
    public Optional<FormDecodeException> excluding(FieldError.Kind kind) {
        List<FieldError> rest = errors.stream()
                .filter(e -> e.kind() != kind)
                .collect(toList());
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        var exc = new FormDecodeException(rest, value);
        exc.setStackTrace(getStackTrace());
        return Optional.of(exc);
    }
}
