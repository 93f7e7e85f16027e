package alpha.handlerkit.spi;

import static java.util.Objects.requireNonNull;

/**
 * A problem with one field, found by a {@link FormDecoder}.
 *
 * @param field name of parameter or property
 * @param kind of problem
 * @param message description of the problem
 */
public record FieldError(String field, Kind kind, String message)
{
    /**
     * Constructs this object.
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public FieldError {
        requireNonNull(field);
        requireNonNull(kind);
        requireNonNull(message);
    }

    /**
     * Kind of problem.
     */
    public enum Kind {
        /** The parameter does not match a property of the target type. */
        UNKNOWN_FIELD,
        /** The value could not be converted to the property's type. */
        CONVERSION,
        /** A required property had no parameter. */
        MISSING_REQUIRED,
        /** The target value could not be created. */
        BINDING
    }

    @Override
    public String toString() {
        return field + " (" + kind + "): " + message;
    }
}
