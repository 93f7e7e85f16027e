package alpha.handlerkit.handler;

import static alpha.handlerkit.HttpConstants.StatusCode.FIVE_HUNDRED;
import static java.util.Objects.requireNonNull;

/**
 * Turns any failure into an {@link HttpError}.<p>
 *
 * A failure is either classified already (it is an {@code HttpError}) or it is
 * not, in which case it becomes a
 * {@value alpha.handlerkit.HttpConstants.StatusCode#FIVE_HUNDRED} (Internal
 * Server Error) with the failure as cause. There is no third alternative and
 * classification never fails.
 *
 * @see HttpError
 */
public final class ErrorClassifier
{
    private ErrorClassifier() {
        // Empty
    }

    /**
     * Classifies the given failure.<p>
     *
     * An {@code HttpError} is returned as-is, which makes the operation
     * idempotent; {@code classify(classify(x)) == classify(x)}.<p>
     *
     * Otherwise, a new {@code HttpError} is returned with status code
     * {@value alpha.handlerkit.HttpConstants.StatusCode#FIVE_HUNDRED}, the
     * string representation of the failure as message, and the failure as
     * cause.
     *
     * @param failure to classify
     *
     * @return a classified error (never {@code null})
     *
     * @throws NullPointerException if {@code failure} is {@code null}
     */
    public static HttpError classify(Throwable failure) {
        requireNonNull(failure);
        if (failure instanceof HttpError classified) {
            return classified;
        }
        return new HttpError(FIVE_HUNDRED, failure.toString(), failure);
    }
}
