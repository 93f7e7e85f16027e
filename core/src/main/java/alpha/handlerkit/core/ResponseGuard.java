package alpha.handlerkit.core;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Enforces at most one terminal write per response.<p>
 *
 * A terminal write {@linkplain #claim(String) claims} the guard before it
 * touches the response. A second claim fails with an
 * {@code IllegalStateException} naming the operation holding the claim.<p>
 *
 * Only the recovery path may {@linkplain #release() release} a claim, and only
 * after it has reset the response's buffer, so the transport never sees two
 * terminal writes.<p>
 *
 * The guard is confined to the request thread and is not thread-safe.
 */
final class ResponseGuard
{
    private String owner;

    /**
     * Claims the response.
     *
     * @param operation name of the writing operation
     *
     * @throws NullPointerException if {@code operation} is {@code null}
     * @throws IllegalStateException if the response is already claimed
     */
    void claim(String operation) {
        requireUnclaimed(operation);
        owner = operation;
    }

    /**
     * Throws an {@code IllegalStateException} if the response is claimed.
     *
     * @param operation name of the operation about to modify the response
     *
     * @throws NullPointerException if {@code operation} is {@code null}
     * @throws IllegalStateException if the response is already claimed
     */
    void requireUnclaimed(String operation) {
        requireNonNull(operation);
        if (owner != null) {
            throw new IllegalStateException(
                "Response already written by \"" + owner + "\", " +
                "can not also \"" + operation + "\".");
        }
    }

    /**
     * {@return {@code true} if a terminal write has claimed the response}
     */
    boolean isClaimed() {
        return owner != null;
    }

    /**
     * {@return the name of the operation holding the claim, if any}
     */
    Optional<String> owner() {
        return Optional.ofNullable(owner);
    }

    void release() {
        owner = null;
    }
}
