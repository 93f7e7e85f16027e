package alpha.handlerkit.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Base class of immutable builders.<p>
 *
 * Each builder instance links back to the builder it was derived from and
 * holds nothing but one modification. When the built object is about to be
 * created, the chain is walked from the root and each modification is replayed
 * against a fresh mutable state container. Any builder in the chain can
 * therefore be shared and derived from again, concurrently.
 *
 * @param <S> type of the mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;

    /**
     * Constructs a root builder (no modifications).
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }

    /**
     * Constructs a builder derived from another.
     *
     * @param prev builder derived from
     * @param modifier to apply on the state
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }

    /**
     * Creates a state container and replays all modifications of this chain
     * against it, oldest first.
     *
     * @param factory of the state container
     *
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.addFirst(b.modifier);
        }
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
