package alpha.grouprouter.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Baseclass for the immutable builders of configuration values.<p>
 * 
 * Each builder instance links back to the builder it was derived from and
 * stores only one modification. Setting a value therefore never mutates a
 * builder; it returns a new one. This makes it safe to share a builder, for
 * example {@code Config.DEFAULT.toBuilder()}, as a template.<p>
 * 
 * The chain of modifications is replayed, oldest first, against a fresh
 * mutable state container by {@link #constructState(Supplier)}.
 * 
 * @param <S> mutable state container
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
     * Constructs a builder derived from {@code prev}.
     * 
     * @param prev builder to derive from
     * @param modifier action to apply on the state
     * 
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a state container and replays all modifications against it.<p>
     * 
     * The concrete builder's {@code build()} method calls this method and
     * hands the result to the constructor of the built value.
     * 
     * @param factory of state
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> mods = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.push(b.modifier);
        }
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
