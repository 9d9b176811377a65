package io.fuelpipelines.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A Source produces items in a deterministic order until it is exhausted. Sources are finite and
 * single-pass: they consume the underlying input, so a new run needs a new Source over a fresh input.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next item. Returns empty once the source is exhausted; after that {@link #isFinished()}
     * is true and every further call returns empty.
     *
     * @throws IOException when the underlying input cannot be read
     */
    Optional<T> poll() throws IOException;

    /**
     * Whether the source has reached its end and will produce no more items.
     */
    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
