package io.fuelpipelines.error;

import java.io.IOException;

public interface DeadLetterSink extends AutoCloseable {
    void accept(DeadLetter letter) throws IOException;

    @Override
    default void close() throws IOException {}
}
