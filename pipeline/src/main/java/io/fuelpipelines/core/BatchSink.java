package io.fuelpipelines.core;

import java.util.List;

/** Sink that persists items a batch at a time; a batch is accepted entirely or not at all. */
public interface BatchSink<T> {
    void acceptBatch(List<T> items) throws Exception;
}
