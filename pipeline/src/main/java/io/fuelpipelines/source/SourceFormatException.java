package io.fuelpipelines.source;

import java.io.IOException;

/** The input's header cannot be bound to the expected columns. */
public class SourceFormatException extends IOException {
    public SourceFormatException(String message) {
        super(message);
    }
}
