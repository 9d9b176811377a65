package io.fuelpipelines.fuel;

/** The input could not be opened, bound or read. Fatal to the run. */
public class SourceUnavailableException extends Exception {
    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
