package io.fuelpipelines.fuel;

/** The target store refused a replace or a batch insert. Fatal to the run. */
public class StoreUnavailableException extends Exception {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
