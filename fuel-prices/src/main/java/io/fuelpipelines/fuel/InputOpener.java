package io.fuelpipelines.fuel;

import java.io.InputStream;

/** Opens the raw CSV byte stream for a source location. */
@FunctionalInterface
public interface InputOpener {
    InputStream open(String location) throws SourceUnavailableException;
}
