package io.fuelpipelines.source;

/**
 * A data line whose field count does not match the header. It is carried in its chunk for counting
 * and dead-lettering but is never turned into a {@link RawRecord}.
 */
public record MalformedLine(long rowNumber, int expectedFields, int actualFields, String text) {}
