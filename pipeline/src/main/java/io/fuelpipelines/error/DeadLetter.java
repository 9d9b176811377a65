package io.fuelpipelines.error;

/**
 * A rejected input row kept for human correction.
 *
 * @param rowNumber 1-based data row of the input
 * @param reason    machine-readable rejection kind
 * @param detail    human-readable explanation, may name the offending column
 * @param payload   the row as read, or a rendering of it
 */
public record DeadLetter(long rowNumber, String reason, String detail, String payload) {}
