package io.fuelpipelines.fuel;

/** Why an input row was left out of the table. */
public enum RejectionKind {
    /** Field count differs from the header; raised by the reader, never by the normalizer. */
    COLUMN_COUNT_MISMATCH,
    BAD_DECIMAL,
    BAD_DATE,
    BAD_TAX_ID,
    MISSING_MANDATORY_FIELD,
    BAD_STATE_CODE,
    UNKNOWN_PRODUCT
}
