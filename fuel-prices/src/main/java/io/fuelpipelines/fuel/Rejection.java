package io.fuelpipelines.fuel;

import java.util.Objects;

/**
 * @param column the offending column, null for structural rejections
 */
public record Rejection(RejectionKind kind, String column, String detail) {
    public Rejection {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(detail);
    }
}
