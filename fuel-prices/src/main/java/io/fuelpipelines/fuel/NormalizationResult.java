package io.fuelpipelines.fuel;

import java.util.Objects;

/** Outcome of normalizing one row: exactly one of a sale or a rejection. */
public final class NormalizationResult {
    private final FuelSale sale;
    private final Rejection rejection;

    private NormalizationResult(FuelSale sale, Rejection rejection) {
        this.sale = sale;
        this.rejection = rejection;
    }

    public static NormalizationResult accepted(FuelSale sale) {
        return new NormalizationResult(Objects.requireNonNull(sale), null);
    }

    public static NormalizationResult rejected(Rejection rejection) {
        return new NormalizationResult(null, Objects.requireNonNull(rejection));
    }

    public static NormalizationResult rejected(RejectionKind kind, String column, String detail) {
        return rejected(new Rejection(kind, column, detail));
    }

    public boolean isAccepted() { return sale != null; }

    /** @throws IllegalStateException when the row was rejected */
    public FuelSale sale() {
        if (sale == null) throw new IllegalStateException("Row was rejected: " + rejection);
        return sale;
    }

    /** @throws IllegalStateException when the row was accepted */
    public Rejection rejection() {
        if (rejection == null) throw new IllegalStateException("Row was accepted");
        return rejection;
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted{" + sale + '}' : "Rejected{" + rejection + '}';
    }
}
