package io.fuelpipelines.fuel;

import java.util.Locale;
import java.util.Optional;

/** Products surveyed by the ANP price collection, across its gasoline/ethanol, diesel/GNV and GLP files. */
public enum Product {
    GASOLINA("GASOLINA"),
    GASOLINA_ADITIVADA("GASOLINA ADITIVADA"),
    ETANOL("ETANOL"),
    DIESEL("DIESEL"),
    DIESEL_S10("DIESEL S10"),
    DIESEL_S500("DIESEL S500"),
    GNV("GNV"),
    GLP("GLP");

    private final String label;

    Product(String label) { this.label = label; }

    /** The label stored in the table and shown in reports. */
    public String label() { return label; }

    /** Case-insensitive lookup that tolerates padding and repeated inner spaces. */
    public static Optional<Product> fromLabel(String text) {
        if (text == null) return Optional.empty();
        String wanted = text.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        for (Product p : values()) {
            if (p.label.equals(wanted)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
