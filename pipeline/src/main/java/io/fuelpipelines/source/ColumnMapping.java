package io.fuelpipelines.source;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps header names found in an input to canonical column names. Matching ignores case, accents,
 * a leading byte order mark, and runs of whitespace, '-' or '_', so "Regiao - Sigla", "REGIÃO_SIGLA"
 * and "regiao sigla" are the same name.
 */
public final class ColumnMapping {
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_\\-]+");

    private final Set<String> columns;
    private final Set<String> required;
    private final Map<String, String> byAlias;

    private ColumnMapping(Set<String> columns, Set<String> required, Map<String, String> byAlias) {
        this.columns = Collections.unmodifiableSet(columns);
        this.required = Collections.unmodifiableSet(required);
        this.byAlias = Map.copyOf(byAlias);
    }

    public static Builder builder() { return new Builder(); }

    /** Canonical columns in declaration order. */
    public Set<String> columns() { return columns; }


    public Optional<String> resolve(String headerName) {
        if (headerName == null) return Optional.empty();
        return Optional.ofNullable(byAlias.get(key(headerName)));
    }

    /**
     * Binds a header positionally. The result has one entry per header field: the canonical column
     * it maps to, or null for fields this mapping does not know.
     *
     * @throws SourceFormatException when a required column is absent or two fields map to one column
     */
    public List<String> bind(List<String> headerNames) throws SourceFormatException {
        List<String> bound = new ArrayList<>(headerNames.size());
        Set<String> seen = new LinkedHashSet<>();
        for (String name : headerNames) {
            String column = resolve(name).orElse(null);
            if (column != null && !seen.add(column)) {
                throw new SourceFormatException("Header maps column '" + column + "' more than once: " + headerNames);
            }
            bound.add(column);
        }
        List<String> missing = new ArrayList<>();
        for (String r : required) {
            if (!seen.contains(r)) missing.add(r);
        }
        if (!missing.isEmpty()) {
            throw new SourceFormatException("Header is missing required columns " + missing + ": " + headerNames);
        }
        return bound;
    }

    static String key(String name) {
        String s = name.replace("\uFEFF", "");
        s = DIACRITICS.matcher(Normalizer.normalize(s, Normalizer.Form.NFD)).replaceAll("");
        s = SEPARATORS.matcher(s.trim()).replaceAll(" ");
        return s.toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Set<String> columns = new LinkedHashSet<>();
        private final Set<String> required = new LinkedHashSet<>();
        private final Map<String, String> byAlias = new HashMap<>();

        private Builder() {}

        /** Declares a column; its own name is always accepted as an alias. */
        public Builder column(String name, boolean isRequired, String... aliases) {
            if (!columns.add(name)) throw new IllegalArgumentException("Duplicate column " + name);
            if (isRequired) required.add(name);
            alias(name, name);
            for (String a : aliases) alias(name, a);
            return this;
        }

        private void alias(String column, String alias) {
            String previous = byAlias.putIfAbsent(key(alias), column);
            if (previous != null && !previous.equals(column)) {
                throw new IllegalArgumentException("Alias '" + alias + "' already maps to " + previous);
            }
        }

        public ColumnMapping build() {
            return new ColumnMapping(new LinkedHashSet<>(columns), new LinkedHashSet<>(required), byAlias);
        }
    }
}
