package com.queryforge.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Supported target dialects.
 *
 * Each dialect carries the label clients send (e.g. "SQL Server") and the family whose rules apply to it.
 */
public enum Dialect {
    MYSQL("MySQL", DialectFamily.RELATIONAL),
    POSTGRESQL("PostgreSQL", DialectFamily.RELATIONAL),
    SQL_SERVER("SQL Server", DialectFamily.RELATIONAL),
    SQLITE("SQLite", DialectFamily.RELATIONAL),
    ORACLE("Oracle", DialectFamily.RELATIONAL),
    MONGODB("MongoDB", DialectFamily.DOCUMENT);

    private final String label;
    private final DialectFamily family;

    Dialect(String label, DialectFamily family) {
        this.label = label;
        this.family = family;
    }

    public String getLabel() {
        return label;
    }

    public DialectFamily getFamily() {
        return family;
    }

    /**
     * All dialect labels in declaration order.
     *
     * @return labels
     */
    public static List<String> labels() {
        return Arrays.stream(values()).map(Dialect::getLabel).toList();
    }

    /**
     * Resolve a dialect by label, ignoring case and surrounding whitespace.
     *
     * @param label incoming label
     * @return dialect, empty when the label is unknown
     */
    public static Optional<Dialect> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String v = label.trim();
        for (Dialect d : values()) {
            if (d.label.equalsIgnoreCase(v)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
