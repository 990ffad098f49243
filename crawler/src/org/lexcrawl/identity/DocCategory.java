package org.lexcrawl.identity;

import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Kind of legal instrument. The three-letter code is part of every global id.
 */
public enum DocCategory {
    CASE("CAS"),
    ACT("ACT"),
    RULE("RUL"),
    ORDER("ORD"),
    ORDINANCE("ORN"),
    REGULATION("REG"),
    TREATY("TRE"),
    CONSTITUTION("CON"),
    NOTIFICATION("NOT"),
    CIRCULAR("CIR"),
    GAZETTE("GAZ"),
    MISC("MIS");

    private final String code;

    DocCategory(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Accepts either the enum name or the code, case-insensitively.
     *
     * @throws IllegalArgumentException if neither matches
     */
    public static DocCategory parse(String value) {
        String upper = value.trim().toUpperCase(Locale.ROOT);
        for (DocCategory category : values()) {
            if (category.name().equals(upper) || category.code.equals(upper)) return category;
        }
        throw new IllegalArgumentException("Unknown document category: " + value);
    }

    public static DocCategory parseOrDefault(@Nullable String value, DocCategory fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return parse(value);
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
