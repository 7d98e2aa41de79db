package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declared visibility. Constants are ordered from most to least restrictive, so
 * {@link #isRelaxedComparedTo(Visibility)} is a plain ordinal comparison.
 */
public enum Visibility {
    PRIVATE,
    INTERNAL,
    EXTERNAL,
    PUBLIC;

    @JsonValue
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isExternallyCallable() {
        return this == PUBLIC || this == EXTERNAL;
    }

    public boolean isRelaxedComparedTo(Visibility before) {
        return ordinal() > before.ordinal();
    }

    public static Visibility fromKeyword(String keyword) {
        for (Visibility visibility : values()) {
            if (visibility.keyword().equals(keyword)) {
                return visibility;
            }
        }
        return null;
    }
}
