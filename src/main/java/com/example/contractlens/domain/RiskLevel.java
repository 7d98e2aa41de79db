package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup; unknown or missing labels map to {@link #LOW}. */
    @JsonCreator
    public static RiskLevel fromLabel(String label) {
        if (label == null) {
            return LOW;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}
