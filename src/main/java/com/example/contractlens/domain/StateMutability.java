package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StateMutability {
    PURE,
    VIEW,
    NONPAYABLE,
    PAYABLE;

    @JsonValue
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** True for {@code view} and {@code pure}: the function cannot write state. */
    public boolean isReadOnly() {
        return this == PURE || this == VIEW;
    }

    public static StateMutability fromKeyword(String keyword) {
        if ("constant".equals(keyword)) {
            return VIEW;
        }
        for (StateMutability mutability : values()) {
            if (mutability.keyword().equals(keyword)) {
                return mutability;
            }
        }
        return null;
    }
}
