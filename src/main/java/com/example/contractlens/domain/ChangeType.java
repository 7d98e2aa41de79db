package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChangeType {
    ADDED,
    REMOVED,
    MODIFIED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
