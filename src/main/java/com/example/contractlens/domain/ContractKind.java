package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContractKind {
    CONTRACT,
    INTERFACE,
    LIBRARY,
    ABSTRACT;

    @JsonValue
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
