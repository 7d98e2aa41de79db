package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Impact {
    BREAKING("breaking"),
    NON_BREAKING("non-breaking");

    private final String label;

    Impact(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Impact of(boolean breaking) {
        return breaking ? BREAKING : NON_BREAKING;
    }
}
