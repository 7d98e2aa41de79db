package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A function, event or modifier parameter.
 *
 * @param storageLocation {@code memory}, {@code storage} or {@code calldata}; null when absent
 * @param indexed only meaningful for event parameters
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Parameter(String name, String type, String storageLocation, boolean indexed) {
    public Parameter {
        name = name == null ? "" : name;
    }

    public static Parameter of(String name, String type) {
        return new Parameter(name, type, null, false);
    }
}
