package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * @param symbols named symbols, empty for a bare or aliased import
 * @param alias null unless the import is aliased
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImportInfo(String path, List<String> symbols, String alias) {
    public ImportInfo {
        symbols = List.copyOf(symbols);
    }
}
