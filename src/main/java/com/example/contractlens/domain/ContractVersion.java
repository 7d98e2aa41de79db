package com.example.contractlens.domain;

/**
 * Identity and source of one side of a comparison. Multi-file verification
 * bundles arrive here already concatenated.
 */
public record ContractVersion(String address, String name, String sourceCode, String network) {
    public ContractVersion {
        address = address == null ? "" : address;
        name = name == null ? "" : name;
        sourceCode = sourceCode == null ? "" : sourceCode;
        network = network == null ? "" : network;
    }
}
