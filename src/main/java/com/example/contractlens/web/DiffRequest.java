package com.example.contractlens.web;

import com.example.contractlens.domain.ContractVersion;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class DiffRequest {
    private ContractVersion contractA;
    private ContractVersion contractB;
    private boolean includeSemanticAnalysis;
}
