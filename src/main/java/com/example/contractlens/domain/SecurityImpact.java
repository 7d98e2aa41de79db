package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityImpact(String change, String impact, Severity severity, String recommendation) {}
