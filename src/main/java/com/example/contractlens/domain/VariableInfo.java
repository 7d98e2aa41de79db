package com.example.contractlens.domain;

/**
 * A state variable. {@code type} is the composed source spelling, e.g.
 * {@code mapping(address => uint256)}.
 */
public record VariableInfo(
        String name,
        String type,
        Visibility visibility,
        boolean constant,
        boolean immutable,
        LineSpan span)
        implements Named {}
