package com.example.contractlens.domain;

public record LineSpan(int start, int end) {
    public static final LineSpan UNKNOWN = new LineSpan(0, 0);
}
