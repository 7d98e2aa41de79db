package com.example.contractlens.domain;

/** Elapsed time of one comparison step. */
public record StepTiming(String step, double seconds) {}
