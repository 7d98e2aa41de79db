package com.example.contractlens.domain;

import java.util.List;

public record ComparisonTiming(List<StepTiming> steps, double totalSeconds) {
    public ComparisonTiming {
        steps = List.copyOf(steps);
    }
}
