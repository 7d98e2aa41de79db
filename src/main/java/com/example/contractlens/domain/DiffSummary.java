package com.example.contractlens.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DiffSummary {
    private int totalChanges;
    private int added;
    private int removed;
    private int modified;
    private int breakingChanges;
    private String narrative;
}
