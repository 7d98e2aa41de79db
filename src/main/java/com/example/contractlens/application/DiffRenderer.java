package com.example.contractlens.application;

import com.example.contractlens.domain.DiffLine;

import java.util.List;

public interface DiffRenderer {
    String render(String fileName, List<DiffLine> lines, int contextSize);
}
