package com.example.contractlens.application;

import com.example.contractlens.domain.SemanticAnalysisRequest;
import com.example.contractlens.domain.SemanticAnalysisResponse;

/**
 * Optional narrative enrichment of a comparison. Implementations may block; the
 * caller bounds the wait and falls back to rule-based results on any failure.
 */
public interface SemanticAnalyzer {
    SemanticAnalysisResponse analyze(SemanticAnalysisRequest request) throws CollaboratorFailureException;
}
