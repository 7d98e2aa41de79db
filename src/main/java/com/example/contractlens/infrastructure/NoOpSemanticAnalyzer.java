package com.example.contractlens.infrastructure;

import com.example.contractlens.application.CollaboratorFailureException;
import com.example.contractlens.application.SemanticAnalyzer;
import com.example.contractlens.domain.SemanticAnalysisRequest;
import com.example.contractlens.domain.SemanticAnalysisResponse;

/** Stands in when no collaborator is configured; every call fails with the configured reason. */
public class NoOpSemanticAnalyzer implements SemanticAnalyzer {
    private final CollaboratorFailureException.Reason reason;

    public NoOpSemanticAnalyzer(CollaboratorFailureException.Reason reason) {
        this.reason = reason;
    }

    @Override
    public SemanticAnalysisResponse analyze(SemanticAnalysisRequest request) throws CollaboratorFailureException {
        String message = reason == CollaboratorFailureException.Reason.MISSING_CREDENTIALS
                ? "No API key configured for semantic analysis"
                : "Semantic analysis is disabled";
        throw new CollaboratorFailureException(reason, message);
    }
}
