package com.example.contractlens.web;

import com.example.contractlens.application.ComparisonCache;
import com.example.contractlens.application.ContractComparisonUseCase;
import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.domain.ContractVersion;
import com.example.contractlens.domain.DiffResult;
import com.example.contractlens.parser.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;

@RestController
@RequestMapping("/api/contracts")
public class ContractLensController {
    private static final Logger log = LogManager.getLogger(ContractLensController.class);

    private final ContractComparisonUseCase comparisonUseCase;
    private final ComparisonCache comparisonCache;

    public ContractLensController(ContractComparisonUseCase comparisonUseCase, ComparisonCache comparisonCache) {
        this.comparisonUseCase = comparisonUseCase;
        this.comparisonCache = comparisonCache;
    }

    @PostMapping("/parse")
    public ContractModel parse(@RequestBody ParseRequest request) throws ParseException {
        if (request.getSourceCode() == null || request.getSourceCode().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Source code is required");
        }
        return comparisonUseCase.parse(request.getSourceCode());
    }

    @PostMapping("/diff")
    public DiffResult diff(@RequestBody DiffRequest request) {
        ContractVersion contractA = request.getContractA();
        ContractVersion contractB = request.getContractB();
        if (contractA == null || contractB == null
                || contractA.sourceCode().isBlank() || contractB.sourceCode().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Both contract sources are required");
        }
        boolean addressed = !contractA.address().isBlank() && !contractB.address().isBlank();
        if (addressed && contractA.address().equalsIgnoreCase(contractB.address())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Cannot compare a contract with itself");
        }

        String cacheKey = addressed
                ? ComparisonCache.key(contractA.address(), contractB.address(), contractA.network(),
                        contractA.sourceCode(), contractB.sourceCode(), request.isIncludeSemanticAnalysis())
                : null;
        if (cacheKey != null) {
            Optional<DiffResult> cached = comparisonCache.get(cacheKey);
            if (cached.isPresent()) {
                log.info("Serving cached comparison {}", cacheKey);
                return cached.get();
            }
        }

        DiffResult result = request.isIncludeSemanticAnalysis()
                ? comparisonUseCase.compareWithSemanticAnalysis(contractA, contractB)
                : comparisonUseCase.compare(contractA, contractB);
        if (cacheKey != null) {
            comparisonCache.put(cacheKey, result);
        }
        return result;
    }
}
