package com.example.contractlens.application;

import com.example.contractlens.diff.ImpactClassifier;
import com.example.contractlens.diff.LineDiffer;
import com.example.contractlens.diff.SemanticAnalysisMerger;
import com.example.contractlens.diff.StructuralDiffer;
import com.example.contractlens.domain.ChangeCategory;
import com.example.contractlens.domain.ChangeType;
import com.example.contractlens.domain.ComparisonTiming;
import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.domain.ContractVersion;
import com.example.contractlens.domain.DiffChange;
import com.example.contractlens.domain.DiffLine;
import com.example.contractlens.domain.DiffResult;
import com.example.contractlens.domain.DiffStats;
import com.example.contractlens.domain.DiffSummary;
import com.example.contractlens.domain.LineChangeType;
import com.example.contractlens.domain.SecurityImpact;
import com.example.contractlens.domain.SemanticAnalysis;
import com.example.contractlens.domain.SemanticAnalysisRequest;
import com.example.contractlens.domain.SemanticAnalysisResponse;
import com.example.contractlens.domain.StepTiming;
import com.example.contractlens.parser.ContractParser;
import com.example.contractlens.parser.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the comparison pipeline: parse both sides, diff lines and structure, classify
 * security impacts and, for the enriched variant, consult the semantic collaborator.
 * A side that cannot be parsed is compared as an empty model.
 */
@Service
public class ContractComparisonUseCase {
    private static final Logger log = LogManager.getLogger(ContractComparisonUseCase.class);

    static final int UNIFIED_CONTEXT_LINES = 3;

    private final ContractParser contractParser;
    private final LineDiffer lineDiffer;
    private final StructuralDiffer structuralDiffer;
    private final ImpactClassifier impactClassifier;
    private final SemanticAnalysisMerger semanticAnalysisMerger;
    private final DiffRenderer diffRenderer;
    private final SemanticAnalyzer semanticAnalyzer;
    private final Duration semanticTimeout;

    public ContractComparisonUseCase(
            ContractParser contractParser,
            LineDiffer lineDiffer,
            StructuralDiffer structuralDiffer,
            ImpactClassifier impactClassifier,
            SemanticAnalysisMerger semanticAnalysisMerger,
            DiffRenderer diffRenderer,
            SemanticAnalyzer semanticAnalyzer,
            @Value("${contract-lens.semantic.timeout:45s}") Duration semanticTimeout) {
        this.contractParser = contractParser;
        this.lineDiffer = lineDiffer;
        this.structuralDiffer = structuralDiffer;
        this.impactClassifier = impactClassifier;
        this.semanticAnalysisMerger = semanticAnalysisMerger;
        this.diffRenderer = diffRenderer;
        this.semanticAnalyzer = semanticAnalyzer;
        this.semanticTimeout = semanticTimeout;
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(List<StepTiming> timings, String label, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        timings.add(new StepTiming(label, seconds));
        return seconds;
    }

    public ContractModel parse(String sourceCode) throws ParseException {
        return contractParser.parse(sourceCode);
    }

    /** Rule-based comparison; the semantic collaborator is not consulted. */
    public DiffResult compare(ContractVersion contractA, ContractVersion contractB) {
        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();
        DiffResult result = analyze(contractA, contractB, timings).result();
        result.setTiming(new ComparisonTiming(timings, nanosToSeconds(System.nanoTime() - overallStart)));
        return result;
    }

    /**
     * Rule-based comparison enriched by the semantic collaborator. Any collaborator
     * failure, including running past the timeout, yields a degraded analysis built
     * from the rule-based findings instead of an error.
     */
    public DiffResult compareWithSemanticAnalysis(ContractVersion contractA, ContractVersion contractB) {
        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();
        Analysis analysis = analyze(contractA, contractB, timings);
        DiffResult result = analysis.result();

        long semanticStart = System.nanoTime();
        SemanticAnalysis semantic;
        try {
            SemanticAnalysisResponse response = requestSemanticAnalysis(new SemanticAnalysisRequest(
                    contractA, contractB, result.getChanges(), analysis.securityImpacts()));
            semantic = semanticAnalysisMerger.merge(result.getChanges(), analysis.securityImpacts(), response);
            double seconds = recordStep(timings, "Semantic analysis", semanticStart);
            log.info("Semantic analysis completed in {}s", seconds);
        } catch (CollaboratorFailureException e) {
            recordStep(timings, "Semantic analysis (fallback)", semanticStart);
            log.warn("Semantic analysis unavailable ({}), using rule-based results: {}", e.getReason(), e.getMessage());
            semantic = semanticAnalysisMerger.fallback(
                    result.getChanges(), analysis.securityImpacts(), e.getMessage());
        }

        result.setSemanticAnalysis(semantic);
        result.getSummary().setBreakingChanges(semantic.breakingChanges().size());
        result.getSummary().setNarrative(semantic.summary());
        result.setTiming(new ComparisonTiming(timings, nanosToSeconds(System.nanoTime() - overallStart)));
        return result;
    }

    private Analysis analyze(ContractVersion contractA, ContractVersion contractB, List<StepTiming> timings) {
        long parseStart = System.nanoTime();
        ContractModel modelA = parseOrEmpty(contractA, "left");
        double parseLeftSeconds = recordStep(timings, "Parse contract (left)", parseStart);
        log.info("Parsed left contract in {}s", parseLeftSeconds);

        parseStart = System.nanoTime();
        ContractModel modelB = parseOrEmpty(contractB, "right");
        double parseRightSeconds = recordStep(timings, "Parse contract (right)", parseStart);
        log.info("Parsed right contract in {}s", parseRightSeconds);

        long structuralStart = System.nanoTime();
        List<DiffChange> changes = structuralDiffer.diffModels(modelA, modelB);
        List<SecurityImpact> impacts = impactClassifier.classifySecurityImpacts(changes, modelA, modelB);
        double structuralSeconds = recordStep(timings, "Structural diff", structuralStart);
        log.info("Found {} structural change(s) and {} security impact(s) in {}s",
                changes.size(), impacts.size(), structuralSeconds);

        long textStart = System.nanoTime();
        List<DiffLine> textDiff = lineDiffer.diffLines(contractA.sourceCode(), contractB.sourceCode());
        String fileName = contractB.name().isBlank() ? "contract.sol" : contractB.name() + ".sol";
        String unifiedDiff = diffRenderer.render(fileName, textDiff, UNIFIED_CONTEXT_LINES);
        recordStep(timings, "Text diff", textStart);

        DiffResult result = new DiffResult(
                contractA, contractB, changes, summarize(changes), statistics(changes, textDiff));
        result.setSecurityImpacts(impacts);
        result.setTextDiff(textDiff);
        result.setUnifiedDiff(unifiedDiff);
        return new Analysis(result, impacts);
    }

    private ContractModel parseOrEmpty(ContractVersion version, String side) {
        try {
            return contractParser.parse(version.sourceCode());
        } catch (ParseException e) {
            log.warn("Could not parse {} contract '{}', comparing against an empty model: {}",
                    side, version.name(), e.getMessage());
            return ContractModel.empty(version.name());
        }
    }

    private SemanticAnalysisResponse requestSemanticAnalysis(SemanticAnalysisRequest request)
            throws CollaboratorFailureException {
        CompletableFuture<SemanticAnalysisResponse> future = CompletableFuture.supplyAsync(() -> {
            try {
                return semanticAnalyzer.analyze(request);
            } catch (CollaboratorFailureException e) {
                throw new CompletionException(e);
            }
        });
        try {
            return future.get(semanticTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorFailureException(
                    CollaboratorFailureException.Reason.TIMEOUT,
                    "Semantic analysis timed out after " + semanticTimeout.toMillis() + " ms",
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CollaboratorFailureException(
                    CollaboratorFailureException.Reason.TIMEOUT, "Semantic analysis was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof CollaboratorFailureException failure) {
                throw failure;
            }
            throw new CollaboratorFailureException(
                    CollaboratorFailureException.Reason.TRANSPORT, "Semantic analysis failed: " + cause, cause);
        }
    }

    private static DiffSummary summarize(List<DiffChange> changes) {
        int added = count(changes, ChangeType.ADDED);
        int removed = count(changes, ChangeType.REMOVED);
        int modified = count(changes, ChangeType.MODIFIED);
        int breaking = (int) changes.stream().filter(DiffChange::isBreaking).count();
        String narrative = changes.size() + " change(s) detected: " + breaking + " breaking.";
        return new DiffSummary(changes.size(), added, removed, modified, breaking, narrative);
    }

    private static int count(List<DiffChange> changes, ChangeType type) {
        return (int) changes.stream().filter(change -> change.type() == type).count();
    }

    static DiffStats statistics(List<DiffChange> changes, List<DiffLine> textDiff) {
        DiffStats stats = new DiffStats();
        int linesAdded = (int) textDiff.stream().filter(line -> line.type() == LineChangeType.ADDED).count();
        int linesRemoved = (int) textDiff.stream().filter(line -> line.type() == LineChangeType.REMOVED).count();
        stats.setLinesAdded(linesAdded);
        stats.setLinesRemoved(linesRemoved);
        stats.setLinesModified(Math.min(linesAdded, linesRemoved));

        for (ChangeCategory category : ChangeCategory.values()) {
            for (ChangeType type : ChangeType.values()) {
                stats.getCounts().put(DiffStats.countKey(category, type), 0);
            }
        }
        for (DiffChange change : changes) {
            stats.getCounts().merge(DiffStats.countKey(change.category(), change.type()), 1, Integer::sum);
        }

        stats.setFunctionsAdded(stats.count(ChangeCategory.FUNCTION, ChangeType.ADDED));
        stats.setFunctionsRemoved(stats.count(ChangeCategory.FUNCTION, ChangeType.REMOVED));
        stats.setFunctionsModified(stats.count(ChangeCategory.FUNCTION, ChangeType.MODIFIED));
        stats.setEventsAdded(stats.count(ChangeCategory.EVENT, ChangeType.ADDED));
        stats.setEventsRemoved(stats.count(ChangeCategory.EVENT, ChangeType.REMOVED));
        stats.setVariablesAdded(stats.count(ChangeCategory.VARIABLE, ChangeType.ADDED));
        stats.setVariablesRemoved(stats.count(ChangeCategory.VARIABLE, ChangeType.REMOVED));
        stats.setVariablesModified(stats.count(ChangeCategory.VARIABLE, ChangeType.MODIFIED));
        stats.setModifiersAdded(stats.count(ChangeCategory.MODIFIER, ChangeType.ADDED));
        stats.setModifiersRemoved(stats.count(ChangeCategory.MODIFIER, ChangeType.REMOVED));
        return stats;
    }

    private record Analysis(DiffResult result, List<SecurityImpact> securityImpacts) {}
}
