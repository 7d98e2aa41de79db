package com.example.contractlens.parser;

import com.example.contractlens.analysis.CallGraphAnalyzer;
import com.example.contractlens.domain.ContractModel;
import com.example.contractlens.parser.syntax.SourceUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Entry point for turning contract source into a {@link ContractModel}. Parsing is
 * tolerant: recoverable syntax errors are logged and skipped. Source that cannot be
 * tokenized, or that nests too deeply to walk, fails with {@link ParseException};
 * callers that need a model regardless must substitute {@link ContractModel#empty(String)} themselves.
 */
@Component
public class ContractParser {
    private static final Logger log = LogManager.getLogger(ContractParser.class);

    private final CallGraphAnalyzer callGraphAnalyzer;

    public ContractParser(CallGraphAnalyzer callGraphAnalyzer) {
        this.callGraphAnalyzer = callGraphAnalyzer;
    }

    public ContractModel parse(String source) throws ParseException {
        String text = source == null ? "" : source;
        SourceUnit unit = SourceUnitParser.parse(text);
        if (!unit.diagnostics().isEmpty()) {
            log.debug(
                    "Recovered from {} syntax error(s), first at line {}: {}",
                    unit.diagnostics().size(),
                    unit.diagnostics().get(0).line(),
                    unit.diagnostics().get(0).message());
        }
        int totalLines = text.split("\n", -1).length;
        try {
            return new ContractModelExtractor(callGraphAnalyzer)
                    .extract(unit, SourceScanner.pragma(text), SourceScanner.imports(text), totalLines);
        } catch (StackOverflowError e) {
            throw new ParseException("Source nests too deeply to analyze", 1, 1);
        }
    }
}
