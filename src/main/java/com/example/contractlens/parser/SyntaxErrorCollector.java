package com.example.contractlens.parser;

import com.example.contractlens.parser.syntax.SyntaxDiagnostic;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/** Records every error the parser recovers from as a {@link SyntaxDiagnostic}. */
class SyntaxErrorCollector extends BaseErrorListener {
    private final List<SyntaxDiagnostic> diagnostics = new ArrayList<>();

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        diagnostics.add(new SyntaxDiagnostic(msg, line, charPositionInLine + 1));
    }

    List<SyntaxDiagnostic> diagnostics() {
        return diagnostics;
    }
}
