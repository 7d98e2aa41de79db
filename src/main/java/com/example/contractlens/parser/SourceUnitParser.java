package com.example.contractlens.parser;

import com.example.contractlens.parser.antlr.SolidityLexer;
import com.example.contractlens.parser.antlr.SolidityParser;
import com.example.contractlens.parser.syntax.SourceUnit;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Builds the syntax tree for one source file with the generated ANTLR parser.
 *
 * <p>Lexical failures (an unknown character, an unterminated string or block comment)
 * and nesting beyond {@link #MAX_NESTING_DEPTH} fail with {@link ParseException}.
 * Everything the parser can recover from ends up in {@link SourceUnit#diagnostics()}.
 */
public final class SourceUnitParser {
    public static final int MAX_NESTING_DEPTH = 256;

    private SourceUnitParser() {}

    public static SourceUnit parse(String source) throws ParseException {
        CharStream input = CharStreams.fromString(source == null ? "" : source);
        SolidityLexer lexer = new SolidityLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new BaseErrorListener() {
            @Override
            public void syntaxError(
                    Recognizer<?, ?> recognizer,
                    Object offendingSymbol,
                    int line,
                    int charPositionInLine,
                    String msg,
                    RecognitionException e) {
                throw new LexicalError(msg, line, charPositionInLine + 1);
            }
        });

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        try {
            tokens.fill();
        } catch (LexicalError e) {
            throw new ParseException(e.getMessage(), e.line, e.column);
        }
        checkTokens(tokens);

        SolidityParser parser = new SolidityParser(tokens);
        parser.removeErrorListeners();
        SyntaxErrorCollector collector = new SyntaxErrorCollector();
        parser.addErrorListener(collector);
        parser.setErrorHandler(new DefaultErrorStrategy());

        try {
            SolidityParser.SourceUnitContext tree = parser.sourceUnit();
            return new SyntaxTreeBuilder(input).build(tree, collector.diagnostics());
        } catch (SyntaxTreeBuilder.NestingTooDeep e) {
            throw new ParseException(e.getMessage(), e.line, e.column);
        } catch (StackOverflowError e) {
            throw new ParseException("Source nests too deeply to parse", 1, 1);
        }
    }

    private static void checkTokens(CommonTokenStream tokens) throws ParseException {
        int depth = 0;
        for (Token token : tokens.getTokens()) {
            switch (token.getType()) {
                case SolidityLexer.UnterminatedStringLiteral -> throw new ParseException(
                        "Unterminated string literal", token.getLine(), token.getCharPositionInLine() + 1);
                case SolidityLexer.UnterminatedBlockComment -> throw new ParseException(
                        "Unterminated block comment", token.getLine(), token.getCharPositionInLine() + 1);
                case SolidityLexer.LParen, SolidityLexer.LBrack, SolidityLexer.LBrace -> {
                    if (++depth > MAX_NESTING_DEPTH) {
                        throw new ParseException(
                                "Nesting deeper than " + MAX_NESTING_DEPTH + " levels",
                                token.getLine(),
                                token.getCharPositionInLine() + 1);
                    }
                }
                case SolidityLexer.RParen, SolidityLexer.RBrack, SolidityLexer.RBrace -> depth = Math.max(0, depth - 1);
                default -> { }
            }
        }
    }

    private static final class LexicalError extends RuntimeException {
        private final int line;
        private final int column;

        LexicalError(String message, int line, int column) {
            super(message, null, false, false);
            this.line = line;
            this.column = column;
        }
    }
}
