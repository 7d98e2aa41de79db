package com.example.contractlens.parser;

import com.example.contractlens.domain.ImportInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the compiler pragma and the import list straight from source text. The
 * syntax tree is not consulted; these scans also work on text the tree builder only
 * partially understood.
 */
public final class SourceScanner {
    private static final Pattern PRAGMA = Pattern.compile("pragma\\s+solidity\\s+([^;]+);");
    private static final Pattern NAMED_IMPORT =
            Pattern.compile("import\\s+\\{([^}]+)}\\s+from\\s+[\"']([^\"']+)[\"']");
    private static final Pattern DEFAULT_IMPORT =
            Pattern.compile("import\\s+[\"']([^\"']+)[\"'](?:\\s+as\\s+(\\w+))?");
    private static final Pattern WILDCARD_IMPORT =
            Pattern.compile("import\\s+\\*\\s+as\\s+(\\w+)\\s+from\\s+[\"']([^\"']+)[\"']");

    private SourceScanner() {}

    /** First {@code pragma solidity} constraint, or an empty string. */
    public static String pragma(String source) {
        Matcher matcher = PRAGMA.matcher(source);
        return matcher.find() ? matcher.group(1).trim() : "";
    }

    /**
     * Named imports first, in source order, then default and aliased imports whose
     * path was not already seen.
     */
    public static List<ImportInfo> imports(String source) {
        List<ImportInfo> imports = new ArrayList<>();
        Set<String> seenPaths = new HashSet<>();

        Matcher named = NAMED_IMPORT.matcher(source);
        while (named.find()) {
            List<String> symbols = Arrays.stream(named.group(1).split(","))
                    .map(String::trim)
                    .filter(symbol -> !symbol.isEmpty())
                    .toList();
            imports.add(new ImportInfo(named.group(2), symbols, null));
            seenPaths.add(named.group(2));
        }

        Matcher unit = DEFAULT_IMPORT.matcher(source);
        while (unit.find()) {
            if (seenPaths.add(unit.group(1))) {
                imports.add(new ImportInfo(unit.group(1), List.of(), unit.group(2)));
            }
        }

        Matcher wildcard = WILDCARD_IMPORT.matcher(source);
        while (wildcard.find()) {
            if (seenPaths.add(wildcard.group(2))) {
                imports.add(new ImportInfo(wildcard.group(2), List.of(), wildcard.group(1)));
            }
        }
        return imports;
    }
}
