package com.example.contractlens.diff;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes type spellings before comparison: the short aliases {@code uint},
 * {@code int}, {@code byte}, {@code fixed} and {@code ufixed} become their canonical
 * sized forms wherever they appear (array elements and mapping keys and values
 * included), and runs of whitespace collapse to a single space.
 */
public final class TypeNames {
    private static final Pattern ALIAS = Pattern.compile("\\b(uint|int|byte|fixed|ufixed)\\b");
    private static final Map<String, String> CANONICAL = Map.of(
            "uint", "uint256",
            "int", "int256",
            "byte", "bytes1",
            "fixed", "fixed128x18",
            "ufixed", "ufixed128x18");

    private TypeNames() {}

    public static String normalize(String type) {
        if (type == null) {
            return "";
        }
        String collapsed = type.trim().replaceAll("\\s+", " ");
        Matcher matcher = ALIAS.matcher(collapsed);
        StringBuilder normalized = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(normalized, CANONICAL.get(matcher.group(1)));
        }
        matcher.appendTail(normalized);
        return normalized.toString();
    }
}
