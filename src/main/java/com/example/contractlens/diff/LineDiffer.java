package com.example.contractlens.diff;

import com.example.contractlens.domain.DiffLine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Line-level edit script between two texts.
 *
 * <p>Inputs whose line-count product stays within {@link #LCS_CELL_LIMIT} get a
 * minimal script from a full longest-common-subsequence table. On ties the backtrack,
 * which runs from the last lines upwards, takes the added line first, so in the final
 * script a replaced line reads as removed then added. Larger inputs go through a single
 * linear pass that keeps positional matches, classifies lines missing from the other
 * side as removed or added, and otherwise emits both. That pass never drops or
 * repeats a line, but its script is not minimal.
 */
@Component
public class LineDiffer {
    private static final Logger log = LogManager.getLogger(LineDiffer.class);

    public static final long LCS_CELL_LIMIT = 5_000_000L;

    public List<DiffLine> diffLines(String textA, String textB) {
        String[] linesA = splitLines(textA);
        String[] linesB = splitLines(textB);
        if ((long) linesA.length * linesB.length > LCS_CELL_LIMIT) {
            log.debug("Line diff of {}x{} lines exceeds the LCS limit, using linear pass", linesA.length, linesB.length);
            return linearDiff(linesA, linesB);
        }
        return lcsDiff(linesA, linesB);
    }

    static String[] splitLines(String text) {
        return (text == null ? "" : text).split("\\R", -1);
    }

    private static List<DiffLine> lcsDiff(String[] a, String[] b) {
        int m = a.length;
        int n = b.length;
        int[][] table = new int[m + 1][n + 1];
        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                if (a[i - 1].equals(b[j - 1])) {
                    table[i][j] = table[i - 1][j - 1] + 1;
                } else {
                    table[i][j] = Math.max(table[i - 1][j], table[i][j - 1]);
                }
            }
        }

        List<DiffLine> result = new ArrayList<>(m + n);
        int i = m;
        int j = n;
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0 && a[i - 1].equals(b[j - 1])) {
                result.add(DiffLine.unchanged(a[i - 1], i, j));
                i--;
                j--;
            } else if (j > 0 && (i == 0 || table[i][j - 1] >= table[i - 1][j])) {
                result.add(DiffLine.added(b[j - 1], j));
                j--;
            } else {
                result.add(DiffLine.removed(a[i - 1], i));
                i--;
            }
        }
        Collections.reverse(result);
        return result;
    }

    private static List<DiffLine> linearDiff(String[] a, String[] b) {
        Set<String> inA = new HashSet<>(List.of(a));
        Set<String> inB = new HashSet<>(List.of(b));
        List<DiffLine> result = new ArrayList<>(a.length + b.length);
        int i = 0;
        int j = 0;
        while (i < a.length || j < b.length) {
            if (i < a.length && j < b.length && a[i].equals(b[j])) {
                result.add(DiffLine.unchanged(a[i], i + 1, j + 1));
                i++;
                j++;
            } else if (i < a.length && !inB.contains(a[i])) {
                result.add(DiffLine.removed(a[i], i + 1));
                i++;
            } else if (j < b.length && !inA.contains(b[j])) {
                result.add(DiffLine.added(b[j], j + 1));
                j++;
            } else {
                if (i < a.length) {
                    result.add(DiffLine.removed(a[i], i + 1));
                    i++;
                }
                if (j < b.length) {
                    result.add(DiffLine.added(b[j], j + 1));
                    j++;
                }
            }
        }
        return result;
    }
}
