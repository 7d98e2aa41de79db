package com.example.contractlens.infrastructure;

import com.example.contractlens.diff.LineDiffer;
import com.example.contractlens.domain.DiffLine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnifiedDiffRendererTest {

    private final UnifiedDiffRenderer renderer = new UnifiedDiffRenderer();

    @Test
    void renderProducesFallbackWhenContentMatches() {
        List<DiffLine> lines = new LineDiffer().diffLines("contract A {}", "contract A {}");

        String diff = renderer.render("Example.sol", lines, 3);

        assertTrue(
                diff.contains("--- Example.sol_orig"),
                "Diff should include original header when no textual differences exist.");
        assertTrue(
                diff.contains("+++ Example.sol_rev"),
                "Diff should include revised header when no textual differences exist.");
        assertTrue(
                diff.contains("@@ -0,0 +0,0 @@"),
                "Diff should include synthetic hunk when no textual differences exist.");
        assertTrue(
                diff.contains("No textual differences available."),
                "Diff should include explanatory message when no textual differences exist.");
    }

    @Test
    void renderUsesTheGivenEditScript() {
        List<DiffLine> lines = List.of(
                DiffLine.unchanged("contract A {", 1, 1),
                DiffLine.removed("    uint256 a;", 2),
                DiffLine.added("    uint256 b;", 2),
                DiffLine.unchanged("}", 3, 3));

        String diff = renderer.render("A.sol", lines, 3);

        assertTrue(diff.contains("@@ -1,3 +1,3 @@"), "Hunk should span the whole three-line file");
        assertTrue(diff.contains("-    uint256 a;"), "Removed line should be prefixed with '-'");
        assertTrue(diff.contains("+    uint256 b;"), "Added line should be prefixed with '+'");
        assertTrue(diff.contains(" contract A {"), "Context lines should be prefixed with a space");
    }

    @Test
    void renderLimitsContextAroundChanges() {
        StringBuilder left = new StringBuilder();
        StringBuilder right = new StringBuilder();
        for (int i = 1; i <= 20; i++) {
            left.append("line ").append(i).append('\n');
            right.append(i == 10 ? "changed" : "line " + i).append('\n');
        }
        List<DiffLine> lines = new LineDiffer().diffLines(left.toString(), right.toString());

        String diff = renderer.render("Long.sol", lines, 1);

        assertTrue(diff.contains(" line 9"));
        assertTrue(diff.contains(" line 11"));
        assertFalse(diff.contains(" line 8"), "Only one line of context should surround the change");
        assertFalse(diff.contains("No textual differences available."));
    }
}
