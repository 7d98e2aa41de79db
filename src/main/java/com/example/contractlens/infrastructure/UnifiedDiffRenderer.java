package com.example.contractlens.infrastructure;

import com.example.contractlens.application.DiffRenderer;
import com.example.contractlens.domain.DiffLine;
import com.example.contractlens.domain.LineChangeType;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.ChangeDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.DeleteDelta;
import com.github.difflib.patch.InsertDelta;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an already computed line edit script as a unified diff, so the hunks agree
 * with the line list returned next to them.
 */
@Component
public class UnifiedDiffRenderer implements DiffRenderer {
    private static final String NO_TEXTUAL_DIFFERENCES_MESSAGE = "No textual differences available.";

    @Override
    public String render(String fileName, List<DiffLine> lines, int contextSize) {
        List<String> originalLines = new ArrayList<>();
        Patch<String> patch = new Patch<>();
        List<String> removed = new ArrayList<>();
        List<String> added = new ArrayList<>();
        int originalPosition = 0;
        int revisedPosition = 0;
        for (DiffLine line : lines) {
            if (line.type() == LineChangeType.UNCHANGED) {
                if (!removed.isEmpty() || !added.isEmpty()) {
                    patch.addDelta(delta(originalPosition, removed, revisedPosition, added));
                    originalPosition += removed.size();
                    revisedPosition += added.size();
                    removed = new ArrayList<>();
                    added = new ArrayList<>();
                }
                originalLines.add(line.content());
                originalPosition++;
                revisedPosition++;
            } else if (line.type() == LineChangeType.REMOVED) {
                originalLines.add(line.content());
                removed.add(line.content());
            } else {
                added.add(line.content());
            }
        }
        if (!removed.isEmpty() || !added.isEmpty()) {
            patch.addDelta(delta(originalPosition, removed, revisedPosition, added));
        }

        int safeContextSize = Math.max(0, contextSize);
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                fileName + "_orig", fileName + "_rev", originalLines, patch, safeContextSize);
        if (unified.isEmpty()) {
            unified = List.of(
                    String.format("--- %s_orig", fileName),
                    String.format("+++ %s_rev", fileName),
                    "@@ -0,0 +0,0 @@",
                    " " + NO_TEXTUAL_DIFFERENCES_MESSAGE);
        }
        return String.join(System.lineSeparator(), unified) + System.lineSeparator();
    }

    private static AbstractDelta<String> delta(
            int originalPosition, List<String> removed, int revisedPosition, List<String> added) {
        Chunk<String> source = new Chunk<>(originalPosition, removed);
        Chunk<String> target = new Chunk<>(revisedPosition, added);
        if (removed.isEmpty()) {
            return new InsertDelta<>(source, target);
        }
        if (added.isEmpty()) {
            return new DeleteDelta<>(source, target);
        }
        return new ChangeDelta<>(source, target);
    }
}
