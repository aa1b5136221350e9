package org.lambdacalc.cli;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of checking one example file.
 *
 * @param file         the checked file
 * @param lineCount    number of lines read
 * @param invalidLines 1-based numbers of the rejected lines
 */
public record CheckReport(Path file, int lineCount, List<Integer> invalidLines) {
    public CheckReport {
        invalidLines = List.copyOf(invalidLines);
    }

    public boolean allValid() {
        return invalidLines.isEmpty();
    }

    public int validCount() {
        return lineCount - invalidLines.size();
    }
}
