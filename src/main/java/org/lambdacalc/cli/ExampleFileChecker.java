package org.lambdacalc.cli;

import org.lambdacalc.LambdaParser;
import org.lambdacalc.error.Diagnostic;
import org.lambdacalc.lang.Cause;
import org.lambdacalc.lexer.LambdaLexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds the lines of an example file to a {@link LambdaParser} and reports on them.
 *
 * <p>Rejected lines are reported and skipped; the remaining lines are still processed.
 */
public final class ExampleFileChecker {
    private static final Logger logger = LoggerFactory.getLogger(ExampleFileChecker.class);
    private static final String TOKEN_SEPARATOR = "_";

    private final LambdaParser parser;
    private final PrintStream out;

    public ExampleFileChecker(LambdaParser parser, PrintStream out) {
        this.parser = parser;
        this.out = out;
    }

    /**
     * Lines of a file with surrounding whitespace removed.
     */
    public static List<String> readLines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8)
                    .stream()
                    .map(String::strip)
                    .toList();
    }

    /**
     * Tokenize every line, printing the joined tokens of valid lines and a diagnostic for invalid ones.
     */
    public CheckReport checkValidity(Path file) throws IOException {
        var lines = readLines(file);
        logger.info("Checking {} line(s) of {}", lines.size(), file);

        var invalidLines = new ArrayList<Integer>();
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            var lineNumber = i + 1;
            parser.tokenize(line)
                  .onSuccess(tokens -> out.println("The tokenized string for input string " + line + " is "
                                                   + LambdaLexer.join(tokens, TOKEN_SEPARATOR)))
                  .onFailure(cause -> {
                      invalidLines.add(lineNumber);
                      report(file, line, lineNumber, cause);
                  });
        }
        if (invalidLines.isEmpty()) {
            out.println("All lines are valid");
        }
        return new CheckReport(file, lines.size(), invalidLines);
    }

    /**
     * Print the parse tree of every valid line, each preceded by a blank line.
     */
    public void printTrees(Path file) throws IOException {
        var lines = readLines(file);
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            var lineNumber = i + 1;
            var tokens = parser.tokenize(line);
            if (tokens.isFailure()) {
                continue;
            }
            parser.parse(tokens.unwrap())
                  .onSuccess(tree -> {
                      out.println();
                      parser.printTree(tree, out);
                  })
                  .onFailure(cause -> report(file, line, lineNumber, cause));
        }
    }

    private void report(Path file, String line, int lineNumber, Cause cause) {
        var diagnostic = Diagnostic.of(cause);
        var fileName = file.getFileName()
                           .toString();
        logger.warn(diagnostic.formatSimple(fileName, lineNumber));
        out.print(diagnostic.format(line, fileName, lineNumber));
    }
}
