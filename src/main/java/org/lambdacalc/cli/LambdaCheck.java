package org.lambdacalc.cli;

import org.lambdacalc.LambdaParser;
import org.lambdacalc.lexer.DotScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line checker for files of lambda terms, one term per line.
 *
 * <pre>
 * usage: LambdaCheck [--tree | --no-tree] [--dot-scope=global|enclosing] [file...]
 * </pre>
 *
 * <p>Without files, checks {@code valid_examples.txt} (printing its trees) and then
 * {@code invalid_examples.txt} from the working directory.
 */
public final class LambdaCheck {
    private static final Logger logger = LoggerFactory.getLogger(LambdaCheck.class);

    static final List<String> DEFAULT_FILES = List.of("valid_examples.txt", "invalid_examples.txt");
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 2;

    private static final String USAGE = "usage: LambdaCheck [--tree | --no-tree] [--dot-scope=global|enclosing] [file...]";

    private LambdaCheck() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, Path.of(""));
    }

    /**
     * Run against files resolved from {@code workingDirectory}.
     */
    static int run(String[] args, PrintStream out, PrintStream err, Path workingDirectory) {
        Boolean trees = null;
        var dotScope = DotScope.GLOBAL_COUNT;
        var files = new ArrayList<String>();

        for (var arg : args) {
            switch (arg) {
                case "--tree" -> trees = Boolean.TRUE;
                case "--no-tree" -> trees = Boolean.FALSE;
                case "--dot-scope=global" -> dotScope = DotScope.GLOBAL_COUNT;
                case "--dot-scope=enclosing" -> dotScope = DotScope.ENCLOSING_GROUP;
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Unknown option: " + arg);
                        err.println(USAGE);
                        return EXIT_FAILURE;
                    }
                    files.add(arg);
                }
            }
        }

        var useDefaults = files.isEmpty();
        if (useDefaults) {
            files.addAll(DEFAULT_FILES);
        }

        var checker = new ExampleFileChecker(LambdaParser.builder()
                                                         .dotScope(dotScope)
                                                         .build(),
                                             out);
        for (int i = 0; i < files.size(); i++) {
            var file = workingDirectory.resolve(files.get(i));
            // by default only the valid examples get their trees printed
            var printTrees = trees != null
                             ? trees
                             : !useDefaults || i == 0;
            try {
                var report = checker.checkValidity(file);
                logger.info("{}: {} of {} line(s) valid", file, report.validCount(), report.lineCount());
                if (printTrees) {
                    checker.printTrees(file);
                }
            } catch (IOException e) {
                logger.error("Cannot read {}", file, e);
                err.println("Cannot read " + file + ": " + e.getMessage());
                return EXIT_FAILURE;
            }
        }
        return EXIT_OK;
    }
}
