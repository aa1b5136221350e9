package org.lambdacalc.error;

import org.lambdacalc.error.LambdaError.LexicalError;
import org.lambdacalc.error.LambdaError.NestingTooDeep;
import org.lambdacalc.error.LambdaError.StructuralError;
import org.lambdacalc.error.LambdaError.TrailingTokens;
import org.lambdacalc.error.LambdaError.UnexpectedEnd;
import org.lambdacalc.error.LambdaError.UnexpectedToken;
import org.lambdacalc.lang.Cause;

import java.util.List;

/**
 * Rust-style rendering of a rejected line.
 *
 * <p>Example output:
 * <pre>
 * error[L004]: unmatched closing bracket
 *   --> invalid_examples.txt:3:4
 *   |
 * 3 | x y)
 *   |    ^ bracket ')' is not matched with an opening bracket '('
 *   |
 * </pre>
 *
 * @param code    error code, {@code null} for structural errors
 * @param message primary error message
 * @param offset  0-based index in the line the caret points at
 * @param width   number of characters underlined
 * @param label   text printed after the underline
 * @param notes   additional notes or suggestions
 */
public record Diagnostic(
    String code,
    String message,
    int offset,
    int width,
    String label,
    List<String> notes
) {
    private static final String STRUCTURAL_CODE = "P001";

    /**
     * Build the diagnostic for a failure cause produced by the lexer or parser.
     */
    public static Diagnostic of(Cause cause) {
        if (cause instanceof LexicalError lexical) {
            return lexical(lexical);
        }
        if (cause instanceof StructuralError structural) {
            return structural(structural);
        }
        return new Diagnostic(null, cause.message(), 0, 1, "", List.of());
    }

    private static Diagnostic lexical(LexicalError error) {
        var kind = error.kind();
        var notes = kind.help() == null
                    ? List.<String>of()
                    : List.of("help: " + kind.help());
        var width = kind == LexicalError.Kind.INVALID_VARIABLE_NAME
                    ? Math.max(1, error.detail().length())
                    : 1;
        return new Diagnostic(kind.code(), kind.summary(), error.offset(), width, kind.label(), notes);
    }

    private static Diagnostic structural(StructuralError error) {
        String label;
        if (error instanceof UnexpectedToken unexpected) {
            label = "expected " + unexpected.expected() + ", found " + unexpected.found();
        } else if (error instanceof UnexpectedEnd end) {
            label = "expected " + end.expected();
        } else if (error instanceof NestingTooDeep tooDeep) {
            label = "nested more than " + tooDeep.limit() + " levels";
        } else {
            label = "unconsumed " + ((TrailingTokens) error).found();
        }
        return new Diagnostic(STRUCTURAL_CODE, "malformed lambda term", error.offset(), 1, label,
                              List.of("note: " + error.message()));
    }

    /**
     * Format this diagnostic against the rejected line.
     *
     * @param line       the rejected line
     * @param filename   file the line came from, or {@code null}
     * @param lineNumber 1-based line number shown in the gutter
     * @return formatted diagnostic, ending with a newline
     */
    public String format(String line, String filename, int lineNumber) {
        var sb = new StringBuilder();

        sb.append("error");
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(lineNumber).append(":").append(offset + 1).append("\n");

        var lineNumStr = String.valueOf(lineNumber);
        var gutter = " ".repeat(lineNumStr.length() + 1);

        sb.append(gutter).append("|\n");
        sb.append(lineNumStr).append(" | ").append(line).append("\n");
        sb.append(gutter).append("| ")
          .append(" ".repeat(Math.max(0, offset)))
          .append("^".repeat(width));
        if (!label.isEmpty()) {
            sb.append(" ").append(label);
        }
        sb.append("\n");
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Format against a single line with no file name.
     */
    public String format(String line) {
        return format(line, null, 1);
    }

    /**
     * Single-line format for log messages, e.g. {@code terms.txt:3:4: error[L004]: unmatched closing bracket}.
     */
    public String formatSimple(String source, int lineNumber) {
        return String.format("%s:%d:%d: error%s: %s",
                             source,
                             lineNumber,
                             offset + 1,
                             code == null
                             ? ""
                             : "[" + code + "]",
                             message);
    }
}
