package org.pragmatica.scripter.error;

import org.pragmatica.scripter.syntax.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rust-style rendering of an analysis problem against the source it came from.
 *
 * <p>Example output:
 * <pre>
 * warning: Could not analyze statement: found 'await x', kind was AWAIT_EXPRESSION
 *   --> lib/index.ts:3:5
 *    |
 *  3 |     await x;
 *    |     ^^^^^^^ kept as literal text
 *    |
 * </pre>
 *
 * @param message primary message
 * @param span    region the message refers to, underlined with {@code ^}
 * @param labels  labeled regions
 * @param notes   trailing notes
 */
public record Diagnostic(
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public record Label(SourceSpan span, String message) {}

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(message, span, List.of(), List.of());
    }

    /**
     * Warning describing an element that was kept as literal text.
     */
    public static Diagnostic fallback(AnalysisError.UnsupportedConstruct error) {
        return warning(error.message(), error.span())
            .withLabel("kept as literal text")
            .withHelp("the node renders its original text and ignores markDirty()");
    }

    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, labelMessage));
        return new Diagnostic(message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withHelp(String help) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add("help: " + help);
        return new Diagnostic(message, span, labels, List.copyOf(newNotes));
    }

    /**
     * Render the diagnostic with the affected source lines.
     *
     * @param source   text of the whole file
     * @param fileName file name shown in the location line, may be {@code null}
     */
    public String format(String source, String fileName) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("warning: ").append(message).append("\n");

        var location = span.start();
        sb.append("  --> ");
        if (fileName != null) {
            sb.append(fileName).append(":");
        }
        sb.append(location.line()).append(":").append(location.column()).append("\n");

        int firstLine = span.start().line();
        int lastLine = span.end().line();
        for (var label : labels) {
            firstLine = Math.min(firstLine, label.span().start().line());
            lastLine = Math.max(lastLine, label.span().end().line());
        }

        int gutter = String.valueOf(lastLine).length();
        var emptyGutter = " ".repeat(gutter + 1) + "|\n";

        sb.append(emptyGutter);
        for (int lineNum = Math.max(1, firstLine); lineNum <= Math.min(lastLine, lines.length); lineNum++) {
            var content = lines[lineNum - 1];
            sb.append(String.format("%" + gutter + "d", lineNum)).append(" | ").append(content).append("\n");

            var lineLabels = labelsOn(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutter)).append(" | ")
                  .append(underline(lineNum, content, lineLabels))
                  .append("\n");
            }
        }
        sb.append(emptyGutter);

        for (var note : notes) {
            sb.append(" ".repeat(gutter + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private List<Label> labelsOn(int lineNum) {
        var result = new ArrayList<Label>();

        if (labels.isEmpty() && covers(span, lineNum)) {
            result.add(new Label(span, ""));
        }
        for (var label : labels) {
            if (covers(label.span(), lineNum)) {
                result.add(label);
            }
        }
        return result;
    }

    private static boolean covers(SourceSpan span, int lineNum) {
        return span.start().line() <= lineNum && span.end().line() >= lineNum;
    }

    private static String underline(int lineNum, String content, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int column = 1;

        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(label -> startColumn(label, lineNum)))
                               .toList();

        for (var label : sorted) {
            int startCol = startColumn(label, lineNum);
            int endCol = label.span().end().line() == lineNum
                         ? label.span().end().column()
                         : content.length() + 1;

            if (startCol > column) {
                sb.append(" ".repeat(startCol - column));
                column = startCol;
            }

            int width = Math.max(1, endCol - startCol);
            sb.append("^".repeat(width));
            column += width;

            if (!label.message().isEmpty()) {
                sb.append(" ").append(label.message());
            }
        }
        return sb.toString();
    }

    private static int startColumn(Label label, int lineNum) {
        return label.span().start().line() == lineNum ? label.span().start().column() : 1;
    }
}
