package org.astroller.engine.result;

import org.astroller.dsl.ListExpansion;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats a result tree as a readable computation trace.
 *
 * A scalar renders as one line, {@code notation => rolls => reduced = value}:
 * <pre>
 * (2d20 kh1 + 8) => ([13, 8] + 8) => 13 + 8 = 21
 * </pre>
 * Lists and sequences render as a title line followed by indented detail
 * lines and one numbered block per element:
 * <pre>
 * List Expansion: 2 (2d20 kh1 + 8)
 *   Count: 2 => 2
 *   Expression: (2d20 kh1 + 8)
 *   Results: [21, 26]
 *   0: 
 *     (2d20 kh1 + 8) => ([13, 8] + 8) => 13 + 8 = 21
 *   1: 
 *     (2d20 kh1 + 8) => ([6, 18] + 8) => 18 + 8 = 26
 * </pre>
 */
public final class ResultRenderer {

    private static final String INDENT = "  ";
    private static final String LAYER_SEPARATOR = " => ";

    private ResultRenderer() {
        // Static utility class
    }

    public static String render(ResultNode result) {
        List<String> lines = new ArrayList<>();
        appendTo(lines, result, "");
        return String.join("\n", lines);
    }

    /**
     * Builds the single trace line of a scalar result. A layer equal to the
     * one before it is left out, and the value is only appended when the
     * last layer is not already the value.
     */
    public static String traceLine(ScalarResult result) {
        List<String> layers = new ArrayList<>();
        addLayer(layers, result.expression().toNotation());
        addLayer(layers, result.rollsText());
        addLayer(layers, result.reducedText());

        String line = String.join(LAYER_SEPARATOR, layers);
        String value = result.valueText();
        if (!layers.get(layers.size() - 1).equals(value)) {
            line += " = " + value;
        }
        return line;
    }

    private static void addLayer(List<String> layers, String layer) {
        if (layers.isEmpty() || !layers.get(layers.size() - 1).equals(layer)) {
            layers.add(layer);
        }
    }

    private static void appendTo(List<String> lines, ResultNode result, String indent) {
        String inner = indent + INDENT;
        if (result instanceof ScalarResult scalar) {
            lines.add(indent + traceLine(scalar));
        } else if (result instanceof ListExpansionResult list) {
            ListExpansion expansion = list.expression();
            lines.add(indent + "List Expansion: " + expansion.toNotation());
            lines.add(inner + "Count: " + expansion.count() + LAYER_SEPARATOR + list.repetitions().size());
            lines.add(inner + "Expression: " + expansion.body().toNotation());
            lines.add(inner + "Results: " + list.valueText());
            appendElements(lines, list.repetitions(), inner);
        } else if (result instanceof SequenceResult sequence) {
            lines.add(indent + "Sequence: " + sequence.expression().toNotation());
            lines.add(inner + "Results: " + sequence.valueText());
            appendElements(lines, sequence.items(), inner);
        } else {
            throw new IllegalStateException("Unsupported result node: " + result.getClass().getSimpleName());
        }
    }

    private static void appendElements(List<String> lines, List<ResultNode> elements, String indent) {
        for (int i = 0; i < elements.size(); i++) {
            lines.add(indent + i + ": ");
            appendTo(lines, elements.get(i), indent + INDENT + INDENT);
        }
    }
}
