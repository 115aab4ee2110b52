package de.upb.sse.retarget.compiler;

import de.upb.sse.retarget.ir.TypedExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Lays out the statements of a body, separating runs of different categories
 * (declarations, calls, loops, ...) with one blank line.
 */
public final class ExpressionLineFormatter {
    private final ToIntFunction<TypedExpr> classifier;

    public ExpressionLineFormatter() {
        this(TypedExpr::category);
    }

    public ExpressionLineFormatter(ToIntFunction<TypedExpr> classifier) {
        this.classifier = classifier;
    }

    /**
     * Compiles each expression and returns the output lines, an empty string standing for
     * a separator. Expressions that compile to nothing do not take part in grouping.
     */
    public List<String> format(List<TypedExpr> exprs, Function<TypedExpr, Optional<String>> compile) {
        List<String> lines = new ArrayList<>();
        Integer previousCategory = null;
        for (TypedExpr expr : exprs) {
            Optional<String> text = compile.apply(expr);
            if (text.isEmpty()) continue;

            int category = classifier.applyAsInt(expr);
            if (previousCategory != null && previousCategory != category) {
                lines.add("");
            }
            lines.add(text.get());
            previousCategory = category;
        }
        return lines;
    }

    public String formatToString(List<TypedExpr> exprs, Function<TypedExpr, Optional<String>> compile) {
        return String.join("\n", format(exprs, compile));
    }
}
