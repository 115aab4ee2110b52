package de.upb.sse.retarget.compiler;

import de.upb.sse.retarget.exceptions.CompilationError;
import de.upb.sse.retarget.ir.ExprKind;
import de.upb.sse.retarget.ir.TypedExpr;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes {@code marker("native code {0}", arg0, ...)} calls and turns them into the
 * literal text, with each {@code {n}} replaced by the compiled n-th following argument.
 */
final class TargetCodeInjection {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)}");

    private final String markerName;

    TargetCodeInjection(String markerName) {
        this.markerName = markerName;
    }

    Optional<String> tryInject(TypedExpr expr, Function<TypedExpr, String> compileArgument) {
        TypedExpr call = expr.unwrap();
        if (!call.is(ExprKind.CALL) || call.getChildren().size() < 2) return Optional.empty();

        TypedExpr callee = call.child(0).unwrap();
        if (!callee.is(ExprKind.IDENT) || !markerName.equals(callee.getValue())) return Optional.empty();

        TypedExpr code = call.child(1).unwrap();
        if (!code.is(ExprKind.CONSTANT) || !(code.getValue() instanceof String)) return Optional.empty();

        List<TypedExpr> args = call.getChildren().subList(2, call.getChildren().size());
        Matcher m = PLACEHOLDER.matcher((String) code.getValue());
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int index;
            try {
                index = Integer.parseInt(m.group(1));
            } catch (NumberFormatException e) {
                index = Integer.MAX_VALUE;
            }
            if (index >= args.size()) {
                throw new CompilationError(call.getPosition(),
                        markerName + " refers to argument {" + m.group(1) + "} but only " + args.size() + " were given");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(compileArgument.apply(args.get(index))));
        }
        m.appendTail(sb);
        return Optional.of(sb.toString());
    }
}
