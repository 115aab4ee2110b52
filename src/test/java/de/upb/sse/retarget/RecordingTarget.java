package de.upb.sse.retarget;

import de.upb.sse.retarget.compiler.CompilerDriver;
import de.upb.sse.retarget.compiler.TargetHooks;
import de.upb.sse.retarget.ir.ClassFunc;
import de.upb.sse.retarget.ir.ClassVar;
import de.upb.sse.retarget.ir.Declaration;
import de.upb.sse.retarget.ir.DeclarationKind;
import de.upb.sse.retarget.ir.TypedExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Small pseudo-code target for tests. Remembers every declaration it was asked to emit.
 * Typedefs and abstracts erase to nothing, unsupported expressions produce no text.
 */
public class RecordingTarget implements TargetHooks {
    public final List<String> emitted = Collections.synchronizedList(new ArrayList<>());
    public final List<String> events = new ArrayList<>();

    @Override
    public Optional<String> emitDeclaration(Declaration declaration, List<ClassVar> vars, List<ClassFunc> funcs, CompilerDriver driver) {
        emitted.add(declaration.getTypePath());
        if (declaration.getKind() == DeclarationKind.TYPEDEF || declaration.getKind() == DeclarationKind.ABSTRACT) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder("class ").append(declaration.getName()).append(" {");
        for (ClassVar v : vars) {
            sb.append("\nvar ").append(v.getName());
            if (v.getInitializer() != null) sb.append(" = ").append(driver.compileVarInitializer(v));
        }
        for (ClassFunc f : funcs) {
            String params = f.getParams().stream().map(p -> p.getName()).collect(Collectors.joining(", "));
            sb.append("\nfn ").append(f.getName()).append("(").append(params).append(") {");
            if (f.hasBody()) sb.append("\n").append(driver.compileFunctionBody(f));
            sb.append("\n}");
        }
        return Optional.of(sb.append("\n}").toString());
    }

    @Override
    public Optional<String> emitExpression(TypedExpr e, CompilerDriver driver) {
        switch (e.getKind()) {
            case CONSTANT:
                return Optional.of(e.getValue() instanceof String ? "\"" + e.getValue() + "\"" : String.valueOf(e.getValue()));
            case LOCAL:
                return Optional.of(e.getVariable().getName());
            case IDENT:
                return Optional.of(String.valueOf(e.getValue()));
            case VAR_DECL:
                return Optional.of("var " + e.getVariable().getName()
                        + (e.getChildren().isEmpty() ? "" : " = " + driver.compileExpressionOrFail(e.child(0))));
            case BINOP:
                return Optional.of(driver.compileExpressionOrFail(e.child(0)) + " " + e.getValue() + " "
                        + driver.compileExpressionOrFail(e.child(1)));
            case CALL:
                return Optional.of(driver.compileExpressionOrFail(e.child(0)) + "("
                        + e.getChildren().subList(1, e.getChildren().size()).stream()
                        .map(driver::compileExpressionOrFail).collect(Collectors.joining(", ")) + ")");
            case FIELD:
                return Optional.of(driver.compileExpressionOrFail(e.child(0)) + "." + e.getValue());
            case BLOCK:
                return Optional.of("{ " + e.getChildren().stream()
                        .map(driver::compileExpressionOrFail).collect(Collectors.joining("; ")) + " }");
            case IF:
                return Optional.of("if (" + driver.compileExpressionOrFail(e.child(0)) + ") "
                        + driver.compileExpressionOrFail(e.child(1))
                        + (e.getChildren().size() > 2 ? " else " + driver.compileExpressionOrFail(e.child(2)) : ""));
            case RETURN:
                return Optional.of(e.getChildren().isEmpty() ? "return" : "return " + driver.compileExpressionOrFail(e.child(0)));
            case PARENTHESIS:
                return Optional.of("(" + driver.compileExpressionOrFail(e.child(0)) + ")");
            case META:
                return driver.compileExpression(e.child(0));
            default:
                return Optional.empty();
        }
    }

    @Override
    public void onCompileStart(CompilerDriver driver) {
        events.add("start");
    }

    @Override
    public void onCompileEnd(CompilerDriver driver) {
        events.add("end");
    }
}
