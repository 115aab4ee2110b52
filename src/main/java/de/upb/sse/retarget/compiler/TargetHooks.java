package de.upb.sse.retarget.compiler;

import de.upb.sse.retarget.ir.ClassFunc;
import de.upb.sse.retarget.ir.ClassMember;
import de.upb.sse.retarget.ir.ClassVar;
import de.upb.sse.retarget.ir.Declaration;
import de.upb.sse.retarget.ir.TypedExpr;

import java.util.List;
import java.util.Optional;

/**
 * Target-specific text emission. The only place where output-language syntax is decided.
 *
 * An empty result means "nothing to emit" and is not an error.
 */
public interface TargetHooks {
    /** Emit one class, enum, typedef or abstract with its already filtered members. */
    Optional<String> emitDeclaration(Declaration declaration, List<ClassVar> vars, List<ClassFunc> funcs, CompilerDriver driver);

    /** Emit one expression; nested expressions go back through {@code driver}. */
    Optional<String> emitExpression(TypedExpr expr, CompilerDriver driver);

    /** Consulted after the built-in declaration policy accepted {@code declaration}. */
    default boolean acceptDeclaration(Declaration declaration) {
        return true;
    }

    /** Consulted after the built-in member policy accepted {@code member}. */
    default boolean acceptMember(Declaration owner, ClassMember member) {
        return true;
    }

    default void onCompileStart(CompilerDriver driver) {
    }

    default void onCompileEnd(CompilerDriver driver) {
    }
}
