package de.upb.sse.retarget.compiler;

import de.upb.sse.retarget.ir.Declaration;
import lombok.NonNull;
import lombok.Value;

/** One entry of the compilation accumulator. */
@Value
public class CompiledDeclaration {
    @NonNull Declaration declaration;
    @NonNull String text;
}
