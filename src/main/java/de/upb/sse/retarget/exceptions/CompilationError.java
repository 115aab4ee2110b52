package de.upb.sse.retarget.exceptions;

import de.upb.sse.retarget.ir.Position;
import lombok.Getter;

/**
 * Fatal emission failure. Aborts the declaration being compiled, never the whole pass.
 */
@Getter
public class CompilationError extends RuntimeException {
    private final Position position;

    public CompilationError(Position position, String message) {
        super(orNone(position) + ": " + message);
        this.position = orNone(position);
    }

    private static Position orNone(Position position) {
        return position == null ? Position.NONE : position;
    }
}
