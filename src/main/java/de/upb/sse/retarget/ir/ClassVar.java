package de.upb.sse.retarget.ir;

import lombok.Getter;

import java.util.Optional;

@Getter
public final class ClassVar extends ClassMember {
    private final VarAccess read;
    private final VarAccess write;
    private final String type;
    private final TypedExpr initializer;

    public ClassVar(String name, boolean isStatic, VarAccess read, VarAccess write,
                    String type, TypedExpr initializer, Position position) {
        super(name, isStatic, position);
        this.read = read;
        this.write = write;
        this.type = type;
        this.initializer = initializer;
    }

    public ClassVar(String name, boolean isStatic, String type, TypedExpr initializer) {
        this(name, isStatic, VarAccess.NORMAL, VarAccess.NORMAL, type, initializer, Position.NONE);
    }

    /** A variable has storage unless both directions go through accessors or are disallowed. */
    public boolean isPhysical() {
        return read == VarAccess.NORMAL || write == VarAccess.NORMAL;
    }

    public Optional<TypedExpr> initializer() {
        return Optional.ofNullable(initializer);
    }
}
