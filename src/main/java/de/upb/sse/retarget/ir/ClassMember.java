package de.upb.sse.retarget.ir;

import lombok.Getter;

import java.util.Objects;

/** A variable or function member of a class or enum declaration. */
@Getter
public abstract class ClassMember {
    private final String name;
    private final boolean isStatic;
    private final Position position;

    protected ClassMember(String name, boolean isStatic, Position position) {
        this.name = Objects.requireNonNull(name, "name");
        this.isStatic = isStatic;
        this.position = position == null ? Position.NONE : position;
    }
}
