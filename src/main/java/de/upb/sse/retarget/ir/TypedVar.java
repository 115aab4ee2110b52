package de.upb.sse.retarget.ir;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Identity of a local variable. The id is the ground truth for referential equality,
 * the name is cosmetic and may be rewritten.
 */
@Getter
public final class TypedVar {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    @Setter private String name;
    private final String type;

    public TypedVar(int id, String name, String type) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
    }

    /** Allocates a fresh process-unique id. */
    public static TypedVar create(String name, String type) {
        return new TypedVar(NEXT_ID.incrementAndGet(), name, type);
    }

    public static TypedVar create(String name) {
        return create(name, null);
    }

    /** Copy with the same id and another display name. */
    public TypedVar withName(String newName) {
        return new TypedVar(id, newName, type);
    }

    public boolean sameIdentity(TypedVar other) {
        return other != null && other.id == id;
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
