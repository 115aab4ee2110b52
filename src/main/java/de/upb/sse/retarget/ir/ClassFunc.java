package de.upb.sse.retarget.ir;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

@Getter
public final class ClassFunc extends ClassMember {
    private final MethodKind kind;
    private final List<TypedVar> params;
    private final String returnType;
    private final TypedExpr body;

    public ClassFunc(String name, boolean isStatic, MethodKind kind, List<TypedVar> params,
                     String returnType, TypedExpr body, Position position) {
        super(name, isStatic, position);
        this.kind = kind == null ? MethodKind.NORMAL : kind;
        this.params = params == null ? List.of() : List.copyOf(params);
        this.returnType = returnType;
        this.body = body;
    }

    public ClassFunc(String name, boolean isStatic, TypedExpr body) {
        this(name, isStatic, MethodKind.NORMAL, List.of(), null, body, Position.NONE);
    }

    public boolean hasBody() {
        return body != null;
    }

    public Optional<TypedExpr> body() {
        return Optional.ofNullable(body);
    }
}
