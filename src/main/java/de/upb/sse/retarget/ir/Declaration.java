package de.upb.sse.retarget.ir;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * A top-level declaration handed over by the front end. Immutable for the whole pass.
 */
@Getter
@Builder
@ToString(of = {"kind", "typePath", "module"})
public final class Declaration {
    @NonNull private final DeclarationKind kind;
    /** Fully qualified, dot separated, e.g. {@code app.model.User}. */
    @NonNull private final String typePath;
    /** Owning module; the type path when the front end did not set one. */
    private final String module;
    private final boolean extern;
    private final boolean typeParameter;
    private final boolean interfaceType;
    @Builder.Default private final boolean referenced = true;
    @Builder.Default private final Position position = Position.NONE;
    @Singular("variable") private final List<ClassVar> vars;
    @Singular("function") private final List<ClassFunc> funcs;

    public String getModule() {
        return module == null ? typePath : module;
    }

    public String getName() {
        int dot = typePath.lastIndexOf('.');
        return dot < 0 ? typePath : typePath.substring(dot + 1);
    }

    public boolean hasMembers() {
        return kind == DeclarationKind.CLASS || kind == DeclarationKind.ENUM;
    }
}
