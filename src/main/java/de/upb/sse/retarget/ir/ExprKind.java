package de.upb.sse.retarget.ir;

/**
 * Variants of a typed expression node, each with its line-grouping category.
 * Wrappers have no category of their own and take the one of the node they wrap.
 */
public enum ExprKind {
    CONSTANT(0),
    LOCAL(0),
    ARRAY_INDEX(0),
    VAR_DECL(0),
    TYPE_EXPR(0),
    ENUM_PARAMETER(0),
    ENUM_INDEX(0),
    IDENT(0),
    BINOP(1),
    CALL(1),
    UNOP(1),
    CAST(1),
    FIELD(1),
    OBJECT_DECL(2),
    ARRAY_DECL(3),
    NEW(4),
    FUNCTION(5),
    BLOCK(6),
    FOR(7),
    IF(8),
    WHILE(9),
    SWITCH(10),
    TRY(11),
    RETURN(12),
    BREAK(13),
    CONTINUE(13),
    THROW(14),
    META(-1),
    PARENTHESIS(-1);

    private final int category;

    ExprKind(int category) {
        this.category = category;
    }

    public boolean isTransparent() {
        return category < 0;
    }

    /** Only meaningful for non-transparent kinds, see {@link TypedExpr#category()}. */
    public int category() {
        return category;
    }
}
