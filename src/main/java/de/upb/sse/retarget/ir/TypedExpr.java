package de.upb.sse.retarget.ir;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One node of a fully typed expression tree.
 *
 * Sub-expressions are kept in {@link #getChildren()} in evaluation order so passes can
 * rewrite a tree without knowing every variant. The layout per kind:
 * <ul>
 *   <li>{@code VAR_DECL}: {@link #getVariable()}, children {@code [init]} or empty</li>
 *   <li>{@code LOCAL}: {@link #getVariable()}</li>
 *   <li>{@code CALL}: {@code [callee, arg...]}</li>
 *   <li>{@code BINOP}, {@code UNOP}: operator in {@link #getValue()}</li>
 *   <li>{@code FIELD}, {@code IDENT}, {@code TYPE_EXPR}, {@code NEW}, {@code CAST}, {@code META}: name in {@link #getValue()}</li>
 *   <li>{@code FUNCTION}: parameters in {@link #getVariables()}, children {@code [body]}</li>
 *   <li>{@code FOR}: loop variable in {@link #getVariables()}, children {@code [iterable, body]}</li>
 *   <li>{@code TRY}: catch variables in {@link #getVariables()}, children {@code [body, catchBody...]}</li>
 *   <li>{@code SWITCH}: children {@code [subject, caseValue, caseBody, ..., default?]}, value = has default</li>
 * </ul>
 */
@Getter
public final class TypedExpr {
    private final ExprKind kind;
    private final Position position;
    private final List<TypedExpr> children;
    private final TypedVar variable;
    private final List<TypedVar> variables;
    private final Object value;

    public TypedExpr(ExprKind kind, Position position, List<TypedExpr> children,
                     TypedVar variable, List<TypedVar> variables, Object value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.position = position == null ? Position.NONE : position;
        this.children = children == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(children));
        this.variable = variable;
        this.variables = variables == null ? Collections.emptyList() : List.copyOf(variables);
        this.value = value;
    }

    private static TypedExpr of(ExprKind kind, Position pos, Object value, TypedExpr... children) {
        return new TypedExpr(kind, pos, Arrays.asList(children), null, null, value);
    }

    public static TypedExpr constant(Position pos, Object value) { return of(ExprKind.CONSTANT, pos, value); }
    public static TypedExpr local(Position pos, TypedVar v) { return new TypedExpr(ExprKind.LOCAL, pos, null, v, null, null); }
    public static TypedExpr arrayIndex(Position pos, TypedExpr array, TypedExpr index) { return of(ExprKind.ARRAY_INDEX, pos, null, array, index); }
    public static TypedExpr typeExpr(Position pos, String typePath) { return of(ExprKind.TYPE_EXPR, pos, typePath); }
    public static TypedExpr enumParameter(Position pos, TypedExpr enumValue, String parameter) { return of(ExprKind.ENUM_PARAMETER, pos, parameter, enumValue); }
    public static TypedExpr enumIndex(Position pos, TypedExpr enumValue) { return of(ExprKind.ENUM_INDEX, pos, null, enumValue); }
    public static TypedExpr ident(Position pos, String name) { return of(ExprKind.IDENT, pos, name); }
    public static TypedExpr binop(Position pos, String op, TypedExpr lhs, TypedExpr rhs) { return of(ExprKind.BINOP, pos, op, lhs, rhs); }
    public static TypedExpr unop(Position pos, String op, TypedExpr operand) { return of(ExprKind.UNOP, pos, op, operand); }
    public static TypedExpr cast(Position pos, String type, TypedExpr expr) { return of(ExprKind.CAST, pos, type, expr); }
    public static TypedExpr field(Position pos, TypedExpr target, String name) { return of(ExprKind.FIELD, pos, name, target); }
    public static TypedExpr arrayDecl(Position pos, List<TypedExpr> items) { return new TypedExpr(ExprKind.ARRAY_DECL, pos, items, null, null, null); }
    public static TypedExpr construct(Position pos, String typePath, List<TypedExpr> args) { return new TypedExpr(ExprKind.NEW, pos, args, null, null, typePath); }
    public static TypedExpr block(Position pos, List<TypedExpr> exprs) { return new TypedExpr(ExprKind.BLOCK, pos, exprs, null, null, null); }
    public static TypedExpr block(Position pos, TypedExpr... exprs) { return block(pos, Arrays.asList(exprs)); }
    public static TypedExpr whileLoop(Position pos, TypedExpr cond, TypedExpr body) { return of(ExprKind.WHILE, pos, Boolean.TRUE, cond, body); }
    public static TypedExpr ret(Position pos) { return of(ExprKind.RETURN, pos, null); }
    public static TypedExpr ret(Position pos, TypedExpr value) { return of(ExprKind.RETURN, pos, null, value); }
    public static TypedExpr breakLoop(Position pos) { return of(ExprKind.BREAK, pos, null); }
    public static TypedExpr continueLoop(Position pos) { return of(ExprKind.CONTINUE, pos, null); }
    public static TypedExpr throwValue(Position pos, TypedExpr value) { return of(ExprKind.THROW, pos, null, value); }
    public static TypedExpr meta(Position pos, String name, TypedExpr inner) { return of(ExprKind.META, pos, name, inner); }
    public static TypedExpr paren(Position pos, TypedExpr inner) { return of(ExprKind.PARENTHESIS, pos, null, inner); }

    public static TypedExpr varDecl(Position pos, TypedVar v, TypedExpr init) {
        return new TypedExpr(ExprKind.VAR_DECL, pos, init == null ? null : List.of(init), v, null, null);
    }

    public static TypedExpr call(Position pos, TypedExpr callee, List<TypedExpr> args) {
        List<TypedExpr> children = new ArrayList<>();
        children.add(callee);
        children.addAll(args);
        return new TypedExpr(ExprKind.CALL, pos, children, null, null, null);
    }

    public static TypedExpr call(Position pos, TypedExpr callee, TypedExpr... args) {
        return call(pos, callee, Arrays.asList(args));
    }

    /** Field names are kept in order in the value, field values in the children. */
    public static TypedExpr objectDecl(Position pos, List<String> fieldNames, List<TypedExpr> values) {
        if (fieldNames.size() != values.size()) {
            throw new IllegalArgumentException("object literal needs one value per field");
        }
        return new TypedExpr(ExprKind.OBJECT_DECL, pos, values, null, null, List.copyOf(fieldNames));
    }

    public static TypedExpr function(Position pos, List<TypedVar> params, TypedExpr body) {
        return new TypedExpr(ExprKind.FUNCTION, pos, List.of(body), null, params, null);
    }

    public static TypedExpr forLoop(Position pos, TypedVar loopVar, TypedExpr iterable, TypedExpr body) {
        return new TypedExpr(ExprKind.FOR, pos, List.of(iterable, body), null, List.of(loopVar), null);
    }

    public static TypedExpr ifElse(Position pos, TypedExpr cond, TypedExpr then, TypedExpr otherwise) {
        return otherwise == null ? of(ExprKind.IF, pos, null, cond, then) : of(ExprKind.IF, pos, null, cond, then, otherwise);
    }

    public static TypedExpr switchOn(Position pos, TypedExpr subject, List<TypedExpr> casesAndBodies, TypedExpr defaultBody) {
        if (casesAndBodies.size() % 2 != 0) {
            throw new IllegalArgumentException("switch cases must come in value/body pairs");
        }
        List<TypedExpr> children = new ArrayList<>();
        children.add(subject);
        children.addAll(casesAndBodies);
        if (defaultBody != null) children.add(defaultBody);
        return new TypedExpr(ExprKind.SWITCH, pos, children, null, null, defaultBody != null);
    }

    public static TypedExpr tryCatch(Position pos, TypedExpr body, List<TypedVar> catchVars, List<TypedExpr> catchBodies) {
        if (catchVars.size() != catchBodies.size()) {
            throw new IllegalArgumentException("try needs one body per catch variable");
        }
        List<TypedExpr> children = new ArrayList<>();
        children.add(body);
        children.addAll(catchBodies);
        return new TypedExpr(ExprKind.TRY, pos, children, null, catchVars, null);
    }

    public boolean is(ExprKind k) {
        return kind == k;
    }

    public TypedExpr child(int index) {
        return children.get(index);
    }

    /** The node itself, or the first node below any metadata and parenthesis wrappers. */
    public TypedExpr unwrap() {
        TypedExpr e = this;
        while (e.kind.isTransparent()) {
            e = e.children.get(0);
        }
        return e;
    }

    /** Line-grouping category; wrappers report the category of what they wrap. */
    public int category() {
        return unwrap().kind.category();
    }

    /** Returns this node when every child is the same instance, otherwise a copy. */
    public TypedExpr withChildren(List<TypedExpr> newChildren) {
        if (newChildren.size() == children.size()) {
            boolean same = true;
            for (int i = 0; i < children.size(); i++) {
                if (newChildren.get(i) != children.get(i)) {
                    same = false;
                    break;
                }
            }
            if (same) return this;
        }
        return new TypedExpr(kind, position, newChildren, variable, variables, value);
    }

    public TypedExpr withVariable(TypedVar newVariable) {
        if (newVariable == variable) return this;
        return new TypedExpr(kind, position, children, newVariable, variables, value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (variable != null) sb.append('(').append(variable).append(')');
        if (value != null) sb.append('[').append(value).append(']');
        if (!children.isEmpty()) sb.append(children);
        return sb.toString();
    }
}
