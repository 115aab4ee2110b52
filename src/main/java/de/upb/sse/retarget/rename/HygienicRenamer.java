package de.upb.sse.retarget.rename;

import de.upb.sse.retarget.ir.ExprKind;
import de.upb.sse.retarget.ir.TypedExpr;
import de.upb.sse.retarget.ir.TypedVar;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames local variables so that no declaration reuses a name that is already visible
 * from its block, either declared earlier in the same block or in an enclosing one.
 *
 * Every block node opens a scope, nothing else does. A scope sees the names claimed by
 * its ancestors but never adds to them, so sibling blocks may keep identical names.
 * Renamed variables keep their id; all references are redirected to the renamed copy.
 */
public final class HygienicRenamer {
    private static final Pattern TRAILING_NUMBER = Pattern.compile("^(.*?)(\\d+)$");

    private final Set<String> reservedNames;
    private int renamedCount;

    public HygienicRenamer() {
        this(Set.of());
    }

    /**
     * @param reservedNames names the target does not allow for locals; treated as taken
     *                      in the outermost scope
     */
    public HygienicRenamer(Collection<String> reservedNames) {
        this.reservedNames = new HashSet<>(reservedNames);
    }

    public TypedExpr fix(TypedExpr expr) {
        return fix(expr, Set.of());
    }

    /**
     * @param enclosingNames names already declared around {@code expr} by the caller
     * @return {@code expr} itself when nothing had to be renamed
     */
    public TypedExpr fix(TypedExpr expr, Set<String> enclosingNames) {
        Scope root = new Scope(null);
        root.claimed.addAll(reservedNames);
        root.claimed.addAll(enclosingNames);
        return root.rewrite(expr);
    }

    /** Number of variables renamed by this instance so far. */
    public int getRenamedCount() {
        return renamedCount;
    }

    /**
     * Next candidate after {@code name} collided: a trailing number is incremented,
     * otherwise {@code 2} is appended.
     */
    public static String nextCandidate(String name) {
        Matcher m = TRAILING_NUMBER.matcher(name);
        if (m.matches()) {
            return m.group(1) + new BigInteger(m.group(2)).add(BigInteger.ONE);
        }
        return name + "2";
    }

    /**
     * Names that are declared while already visible, using the same scoping as {@link #fix}.
     * Empty for any output of {@link #fix}.
     */
    public List<String> findCollisions(TypedExpr expr, Set<String> enclosingNames) {
        Set<String> collisions = new LinkedHashSet<>();
        Scope root = new Scope(null);
        root.claimed.addAll(reservedNames);
        root.claimed.addAll(enclosingNames);
        root.check(expr, collisions);
        return new ArrayList<>(collisions);
    }

    private final class Scope {
        private final Scope parent;
        private final Set<String> claimed = new HashSet<>();
        private final Map<Integer, TypedVar> renamed = new HashMap<>();

        private Scope(Scope parent) {
            this.parent = parent;
        }

        private boolean isClaimed(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                if (s.claimed.contains(name)) return true;
            }
            return false;
        }

        private TypedVar substitution(int id) {
            for (Scope s = this; s != null; s = s.parent) {
                TypedVar v = s.renamed.get(id);
                if (v != null) return v;
            }
            return null;
        }

        private TypedExpr fixBlock(TypedExpr block) {
            List<TypedExpr> statements = new ArrayList<>(block.getChildren().size());
            for (TypedExpr statement : block.getChildren()) {
                statements.add(statement.is(ExprKind.VAR_DECL) ? declare(statement) : rewrite(statement));
            }
            return block.withChildren(statements);
        }

        private TypedExpr declare(TypedExpr decl) {
            TypedVar original = decl.getVariable();
            String name = original.getName();
            while (isClaimed(name)) {
                name = nextCandidate(name);
            }
            claimed.add(name);

            TypedVar declared = original;
            if (!name.equals(original.getName())) {
                declared = original.withName(name);
                renamed.put(original.getId(), declared);
                renamedCount++;
            }
            // the initializer may refer to the variable itself, so it is rewritten after the claim
            return rewriteChildren(decl.withVariable(declared));
        }

        private TypedExpr rewrite(TypedExpr expr) {
            if (expr.is(ExprKind.BLOCK)) {
                return new Scope(this).fixBlock(expr);
            }
            if (expr.is(ExprKind.LOCAL)) {
                TypedVar replacement = substitution(expr.getVariable().getId());
                return replacement == null ? expr : expr.withVariable(replacement);
            }
            return rewriteChildren(expr);
        }

        private TypedExpr rewriteChildren(TypedExpr expr) {
            List<TypedExpr> children = expr.getChildren();
            if (children.isEmpty()) return expr;
            List<TypedExpr> rewritten = new ArrayList<>(children.size());
            for (TypedExpr child : children) {
                rewritten.add(rewrite(child));
            }
            return expr.withChildren(rewritten);
        }

        private void check(TypedExpr expr, Set<String> collisions) {
            if (expr.is(ExprKind.BLOCK)) {
                Scope inner = new Scope(this);
                for (TypedExpr statement : expr.getChildren()) {
                    if (!statement.is(ExprKind.VAR_DECL)) {
                        inner.check(statement, collisions);
                        continue;
                    }
                    String name = statement.getVariable().getName();
                    if (inner.isClaimed(name)) collisions.add(name);
                    inner.claimed.add(name);
                    for (TypedExpr child : statement.getChildren()) {
                        inner.check(child, collisions);
                    }
                }
                return;
            }
            for (TypedExpr child : expr.getChildren()) {
                check(child, collisions);
            }
        }
    }
}
