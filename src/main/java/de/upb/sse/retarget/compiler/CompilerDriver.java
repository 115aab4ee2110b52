package de.upb.sse.retarget.compiler;

import de.upb.sse.retarget.configuration.RetargetConfiguration;
import de.upb.sse.retarget.exceptions.CompilationError;
import de.upb.sse.retarget.ir.ClassFunc;
import de.upb.sse.retarget.ir.ClassMember;
import de.upb.sse.retarget.ir.ClassVar;
import de.upb.sse.retarget.ir.Declaration;
import de.upb.sse.retarget.ir.DeclarationKind;
import de.upb.sse.retarget.ir.ExprKind;
import de.upb.sse.retarget.ir.MethodKind;
import de.upb.sse.retarget.ir.TypedExpr;
import de.upb.sse.retarget.ir.TypedVar;
import de.upb.sse.retarget.rename.HygienicRenamer;
import de.upb.sse.retarget.stats.CompilationStats;
import lombok.Getter;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Decides which declarations and members are compiled, hands them to the target hooks and
 * accumulates the resulting text in declaration order.
 */
public class CompilerDriver {
    private static final Logger logger = Logger.getLogger(CompilerDriver.class.getName());

    @Getter private final RetargetConfiguration config;
    @Getter private final CompilationStats stats;
    private final TargetHooks hooks;
    private final ExpressionLineFormatter formatter = new ExpressionLineFormatter();
    private final TargetCodeInjection injection;

    private final List<CompiledDeclaration> compiled = new ArrayList<>();
    private final List<CompilationError> errors = new ArrayList<>();
    private final List<String> failedDeclarations = new ArrayList<>();
    private final Map<String, String> extraFiles = new LinkedHashMap<>();
    private final List<Consumer<Declaration>> declarationListeners = new CopyOnWriteArrayList<>();

    public CompilerDriver(RetargetConfiguration config, TargetHooks hooks) {
        this(config, hooks, new CompilationStats());
    }

    public CompilerDriver(RetargetConfiguration config, TargetHooks hooks, CompilationStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.injection = config.isTargetCodeInjectionEnabled()
                ? new TargetCodeInjection(config.getTargetCodeInjectionName())
                : null;
    }

    /** Called for every declaration of a pass, including the ones that are then skipped. */
    public void addDeclarationListener(Consumer<Declaration> listener) {
        declarationListeners.add(listener);
    }

    /**
     * Runs one full pass. Previous results are discarded first. A declaration whose
     * compilation fails is reported and left out, the others are still compiled.
     */
    public List<CompiledDeclaration> compile(List<Declaration> declarations) {
        compiled.clear();
        errors.clear();
        failedDeclarations.clear();
        synchronized (extraFiles) {
            extraFiles.clear();
        }

        hooks.onCompileStart(this);

        List<Declaration> selected = new ArrayList<>();
        for (Declaration declaration : declarations) {
            for (Consumer<Declaration> listener : declarationListeners) {
                listener.accept(declaration);
            }
            if (shouldGenerate(declaration)) {
                selected.add(declaration);
            } else {
                logger.fine("Skipping " + declaration.getTypePath());
                stats.incrementSkippedDeclarations();
            }
        }

        Outcome[] outcomes = new Outcome[selected.size()];
        IntStream indices = IntStream.range(0, selected.size());
        if (config.isParallelCompilation()) {
            indices = indices.parallel();
        }
        indices.forEach(i -> outcomes[i] = compileOne(selected.get(i)));

        // completion order is irrelevant, results are folded in declaration order
        for (Outcome outcome : outcomes) {
            if (outcome.error != null) {
                errors.add(outcome.error);
                failedDeclarations.add(outcome.declaration.getTypePath());
                stats.incrementFailedDeclarations();
            } else if (outcome.text == null) {
                stats.incrementErasedDeclarations();
            } else {
                compiled.add(new CompiledDeclaration(outcome.declaration, outcome.text));
                stats.incrementCompiledDeclarations();
            }
        }

        hooks.onCompileEnd(this);

        logger.info("Compiled " + compiled.size() + " of " + declarations.size() + " declarations"
                + (errors.isEmpty() ? "" : ", " + errors.size() + " failed"));
        return getCompiledDeclarations();
    }

    private Outcome compileOne(Declaration declaration) {
        try {
            List<ClassVar> vars = new ArrayList<>();
            List<ClassFunc> funcs = new ArrayList<>();
            if (declaration.hasMembers()) {
                vars = declaration.getVars().stream()
                        .filter(v -> shouldGenerateMember(declaration, v))
                        .collect(Collectors.toList());
                funcs = filterFunctions(declaration);
            }
            Optional<String> text = compileDeclaration(declaration, vars, funcs);
            if (text.isEmpty()) {
                logger.fine(declaration.getTypePath() + " produced no output");
            }
            return new Outcome(declaration, text.orElse(null), null);
        } catch (CompilationError e) {
            logger.severe("Failed to compile " + declaration.getTypePath() + ": " + e.getMessage());
            return new Outcome(declaration, null, e);
        }
    }

    private List<ClassFunc> filterFunctions(Declaration declaration) {
        List<ClassFunc> funcs = new ArrayList<>();
        for (ClassFunc func : declaration.getFuncs()) {
            if (!shouldGenerateMember(declaration, func)) continue;
            if (!func.hasBody() && !declaration.isExtern() && !declaration.isInterfaceType()) {
                if (config.isFailOnMissingBody()) {
                    throw new CompilationError(func.getPosition(),
                            "function " + declaration.getTypePath() + "." + func.getName() + " has no body");
                }
                logger.fine("Dropping bodiless function " + declaration.getTypePath() + "." + func.getName());
                continue;
            }
            funcs.add(func);
        }
        return funcs;
    }

    public boolean shouldGenerate(Declaration declaration) {
        if (declaration.isTypeParameter()) return false;
        if (declaration.isExtern() && config.isIgnoreExterns()) return false;
        if (config.getIgnoredTypes().contains(declaration.getTypePath())) return false;
        if (declaration.getKind() == DeclarationKind.TYPEDEF && config.isUnwrapTypedefs()) return false;
        if (config.getDceMode() == RetargetConfiguration.DceMode.SMART && !declaration.isReferenced()) return false;
        return hooks.acceptDeclaration(declaration);
    }

    public boolean shouldGenerateMember(Declaration owner, ClassMember member) {
        if (member instanceof ClassVar) {
            ClassVar field = (ClassVar) member;
            if (config.isIgnoreNonPhysicalFields() && !field.isPhysical()) return false;
        } else if (member instanceof ClassFunc) {
            if (((ClassFunc) member).getKind() == MethodKind.MACRO) return false;
        }
        return hooks.acceptMember(owner, member);
    }

    public Optional<String> compileDeclaration(Declaration declaration, List<ClassVar> vars, List<ClassFunc> funcs) {
        Optional<String> text = hooks.emitDeclaration(declaration, vars, funcs, this);
        return text == null ? Optional.empty() : text;
    }

    public Optional<String> compileExpression(TypedExpr expr) {
        if (injection != null) {
            Optional<String> injected = injection.tryInject(expr, this::compileExpressionOrFail);
            if (injected.isPresent()) return injected;
        }
        Optional<String> text = hooks.emitExpression(expr, this);
        return text == null ? Optional.empty() : text;
    }

    /** Like {@link #compileExpression} but an expression that yields no text is fatal. */
    public String compileExpressionOrFail(TypedExpr expr) {
        return compileExpression(expr).orElseThrow(() ->
                new CompilationError(expr.getPosition(), "target produced no output for " + expr.getKind() + " expression"));
    }

    public String compileExpressionsIntoLines(List<TypedExpr> exprs) {
        return formatter.formatToString(exprs, this::compileExpression);
    }

    public String compileFunctionBody(ClassFunc func) {
        Set<String> params = new HashSet<>();
        for (TypedVar param : func.getParams()) {
            params.add(param.getName());
        }
        return compileBody(func.getBody(), params);
    }

    public String compileVarInitializer(ClassVar var) {
        return compileBody(var.getInitializer(), Set.of());
    }

    /**
     * Renames shadowing locals (when normalization is on) and lays out the top-level
     * statements of {@code body} line by line.
     *
     * @param enclosingNames names visible around the body, such as the function parameters
     */
    public String compileBody(TypedExpr body, Set<String> enclosingNames) {
        if (body == null) return "";
        TypedExpr fixed = body;
        if (config.isNormalizeExpressions()) {
            HygienicRenamer renamer = new HygienicRenamer(config.getReservedVariableNames());
            fixed = renamer.fix(body, enclosingNames);
            stats.addRenamedVariables(renamer.getRenamedCount());

            List<String> collisions = renamer.findCollisions(fixed, enclosingNames);
            if (!collisions.isEmpty()) {
                throw new IllegalStateException("Local names still collide after renaming: " + collisions);
            }
        }
        return compileExpressionsIntoLines(topLevelStatements(fixed));
    }

    private List<TypedExpr> topLevelStatements(TypedExpr body) {
        TypedExpr root = config.isNormalizeExpressions() ? body.unwrap() : body;
        if (!root.is(ExprKind.BLOCK)) return List.of(root);
        if (!config.isNormalizeExpressions()) return root.getChildren();

        List<TypedExpr> statements = new ArrayList<>();
        for (TypedExpr statement : root.getChildren()) {
            TypedExpr inner = statement.unwrap();
            if (inner.is(ExprKind.BLOCK) && inner.getChildren().isEmpty()) continue;
            statements.add(statement.is(ExprKind.PARENTHESIS) ? inner : statement);
        }
        return statements;
    }

    public void setExtraFile(String relativePath, String content) {
        synchronized (extraFiles) {
            extraFiles.put(relativePath, content);
        }
    }

    public void appendToExtraFile(String relativePath, String content) {
        synchronized (extraFiles) {
            extraFiles.merge(relativePath, content, String::concat);
        }
    }

    public Map<String, String> getExtraFiles() {
        synchronized (extraFiles) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(extraFiles));
        }
    }

    public List<CompiledDeclaration> getCompiledDeclarations() {
        return Collections.unmodifiableList(new ArrayList<>(compiled));
    }

    public List<CompilationError> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<String> getFailedDeclarations() {
        return Collections.unmodifiableList(new ArrayList<>(failedDeclarations));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    private static final class Outcome {
        final Declaration declaration;
        final String text;
        final CompilationError error;

        Outcome(Declaration declaration, String text, CompilationError error) {
            this.declaration = declaration;
            this.text = text;
            this.error = error;
        }
    }
}
