package de.upb.sse.retarget.compiler;

import de.upb.sse.retarget.RecordingTarget;
import de.upb.sse.retarget.configuration.RetargetConfiguration;
import de.upb.sse.retarget.exceptions.CompilationError;
import de.upb.sse.retarget.ir.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerDriverTest {
    private static final Position POS = new Position("Main.hx", 3, 5);

    private RetargetConfiguration config;
    private RecordingTarget target;
    private CompilerDriver driver;

    @BeforeEach
    void setup() {
        config = new RetargetConfiguration();
        target = new RecordingTarget();
        driver = new CompilerDriver(config, target);
    }

    private static Declaration.DeclarationBuilder type(String path) {
        return Declaration.builder().kind(DeclarationKind.CLASS).typePath(path);
    }

    private static List<String> paths(List<CompiledDeclaration> compiled) {
        return compiled.stream().map(c -> c.getDeclaration().getTypePath()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Type parameters never reach the target, whatever the configuration")
    void typeParametersAreNeverEmitted() {
        config.setIgnoreExterns(false);
        config.setUnwrapTypedefs(false);
        Declaration t = type("app.List.T").typeParameter(true).extern(true).build();

        assertFalse(driver.shouldGenerate(t));
        driver.compile(List.of(t, type("app.List").build()));

        assertEquals(List.of("app.List"), target.emitted);
    }

    @Test
    void externsNeedExplicitPermission() {
        Declaration ext = type("js.Browser").extern(true).build();

        assertFalse(driver.shouldGenerate(ext));
        config.setIgnoreExterns(false);
        assertTrue(driver.shouldGenerate(ext));
    }

    @Test
    void ignoredTypesTypedefsAndUnreferencedAreSkipped() {
        config.getIgnoredTypes().add("app.Legacy");
        config.setDceMode(RetargetConfiguration.DceMode.SMART);

        List<CompiledDeclaration> compiled = driver.compile(List.of(
                type("app.Legacy").build(),
                Declaration.builder().kind(DeclarationKind.TYPEDEF).typePath("app.Alias").build(),
                type("app.Unused").referenced(false).build(),
                type("app.Main").build()));

        assertEquals(List.of("app.Main"), paths(compiled));
        assertEquals(3, driver.getStats().getSkippedDeclarations());
    }

    @Test
    @DisplayName("Declarations the target erases are not errors")
    void erasedDeclarationsAreNotErrors() {
        List<CompiledDeclaration> compiled = driver.compile(List.of(
                Declaration.builder().kind(DeclarationKind.ABSTRACT).typePath("app.Meters").build(),
                type("app.Main").build()));

        assertEquals(List.of("app.Main"), paths(compiled));
        assertFalse(driver.hasErrors());
        assertEquals(1, driver.getStats().getErasedDeclarations());
        assertEquals(List.of("app.Meters", "app.Main"), target.emitted);
    }

    @Test
    void hookCanRejectDeclarationsAndMembers() {
        TargetHooks onlyPublic = new RecordingTarget() {
            @Override
            public boolean acceptDeclaration(Declaration declaration) {
                return !declaration.getName().startsWith("_");
            }

            @Override
            public boolean acceptMember(Declaration owner, ClassMember member) {
                return !member.getName().startsWith("_");
            }
        };
        CompilerDriver custom = new CompilerDriver(config, onlyPublic);

        List<CompiledDeclaration> compiled = custom.compile(List.of(
                type("app._Hidden").build(),
                type("app.Shown")
                        .variable(new ClassVar("_cache", false, "Int", null))
                        .variable(new ClassVar("size", false, "Int", null))
                        .build()));

        assertEquals(List.of("app.Shown"), paths(compiled));
        assertEquals("class Shown {\nvar size\n}", compiled.get(0).getText());
    }

    @Test
    @DisplayName("Accessor-only fields, macros and bodiless functions are filtered")
    void filtersMembers() {
        Declaration decl = type("app.Point")
                .variable(new ClassVar("x", false, VarAccess.NORMAL, VarAccess.NORMAL, "Float", null, POS))
                .variable(new ClassVar("length", false, VarAccess.ACCESSOR, VarAccess.DISALLOWED, "Float", null, POS))
                .function(new ClassFunc("build", true, MethodKind.MACRO, List.of(), null, TypedExpr.block(POS), POS))
                .function(new ClassFunc("todo", false, null))
                .function(new ClassFunc("reset", false, TypedExpr.block(POS)))
                .build();

        String text = driver.compile(List.of(decl)).get(0).getText();

        assertEquals("class Point {\nvar x\nfn reset() {\n\n}\n}", text);

        config.setIgnoreNonPhysicalFields(false);
        assertTrue(driver.compile(List.of(decl)).get(0).getText().contains("var length"));
    }

    @Test
    @DisplayName("A missing body is fatal for its declaration only when configured")
    void missingBodyIsFatalWhenConfigured() {
        config.setFailOnMissingBody(true);
        Declaration broken = type("app.Broken").function(new ClassFunc("run", false, MethodKind.NORMAL,
                List.of(), null, null, POS)).build();
        Declaration iface = type("app.Runnable").interfaceType(true)
                .function(new ClassFunc("run", false, null)).build();

        List<CompiledDeclaration> compiled = driver.compile(List.of(broken, iface, type("app.Fine").build()));

        assertEquals(List.of("app.Runnable", "app.Fine"), paths(compiled));
        assertEquals(List.of("app.Broken"), driver.getFailedDeclarations());
        assertEquals(POS, driver.getErrors().get(0).getPosition());
    }

    @Test
    @DisplayName("An expression without output fails the declaration but not the pass")
    void missingExpressionOutputIsFatal() {
        TypedExpr unsupported = TypedExpr.throwValue(POS, TypedExpr.constant(POS, "x"));
        CompilationError error = assertThrows(CompilationError.class, () -> driver.compileExpressionOrFail(unsupported));
        assertEquals(POS, error.getPosition());
        assertTrue(driver.compileExpression(unsupported).isEmpty());

        Declaration bad = type("app.Bad").function(new ClassFunc("f", false,
                TypedExpr.block(POS, TypedExpr.ret(POS, TypedExpr.arrayDecl(POS, List.of()))))).build();
        List<CompiledDeclaration> compiled = driver.compile(List.of(bad, type("app.Good").build()));

        assertEquals(List.of("app.Good"), paths(compiled));
        assertEquals(1, driver.getStats().getFailedDeclarations());
    }

    @Test
    @DisplayName("Injected target code is used verbatim with compiled arguments")
    void injectsTargetCode() {
        config.setTargetCodeInjectionName("__native__");
        CompilerDriver injecting = new CompilerDriver(config, target);
        TypedVar v = TypedVar.create("items");

        TypedExpr call = TypedExpr.call(POS, TypedExpr.ident(POS, "__native__"),
                TypedExpr.constant(POS, "len({0}) + {1}"), TypedExpr.local(POS, v), TypedExpr.constant(POS, 1));

        assertEquals("len(items) + 1", injecting.compileExpressionOrFail(call));
        assertEquals("__native__(\"raw\")", driver.compileExpressionOrFail(
                TypedExpr.call(POS, TypedExpr.ident(POS, "__native__"), TypedExpr.constant(POS, "raw"))));

        TypedExpr outOfRange = TypedExpr.call(POS, TypedExpr.ident(POS, "__native__"), TypedExpr.constant(POS, "{3}"));
        assertThrows(CompilationError.class, () -> injecting.compileExpression(outOfRange));

        TypedExpr hugeIndex = TypedExpr.call(POS, TypedExpr.ident(POS, "__native__"), TypedExpr.constant(POS, "x = {99999999999}"));
        CompilationError error = assertThrows(CompilationError.class, () -> injecting.compileExpression(hugeIndex));
        assertEquals(POS, error.getPosition());
    }

    @Test
    @DisplayName("A bad injection placeholder fails its declaration, not the pass")
    void badInjectionFailsOnlyItsDeclaration() {
        config.setTargetCodeInjectionName("__native__");
        CompilerDriver injecting = new CompilerDriver(config, target);
        Declaration bad = type("app.Bad").function(new ClassFunc("f", false, TypedExpr.block(POS,
                TypedExpr.call(POS, TypedExpr.ident(POS, "__native__"), TypedExpr.constant(POS, "x = {99999999999}")))))
                .build();

        List<CompiledDeclaration> compiled = injecting.compile(List.of(bad, type("app.Good").build()));

        assertEquals(List.of("app.Good"), paths(compiled));
        assertEquals(List.of("app.Bad"), injecting.getFailedDeclarations());
    }

    @Test
    void compilationErrorWithoutPosition() {
        CompilationError error = new CompilationError(null, "boom");

        assertEquals(Position.NONE, error.getPosition());
        assertEquals("<unknown>: boom", error.getMessage());
    }

    @Test
    void listenersSeeEveryDeclaration() {
        List<String> seen = new ArrayList<>();
        driver.addDeclarationListener(d -> seen.add(d.getTypePath()));

        driver.compile(List.of(type("app.T").typeParameter(true).build(), type("app.A").build()));

        assertEquals(List.of("app.T", "app.A"), seen);
        assertEquals(List.of("start", "end"), target.events);
    }

    @Test
    void accumulatorIsRebuiltEachPass() {
        driver.compile(List.of(type("app.A").build(), type("app.B").build()));
        driver.setExtraFile("runtime.out", "runtime");
        List<CompiledDeclaration> second = driver.compile(List.of(type("app.C").build()));

        assertEquals(List.of("app.C"), paths(second));
        assertTrue(driver.getExtraFiles().isEmpty());
    }

    @Test
    @DisplayName("Parallel compilation keeps declaration order")
    void parallelCompilationKeepsOrder() {
        config.setParallelCompilation(true);
        List<Declaration> decls = IntStream.range(0, 64)
                .mapToObj(i -> type("app.T" + i).build())
                .collect(Collectors.toList());

        List<CompiledDeclaration> compiled = driver.compile(decls);

        assertEquals(decls.stream().map(Declaration::getTypePath).collect(Collectors.toList()), paths(compiled));
    }

    @Test
    @DisplayName("Function bodies are renamed, grouped and laid out line by line")
    void compilesFunctionBody() {
        TypedVar param = TypedVar.create("x");
        TypedVar local = TypedVar.create("x");
        TypedVar y = TypedVar.create("y");
        ClassFunc func = new ClassFunc("f", false, MethodKind.NORMAL, List.of(param), null,
                TypedExpr.block(POS,
                        TypedExpr.varDecl(POS, local, TypedExpr.local(POS, param)),
                        TypedExpr.varDecl(POS, y, TypedExpr.constant(POS, 2)),
                        TypedExpr.block(POS),
                        TypedExpr.call(POS, TypedExpr.ident(POS, "trace"), TypedExpr.local(POS, local)),
                        TypedExpr.ret(POS, TypedExpr.local(POS, y))),
                POS);

        String body = driver.compileFunctionBody(func);

        assertEquals("var x2 = x\nvar y = 2\n\ntrace(x2)\n\nreturn y", body);
        assertEquals(1, driver.getStats().getRenamedVariables());
    }

    @Test
    void normalizationCanBeDisabled() {
        config.setNormalizeExpressions(false);
        TypedVar a = TypedVar.create("a");
        TypedVar b = TypedVar.create("a");

        String body = driver.compileBody(TypedExpr.block(POS,
                TypedExpr.varDecl(POS, a, null), TypedExpr.varDecl(POS, b, null)), java.util.Set.of());

        assertEquals("var a\nvar a", body);
    }

    @Test
    void extraFilesAccumulate() {
        driver.setExtraFile("runtime/Std.out", "a");
        driver.appendToExtraFile("runtime/Std.out", "b");
        driver.appendToExtraFile("main.out", "main()");

        assertEquals("ab", driver.getExtraFiles().get("runtime/Std.out"));
        assertEquals(List.of("runtime/Std.out", "main.out"), new ArrayList<>(driver.getExtraFiles().keySet()));
    }
}
