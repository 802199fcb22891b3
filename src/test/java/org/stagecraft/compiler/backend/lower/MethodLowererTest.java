package org.stagecraft.compiler.backend.lower;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.EmitOptions;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.syntax.ImportDirective;
import org.stagecraft.compiler.syntax.MethodDeclaration;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.stagecraft.compiler.syntax.Visibility;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.stagecraft.compiler.SourceFixtures.method;
import static org.stagecraft.compiler.SourceFixtures.sourceSet;
import static org.stagecraft.compiler.SourceFixtures.type;
import static org.stagecraft.compiler.SourceFixtures.unit;
import static org.stagecraft.compiler.SourceFixtures.validProgram;

/**
 * Contains unit tests for the {@link MethodLowerer}: decoding, rewrite rules, operand validation
 * and encoding of single methods.
 */
public class MethodLowererTest {

    private static final MethodLowerer DEFAULT = new MethodLowerer(LoweringRegistry.initializeWithDefaults(EmitOptions.defaults()));

    private static MethodLoweringResult lowerFirst(MethodLowerer lowerer, SourceUnit unit, BoundDeclarationState bound, String typeName) {
        TypeDeclaration type = unit.types().stream().filter(t -> t.name().equals(typeName)).findFirst().orElseThrow();
        MethodDeclaration method = type.methods().get(0);
        return lowerer.lower(unit, type, method, bound);
    }

    /**
     * Verifies that a valid body is encoded with one sequence point per instruction and that the
     * import used by a CALL is recorded.
     */
    @Test
    @Tag("unit")
    void encodesValidBody() {
        // Arrange
        List<SourceUnit> units = validProgram();
        SourceSet sourceSet = sourceSet(units);
        SourceUnit main = units.get(1);

        // Act
        MethodLoweringResult result = lowerFirst(DEFAULT, main, sourceSet.boundState(), "Main");

        // Assert
        assertThat(result.succeeded()).isTrue();
        CompiledMethod compiled = result.method();
        assertThat(compiled.key()).isEqualTo("app.Main.run(int)");
        assertThat(compiled.code()[0]).isEqualTo((byte) Opcode.LOAD_ARG.code());
        assertThat(compiled.code()[compiled.code().length - 1]).isEqualTo((byte) Opcode.RET.code());
        assertThat(compiled.sequencePoints()).hasSize(3);
        assertThat(compiled.sequencePoints().get(0).offset()).isZero();
        assertThat(compiled.probeCount()).isZero();
        assertThat(result.usedImports().stream().map(ImportDirective::namespace).toList()).containsExactly("util");
    }

    /**
     * Verifies that NOPs are removed before encoding.
     */
    @Test
    @Tag("unit")
    void nopsAreEliminated() {
        SourceUnit u = unit("a.sc", "app").type(type("Main").method(method("m", "void").body("NOP", "NOP", "RET"))).build();
        SourceSet sourceSet = sourceSet(List.of(u));

        MethodLoweringResult result = lowerFirst(DEFAULT, u, sourceSet.boundState(), "Main");

        assertThat(result.method().code()).containsExactly((byte) Opcode.RET.code());
    }

    /**
     * Verifies that coverage instrumentation inserts one probe per source line.
     */
    @Test
    @Tag("unit")
    void coverageInsertsProbes() {
        SourceUnit u = unit("a.sc", "app").type(type("Main")
                .method(method("m", "int").body("LOAD_CONST 1", "LOAD_CONST 2", "ADD", "NOP", "RET"))).build();
        SourceSet sourceSet = sourceSet(List.of(u));
        MethodLowerer instrumented = new MethodLowerer(
                LoweringRegistry.initializeWithDefaults(EmitOptions.defaults().withEmitTestCoverageData(true)));

        MethodLoweringResult result = lowerFirst(instrumented, u, sourceSet.boundState(), "Main");

        assertThat(result.method().probeCount()).isEqualTo(4);
        assertThat(result.method().code()[0]).isEqualTo((byte) Opcode.PROBE.code());
        assertThat(result.method().sequencePoints()).hasSize(4);
    }

    /**
     * Verifies that every kind of method error is reported in source order and the method is dropped.
     */
    @Test
    @Tag("unit")
    void reportsAllMethodErrors() {
        // Arrange
        SourceUnit u = unit("a.sc", "app")
                .type(type("Other").method(method("secret", "void").visibility(Visibility.PRIVATE).body("RET")))
                .type(type("Main").method(method("bad", "void").param("x", "int").body(
                        "FOO",
                        "LOAD_CONST abc",
                        "LOAD_ARG 3",
                        "NEW Ghost",
                        "CALL Other.missing",
                        "CALL Other.secret")))
                .build();
        SourceSet sourceSet = sourceSet(List.of(u));

        // Act
        MethodLoweringResult result = lowerFirst(DEFAULT, u, sourceSet.boundState(), "Main");

        // Assert
        assertThat(result.succeeded()).isFalse();
        assertThat(result.diagnostics().stream().map(Diagnostic::id).toList()).containsExactly(
                CompilerErrorCode.MISSING_RETURN.id(),
                CompilerErrorCode.UNKNOWN_OPCODE.id(),
                CompilerErrorCode.INVALID_OPERAND.id(),
                CompilerErrorCode.ARGUMENT_INDEX_OUT_OF_RANGE.id(),
                CompilerErrorCode.UNDECLARED_IDENTIFIER.id(),
                CompilerErrorCode.MEMBER_NOT_FOUND.id(),
                CompilerErrorCode.INACCESSIBLE_MEMBER.id());
        assertThat(result.diagnostics().get(3).message()).contains("app.Main.bad(int)");
    }

    /**
     * Verifies that a private member is callable from its own type.
     */
    @Test
    @Tag("unit")
    void privateMemberIsAccessibleFromDeclaringType() {
        SourceUnit u = unit("a.sc", "app").type(type("Main")
                .method(method("entry", "void").body("CALL Main.helper", "RET"))
                .method(method("helper", "void").visibility(Visibility.PRIVATE).body("RET"))).build();
        SourceSet sourceSet = sourceSet(List.of(u));

        MethodLoweringResult result = lowerFirst(DEFAULT, u, sourceSet.boundState(), "Main");

        assertThat(result.succeeded()).isTrue();
        assertThat(result.diagnostics().isEmpty()).isTrue();
    }
}
