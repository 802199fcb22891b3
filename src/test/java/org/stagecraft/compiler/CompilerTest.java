package org.stagecraft.compiler;

import org.stagecraft.compiler.api.CompilationOptions;
import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.DebugInfoMode;
import org.stagecraft.compiler.api.EmissionPolicy;
import org.stagecraft.compiler.api.EmitOptions;
import org.stagecraft.compiler.api.EmitStreams;
import org.stagecraft.compiler.api.ManifestResource;
import org.stagecraft.compiler.api.OutputStreamKind;
import org.stagecraft.compiler.api.SerializationResult;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.frontend.binding.DeclarationBinder;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stagecraft.junit.logging.ExpectLog;
import org.stagecraft.junit.logging.LogLevel;
import org.stagecraft.junit.logging.LogWatchExtension;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.stagecraft.compiler.SourceFixtures.method;
import static org.stagecraft.compiler.SourceFixtures.sourceSet;
import static org.stagecraft.compiler.SourceFixtures.type;
import static org.stagecraft.compiler.SourceFixtures.unit;
import static org.stagecraft.compiler.SourceFixtures.validProgram;

/**
 * End-to-end tests of the compiler orchestration from source set to written streams.
 */
@ExtendWith(LogWatchExtension.class)
public class CompilerTest {

    private final Compiler compiler = new Compiler();

    private static List<SourceUnit> programWithBodyError() {
        return List.of(unit("a.sc", "app").type(type("Main")
                .method(method("run", "int").body("LOAD_CONST 1", "JUMP 4", "RET"))).build());
    }

    private static List<String> errorIds(SerializationResult result) {
        return result.diagnostics().errors().stream().map(Diagnostic::id).toList();
    }

    /**
     * Verifies that a valid program emits successfully into every requested stream.
     */
    @Test
    @Tag("integration")
    void validProgramEmitsAllStreams() {
        // Arrange
        ByteArrayOutputStream primary = new ByteArrayOutputStream();
        ByteArrayOutputStream metadata = new ByteArrayOutputStream();
        ByteArrayOutputStream debug = new ByteArrayOutputStream();
        ByteArrayOutputStream docs = new ByteArrayOutputStream();
        EmitOptions options = EmitOptions.defaults()
                .withDebugInfoMode(DebugInfoMode.SEPARATE)
                .withGenerateDocumentation(true);

        // Act
        SerializationResult result = compiler.emit(sourceSet(validProgram()),
                EmitStreams.primaryOnly(primary).withMetadata(metadata).withDebug(debug).withDocumentation(docs),
                options);

        // Assert
        assertThat(result.success()).isTrue();
        assertThat(result.diagnostics().hasErrors()).isFalse();
        assertThat(result.streamsWritten()).containsExactlyInAnyOrder(OutputStreamKind.values());
        assertThat(primary.size()).isPositive();
        assertThat(metadata.size()).isPositive();
        assertThat(debug.size()).isPositive();
        assertThat(docs.toString(StandardCharsets.UTF_8)).contains("\"assembly\": \"TestAssembly\"");
    }

    /**
     * Verifies that two emits of equal inputs produce identical bytes, on a pool or sequentially.
     */
    @Test
    @Tag("integration")
    void emitIsDeterministic() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            ByteArrayOutputStream parallel = new ByteArrayOutputStream();
            ByteArrayOutputStream sequential = new ByteArrayOutputStream();

            new Compiler(pool).emit(sourceSet(validProgram(), true), EmitStreams.primaryOnly(parallel), EmitOptions.defaults());
            compiler.emit(sourceSet(validProgram(), false), EmitStreams.primaryOnly(sequential), EmitOptions.defaults());

            assertThat(parallel.toByteArray()).isEqualTo(sequential.toByteArray());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Verifies that the compiler's pool lowers methods while declaration binding runs on the
     * binder of the source set.
     */
    @Test
    @Tag("integration")
    void executorLowersMethodsAndBinderBindsDeclarations() {
        // Arrange
        ExecutorService pool = Executors.newFixedThreadPool(2);
        AtomicInteger compilerTasks = new AtomicInteger();
        AtomicInteger binderTasks = new AtomicInteger();
        Executor compilerExecutor = command -> {
            compilerTasks.incrementAndGet();
            pool.execute(command);
        };
        Executor binderExecutor = command -> {
            binderTasks.incrementAndGet();
            pool.execute(command);
        };
        SourceSet sourceSet = SourceSet.builder("TestAssembly")
                .addUnits(validProgram())
                .options(CompilationOptions.defaults().withConcurrentBuild(true))
                .binder(new DeclarationBinder(binderExecutor))
                .build();

        try {
            // Act
            SerializationResult result = new Compiler(compilerExecutor)
                    .emit(sourceSet, EmitStreams.primaryOnly(new ByteArrayOutputStream()), EmitOptions.defaults());

            // Assert: two units bound, two method bodies lowered
            assertThat(result.success()).isTrue();
            assertThat(binderTasks.get()).isEqualTo(2);
            assertThat(compilerTasks.get()).isEqualTo(2);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Verifies that a method body error writes nothing under the default fail-closed policy.
     */
    @Test
    @Tag("integration")
    void failClosedWritesNothing() {
        ByteArrayOutputStream primary = new ByteArrayOutputStream();

        SerializationResult result = compiler.emit(sourceSet(programWithBodyError()),
                EmitStreams.primaryOnly(primary), EmitOptions.defaults());

        assertThat(result.success()).isFalse();
        assertThat(result.streamsWritten()).isEmpty();
        assertThat(errorIds(result)).contains(CompilerErrorCode.UNKNOWN_OPCODE.id());
        assertThat(primary.size()).isZero();
    }

    /**
     * Verifies that EMIT_ANYWAY writes the module but still reports failure.
     */
    @Test
    @Tag("integration")
    void emitAnywayWritesButFails() {
        ByteArrayOutputStream primary = new ByteArrayOutputStream();

        SerializationResult result = compiler.emit(sourceSet(programWithBodyError()),
                EmitStreams.primaryOnly(primary),
                EmitOptions.defaults().withEmissionPolicy(EmissionPolicy.EMIT_ANYWAY));

        assertThat(result.success()).isFalse();
        assertThat(result.streamsWritten()).containsExactly(OutputStreamKind.PRIMARY);
        assertThat(errorIds(result)).contains(CompilerErrorCode.UNKNOWN_OPCODE.id());
        assertThat(primary.size()).isPositive();
    }

    /**
     * Verifies that an invalid output name stops the emit before any output is produced.
     */
    @Test
    @Tag("integration")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "(?s)Emit of 'TestAssembly' stopped: .*")
    void invalidOutputNameStopsEmit() {
        ByteArrayOutputStream primary = new ByteArrayOutputStream();

        SerializationResult result = compiler.emit(sourceSet(validProgram()),
                EmitStreams.primaryOnly(primary), EmitOptions.defaults().withOutputNameOverride("bad/name"));

        assertThat(result.success()).isFalse();
        assertThat(errorIds(result)).containsExactly(CompilerErrorCode.INVALID_OUTPUT_NAME.id());
        assertThat(primary.size()).isZero();
    }

    /**
     * Verifies that inconsistent stream and option combinations are rejected up front.
     */
    @Test
    @Tag("unit")
    void inconsistentOptionsAreRejected() {
        SourceSet sourceSet = sourceSet(validProgram());
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertThatThrownBy(() -> compiler.emit(sourceSet,
                EmitStreams.primaryOnly(out).withDebug(new ByteArrayOutputStream()), EmitOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> compiler.emit(sourceSet,
                EmitStreams.primaryOnly(out).withMetadata(new ByteArrayOutputStream()),
                EmitOptions.defaults().withEmitMetadataOnly(true)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> compiler.emit(sourceSet, EmitStreams.primaryOnly(out),
                EmitOptions.defaults().withEmitMetadataOnly(true).withEmitTestCoverageData(true)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(out.size()).isZero();
    }

    /**
     * Verifies that resources end up in the image and duplicates are reported.
     */
    @Test
    @Tag("integration")
    void resourcesAreEmbedded() {
        ByteArrayOutputStream primary = new ByteArrayOutputStream();
        List<ManifestResource> resources = List.of(
                new ManifestResource("banner.txt", "hello".getBytes(StandardCharsets.UTF_8), true),
                new ManifestResource("banner.txt", "again".getBytes(StandardCharsets.UTF_8), false));

        SerializationResult result = compiler.emit(sourceSet(validProgram()),
                EmitStreams.primaryOnly(primary), EmitOptions.defaults(), resources);

        assertThat(errorIds(result)).containsExactly(CompilerErrorCode.DUPLICATE_RESOURCE.id());
        assertThat(result.success()).isFalse();
        String image = primary.toString(StandardCharsets.ISO_8859_1);
        assertThat(image).contains("banner.txt").contains("hello").doesNotContain("again");
    }

    /**
     * Verifies that the compiler reports the same declaration diagnostics as the engine.
     */
    @Test
    @Tag("unit")
    void getDiagnosticsDelegatesToEngine() {
        SourceSet sourceSet = sourceSet(List.of(unit("a.sc", "app").imports("nowhere")
                .type(type("Main")).build()));

        assertThat(compiler.getDiagnostics(sourceSet))
                .isEqualTo(compiler.diagnosticsEngine().getDiagnostics(sourceSet));
        assertThat(compiler.getDiagnostics(sourceSet).stream().map(Diagnostic::id).toList())
                .containsExactly(CompilerErrorCode.UNKNOWN_NAMESPACE.id());
    }
}
