package org.stagecraft.compiler.api;

import com.typesafe.config.Config;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable configuration of a single emit run, passed into method compilation,
 * finalization and serialization.
 *
 * @param includePrivateMembers Whether metadata-only images keep private members.
 * @param debugInfoMode Where debug information goes.
 * @param emitMetadataOnly Whether only declarations (no method bodies) are emitted.
 * @param outputNameOverride Module name to use instead of the assembly name, or {@code null}.
 * @param emitTestCoverageData Whether method bodies are instrumented with coverage probes.
 * @param generateDocumentation Whether documentation output is generated during finalization.
 * @param emissionPolicy What happens when declaration binding reported errors.
 */
public record EmitOptions(
        boolean includePrivateMembers,
        DebugInfoMode debugInfoMode,
        boolean emitMetadataOnly,
        String outputNameOverride,
        boolean emitTestCoverageData,
        boolean generateDocumentation,
        EmissionPolicy emissionPolicy
) {
    public EmitOptions {
        Objects.requireNonNull(debugInfoMode, "debugInfoMode");
        Objects.requireNonNull(emissionPolicy, "emissionPolicy");
    }

    /**
     * @return Options that emit a full image without debug information, fail closed on declaration errors.
     */
    public static EmitOptions defaults() {
        return new EmitOptions(true, DebugInfoMode.NONE, false, null, false, false, EmissionPolicy.FAIL_CLOSED);
    }

    /**
     * Reads options from a {@code stagecraft.emit} config block. Missing keys fall back to {@link #defaults()}.
     * @param config The config block.
     * @return The options.
     */
    public static EmitOptions fromConfig(Config config) {
        EmitOptions d = defaults();
        return new EmitOptions(
                config.hasPath("include-private-members") ? config.getBoolean("include-private-members") : d.includePrivateMembers(),
                config.hasPath("debug-info") ? DebugInfoMode.valueOf(config.getString("debug-info").toUpperCase(Locale.ROOT)) : d.debugInfoMode(),
                config.hasPath("metadata-only") ? config.getBoolean("metadata-only") : d.emitMetadataOnly(),
                config.hasPath("output-name-override") ? config.getString("output-name-override") : d.outputNameOverride(),
                config.hasPath("test-coverage") ? config.getBoolean("test-coverage") : d.emitTestCoverageData(),
                config.hasPath("documentation") ? config.getBoolean("documentation") : d.generateDocumentation(),
                config.hasPath("emission-policy") ? EmissionPolicy.valueOf(config.getString("emission-policy").toUpperCase(Locale.ROOT)) : d.emissionPolicy());
    }

    public EmitOptions withIncludePrivateMembers(boolean value) {
        return new EmitOptions(value, debugInfoMode, emitMetadataOnly, outputNameOverride, emitTestCoverageData, generateDocumentation, emissionPolicy);
    }

    public EmitOptions withDebugInfoMode(DebugInfoMode value) {
        return new EmitOptions(includePrivateMembers, value, emitMetadataOnly, outputNameOverride, emitTestCoverageData, generateDocumentation, emissionPolicy);
    }

    public EmitOptions withEmitMetadataOnly(boolean value) {
        return new EmitOptions(includePrivateMembers, debugInfoMode, value, outputNameOverride, emitTestCoverageData, generateDocumentation, emissionPolicy);
    }

    public EmitOptions withOutputNameOverride(String value) {
        return new EmitOptions(includePrivateMembers, debugInfoMode, emitMetadataOnly, value, emitTestCoverageData, generateDocumentation, emissionPolicy);
    }

    public EmitOptions withEmitTestCoverageData(boolean value) {
        return new EmitOptions(includePrivateMembers, debugInfoMode, emitMetadataOnly, outputNameOverride, value, generateDocumentation, emissionPolicy);
    }

    public EmitOptions withGenerateDocumentation(boolean value) {
        return new EmitOptions(includePrivateMembers, debugInfoMode, emitMetadataOnly, outputNameOverride, emitTestCoverageData, value, emissionPolicy);
    }

    public EmitOptions withEmissionPolicy(EmissionPolicy value) {
        return new EmitOptions(includePrivateMembers, debugInfoMode, emitMetadataOnly, outputNameOverride, emitTestCoverageData, generateDocumentation, value);
    }
}
