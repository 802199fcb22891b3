package org.stagecraft.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.stagecraft.compiler.api.CompilationOptions;
import org.stagecraft.compiler.api.EmitOptions;
import org.stagecraft.compiler.frontend.analysis.AnalyzerOptions;

/**
 * The option records of a pipeline run, read from the {@code stagecraft} config block.
 *
 * <pre>
 * stagecraft {
 *   compilation { concurrent-build = true, output-kind = library }
 *   emit { debug-info = none, emission-policy = fail_closed, ... }
 *   analyzers { severity { SCA001 = error } }
 * }
 * </pre>
 *
 * @param compilation Options for new source sets.
 * @param emit Options for emit runs.
 * @param analyzers Options passed to analyzers.
 */
public record PipelineSettings(CompilationOptions compilation, EmitOptions emit, AnalyzerOptions analyzers) {

    static final String ROOT_PATH = "stagecraft";

    /**
     * Reads the settings. Missing blocks or keys fall back to the option defaults.
     *
     * @param config The full configuration, e.g. from {@link ConfigLoader#load()}.
     * @return The settings.
     */
    public static PipelineSettings fromConfig(Config config) {
        Config root = config.hasPath(ROOT_PATH) ? config.getConfig(ROOT_PATH) : ConfigFactory.empty();
        return new PipelineSettings(
                CompilationOptions.fromConfig(block(root, "compilation")),
                EmitOptions.fromConfig(block(root, "emit")),
                AnalyzerOptions.fromConfig(block(root, "analyzers")));
    }

    /**
     * Loads configuration from the default sources, applies its logging block and reads the settings.
     *
     * @return The settings.
     */
    public static PipelineSettings load() {
        Config config = ConfigLoader.load();
        LoggingConfigurator.configure(config);
        return fromConfig(config);
    }

    private static Config block(Config root, String path) {
        return root.hasPath(path) ? root.getConfig(path) : ConfigFactory.empty();
    }
}
