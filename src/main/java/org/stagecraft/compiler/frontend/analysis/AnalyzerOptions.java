package org.stagecraft.compiler.frontend.analysis;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.stagecraft.compiler.diagnostics.Diagnostic;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable analyzer configuration, the equivalent of command-line derived analyzer settings.
 * <p>
 * Besides free-form keys read by individual analyzers, the {@code severity.<diagnosticId>} keys
 * rewrite the severity of analyzer diagnostics. Valid values are {@code error}, {@code warning},
 * {@code info} and {@code suppress}.
 */
public final class AnalyzerOptions {

    private static final AnalyzerOptions EMPTY = new AnalyzerOptions(Map.of());
    private static final String SEVERITY_PREFIX = "severity.";

    private final Map<String, String> values;

    private AnalyzerOptions(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static AnalyzerOptions empty() {
        return EMPTY;
    }

    public static AnalyzerOptions of(Map<String, String> values) {
        return new AnalyzerOptions(values);
    }

    /**
     * Flattens a {@code stagecraft.analyzers} config block into dotted keys.
     * @param config The config block.
     * @return The options.
     */
    public static AnalyzerOptions fromConfig(Config config) {
        Map<String, String> values = new HashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.entrySet()) {
            values.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
        }
        return new AnalyzerOptions(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getOrDefault(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * Applies a configured severity override to an analyzer diagnostic.
     *
     * @param diagnostic The diagnostic as reported by the analyzer.
     * @return The possibly re-classified diagnostic, or empty if it is suppressed.
     * @throws IllegalArgumentException if the configured severity is not recognized.
     */
    public Optional<Diagnostic> applySeverity(Diagnostic diagnostic) {
        String configured = values.get(SEVERITY_PREFIX + diagnostic.id());
        if (configured == null) {
            return Optional.of(diagnostic);
        }
        String normalized = configured.trim().toUpperCase(Locale.ROOT);
        if ("SUPPRESS".equals(normalized) || "NONE".equals(normalized)) {
            return Optional.empty();
        }
        try {
            return Optional.of(diagnostic.withSeverity(Diagnostic.Severity.valueOf(normalized)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity '" + configured + "' configured for " + diagnostic.id(), e);
        }
    }

    @Override
    public String toString() {
        return "AnalyzerOptions" + values;
    }
}
