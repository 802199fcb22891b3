package org.stagecraft.compiler.frontend.analysis.rules;

import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.concurrent.CancellationToken;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.frontend.analysis.AnalysisContext;
import org.stagecraft.compiler.frontend.analysis.AnalyzerOptions;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.stagecraft.compiler.SourceFixtures.sourceSet;
import static org.stagecraft.compiler.SourceFixtures.type;
import static org.stagecraft.compiler.SourceFixtures.unit;

/**
 * Tests the {@link TypeNamingAnalyzer}.
 */
public class TypeNamingAnalyzerTest {

    @Test
    @Tag("unit")
    void reportsTypesThatAreNotPascalCase() {
        SourceUnit u = unit("a.sc", "app")
                .type(type("Good"))
                .type(type("lowerCase"))
                .type(type("Snake_Case"))
                .build();
        SourceSet sourceSet = sourceSet(List.of(u));
        AnalysisContext context = new AnalysisContext(sourceSet.boundState(), u, AnalyzerOptions.empty(), CancellationToken.NONE);

        List<Diagnostic> diagnostics = new TypeNamingAnalyzer().analyze(context);

        assertThat(diagnostics).extracting(Diagnostic::message)
                .containsExactly("Type name 'lowerCase' should be PascalCase", "Type name 'Snake_Case' should be PascalCase");
        assertThat(diagnostics).allMatch(d -> d.id().equals(TypeNamingAnalyzer.ID) && d.severity() == Diagnostic.Severity.WARNING);
        assertThat(new TypeNamingAnalyzer().supportsConcurrentUnits()).isTrue();
    }
}
