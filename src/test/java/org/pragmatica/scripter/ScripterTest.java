package org.pragmatica.scripter;

import org.junit.jupiter.api.Test;
import org.pragmatica.scripter.analyzer.AnalysisMode;
import org.pragmatica.scripter.analyzer.AnalyzerConfig;
import org.pragmatica.scripter.error.AnalysisException;
import org.pragmatica.scripter.syntax.Role;
import org.pragmatica.scripter.syntax.SourceSet;
import org.pragmatica.scripter.syntax.SyntaxFixture;
import org.pragmatica.scripter.syntax.SyntaxKind;
import org.pragmatica.scripter.tree.Opaque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScripterTest {

    private static final String TEXT = "yield next;\n";

    private static SourceSet generator() {
        var f = new SyntaxFixture(TEXT);
        var statement = f.node(SyntaxKind.EXPRESSION_STATEMENT, "yield next;")
                         .child(Role.EXPRESSION, f.node(SyntaxKind.YIELD_EXPRESSION, "yield next"));
        return SourceSet.of(f.file("gen.ts", statement));
    }

    @Test
    void host_usesDefaultConfig() {
        assertThat(Scripter.host(new SourceSet()).config()).isEqualTo(AnalyzerConfig.DEFAULT);
    }

    @Test
    void builder_setsModeAndRecursion() {
        var host = Scripter.builder(new SourceSet())
                           .strict()
                           .recursive(true)
                           .build();

        assertThat(host.config()).isEqualTo(new AnalyzerConfig(AnalysisMode.STRICT, true));
    }

    @Test
    void lenientHost_keepsUnsupportedStatement() {
        var sources = generator();

        var source = Scripter.host(sources).analyze("gen.ts");

        assertThat(source.elements().get(0)).isInstanceOf(Opaque.class);
        assertThat(source.render()).isEqualTo(TEXT);
    }

    @Test
    void strictHost_rejectsUnsupportedStatement() {
        var sources = generator();
        var host = Scripter.builder(sources).mode(AnalysisMode.STRICT).build();

        assertThatThrownBy(() -> host.analyze("gen.ts"))
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("YIELD_EXPRESSION");
    }
}
