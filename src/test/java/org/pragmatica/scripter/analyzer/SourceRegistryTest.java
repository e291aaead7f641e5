package org.pragmatica.scripter.analyzer;

import org.junit.jupiter.api.Test;
import org.pragmatica.scripter.error.AnalysisError;
import org.pragmatica.scripter.error.AnalysisException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryTest {

    @Test
    void resolve_createsPristineRootOnce() {
        var registry = new SourceRegistry();

        var root = registry.resolve("lib/a.ts");

        assertThat(root.canAnalyzeBody()).isTrue();
        assertThat(registry.resolve("lib/./a.ts")).isSameAs(root);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void find_doesNotCreateRoots() {
        var registry = new SourceRegistry();

        assertThat(registry.find("lib/a.ts")).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void sources_keepResolutionOrder() {
        var registry = new SourceRegistry();
        var b = registry.resolve("b.ts");
        var a = registry.resolve("a.ts");

        assertThat(registry.sources()).containsExactly(b, a);
    }

    @Test
    void resolve_nullPath_failsWithNullSource() {
        var registry = new SourceRegistry();

        assertThatThrownBy(() -> registry.resolve(null))
            .isInstanceOfSatisfying(AnalysisException.class,
                                    e -> assertThat(e.error()).isEqualTo(new AnalysisError.NullSource(null)));
        assertThat(registry.size()).isZero();
    }

    @Test
    void find_nullPath_failsWithNullSource() {
        assertThatThrownBy(() -> new SourceRegistry().find(null))
            .isInstanceOf(AnalysisException.class)
            .hasMessage("Null source passed to analyzer");
    }

    @Test
    void config_requiresMode() {
        assertThatThrownBy(() -> new AnalyzerConfig(null, false))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void config_defaultIsLenientAndShallow() {
        assertThat(AnalyzerConfig.DEFAULT.isStrict()).isFalse();
        assertThat(AnalyzerConfig.DEFAULT.recursive()).isFalse();
        assertThat(AnalyzerConfig.DEFAULT.withRecursive(true))
            .isEqualTo(new AnalyzerConfig(AnalysisMode.LENIENT, true));
    }
}
