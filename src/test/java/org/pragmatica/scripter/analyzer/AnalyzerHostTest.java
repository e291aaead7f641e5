package org.pragmatica.scripter.analyzer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pragmatica.scripter.error.AnalysisError;
import org.pragmatica.scripter.error.AnalysisException;
import org.pragmatica.scripter.syntax.SourceFile;
import org.pragmatica.scripter.syntax.SourceSet;
import org.pragmatica.scripter.tree.CodeNode;
import org.pragmatica.scripter.tree.FunctionDeclaration;
import org.pragmatica.scripter.tree.Source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyzerHostTest {

    private SourceFile calculator;
    private SourceFile point;
    private AnalyzerHost host;

    @BeforeEach
    void setUp() {
        calculator = Programs.calculator("src/calc.ts");
        point = Programs.point("src/point.ts");
        host = new AnalyzerHost(SourceSet.of(calculator, point));
    }

    // === Source identity ===

    @Test
    void getSource_equivalentPaths_returnSameRoot() {
        var first = host.getSource("src/calc.ts");
        var second = host.getSource("src/lib/../calc.ts");

        assertThat(second).isSameAs(first);
        assertThat(first.fileName()).isEqualTo("src/calc.ts");
        assertThat(host.registry().size()).isEqualTo(1);
    }

    @Test
    void analyze_returnsCanonicalRoot() {
        var root = host.getSource("src/calc.ts");

        var analyzed = host.analyze("./src/calc.ts");

        assertThat(analyzed).isSameAs(root);
        assertThat(analyzed.render()).isEqualTo(Programs.CALCULATOR);
    }

    @Test
    void analyze_repeated_fillsRootOnce() {
        var first = host.analyze("src/calc.ts");
        var element = first.elements().get(1);

        var second = host.analyze("src/calc.ts");

        assertThat(second).isSameAs(first);
        assertThat(second.elements()).hasSize(7);
        assertThat(second.elements().get(1)).isSameAs(element);
    }

    @Test
    void analyze_recursiveAfterShallow_expandsPendingBodies() {
        var source = host.analyze("src/calc.ts");
        var function = function(source);
        assertThat(function.canAnalyzeBody()).isTrue();

        host.analyze("src/calc.ts", true);

        assertThat(function.isBodyAnalyzed()).isTrue();
        assertThat(source.render()).isEqualTo(Programs.CALCULATOR);
    }

    @Test
    void analyzeAll_followsProviderOrder() {
        var sources = host.analyzeAll();

        assertThat(sources).extracting(Source::fileName).containsExactly("src/calc.ts", "src/point.ts");
        assertThat(sources).extracting(CodeNode::render).containsExactly(Programs.CALCULATOR, Programs.POINT);
        assertThat(host.registry().sources()).containsExactlyElementsOf(sources);
    }

    @Test
    void analyzeAll_recursive_expandsBodies() {
        var sources = host.analyzeAll(true);

        assertThat(function(sources.get(0)).isBodyAnalyzed()).isTrue();
        assertThat(function(sources.get(1)).isBodyAnalyzed()).isTrue();
    }

    // === Lazy expansion through the host ===

    @Test
    void getAnalyzer_expandsBlockOfAnalyzedRoot() {
        var source = host.analyze("src/calc.ts");
        var function = function(source);

        host.getAnalyzer(source, false).analyzeBody(function);

        assertThat(function.isBodyAnalyzed()).isTrue();
    }

    @Test
    void getAnalyzer_inheritsModeAndTakesRecursion() {
        var strictHost = new AnalyzerHost(SourceSet.of(calculator), new AnalyzerConfig(AnalysisMode.STRICT, false));

        var analyzer = strictHost.getAnalyzer("src/calc.ts", true);

        assertThat(analyzer.config()).isEqualTo(new AnalyzerConfig(AnalysisMode.STRICT, true));
        assertThat(analyzer.sourceFile()).isSameAs(calculator);
        assertThat(analyzer.source()).isSameAs(strictHost.getSource("src/calc.ts"));
    }

    // === Missing sources ===

    @Test
    void getSource_nullPath_fails() {
        assertThatThrownBy(() -> host.getSource(null))
            .isInstanceOfSatisfying(AnalysisException.class,
                                    e -> assertThat(e.error()).isEqualTo(new AnalysisError.NullSource(null)));
    }

    @Test
    void getAnalyzer_nullSource_fails() {
        assertThatThrownBy(() -> host.getAnalyzer((Source) null, false))
            .isInstanceOf(AnalysisException.class)
            .hasMessage("Null source passed to analyzer");
    }

    @Test
    void analyze_unknownFile_failsButKeepsRoot() {
        assertThatThrownBy(() -> host.analyze("src/missing.ts"))
            .isInstanceOfSatisfying(AnalysisException.class,
                                    e -> assertThat(e.error()).isEqualTo(new AnalysisError.NullSource("src/missing.ts")));

        assertThat(host.registry().find("src/missing.ts"))
            .hasValueSatisfying(root -> assertThat(root.canAnalyzeBody()).isTrue());
    }

    private static FunctionDeclaration function(Source source) {
        return source.findChild(node -> node instanceof FunctionDeclaration)
                     .map(FunctionDeclaration.class::cast)
                     .orElseThrow();
    }
}
