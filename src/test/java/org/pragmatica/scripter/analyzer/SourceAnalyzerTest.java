package org.pragmatica.scripter.analyzer;

import org.junit.jupiter.api.Test;
import org.pragmatica.scripter.error.AnalysisError;
import org.pragmatica.scripter.error.AnalysisException;
import org.pragmatica.scripter.syntax.SourceFile;
import org.pragmatica.scripter.syntax.SyntaxKind;
import org.pragmatica.scripter.tree.AtomicValue;
import org.pragmatica.scripter.tree.BinaryOperation;
import org.pragmatica.scripter.tree.Case;
import org.pragmatica.scripter.tree.ClassDeclaration;
import org.pragmatica.scripter.tree.CodeBlock;
import org.pragmatica.scripter.tree.CodeNode;
import org.pragmatica.scripter.tree.FunctionDeclaration;
import org.pragmatica.scripter.tree.Identifier;
import org.pragmatica.scripter.tree.Opaque;
import org.pragmatica.scripter.tree.Property;
import org.pragmatica.scripter.tree.Source;
import org.pragmatica.scripter.tree.Switch;
import org.pragmatica.scripter.tree.Trivia;
import org.pragmatica.scripter.tree.UnaryOperation;
import org.pragmatica.scripter.tree.VariableDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceAnalyzerTest {

    private static final AnalyzerConfig SHALLOW = AnalyzerConfig.DEFAULT;
    private static final AnalyzerConfig RECURSIVE = AnalyzerConfig.DEFAULT.withRecursive(true);
    private static final AnalyzerConfig STRICT = new AnalyzerConfig(AnalysisMode.STRICT, false);
    private static final AnalyzerConfig STRICT_RECURSIVE = STRICT.withRecursive(true);

    private static SourceAnalyzer analyzer(SourceFile file, AnalyzerConfig config) {
        return new SourceAnalyzer(file, new Source(file.fileName()), config);
    }

    private static <T extends CodeNode> T find(CodeNode root, Class<T> type) {
        return root.findChild(type::isInstance)
                   .map(type::cast)
                   .orElseThrow();
    }

    // === Shallow analysis ===

    @Test
    void analyze_unedited_rendersFileByteForByte() {
        var file = Programs.calculator("calc.ts");

        var source = analyzer(file, SHALLOW).analyze();

        assertThat(source.render()).isEqualTo(Programs.CALCULATOR);
    }

    @Test
    void analyze_interleavesTriviaWithStatements() {
        var file = Programs.calculator("calc.ts");

        var source = analyzer(file, SHALLOW).analyze();

        assertThat(source.elements())
            .extracting(node -> node.getClass().getSimpleName())
            .containsExactly("Trivia", "VariableDeclaration", "Trivia", "FunctionDeclaration",
                             "Trivia", "BinaryOperation", "Trivia");
        assertThat(source.elements().get(0).render()).isEqualTo("// math helpers\n");
        assertThat(source.elements().get(6).render()).isEqualTo("\n");
    }

    @Test
    void analyze_statementTextExcludesSemicolon() {
        var file = Programs.calculator("calc.ts");

        var source = analyzer(file, SHALLOW).analyze();

        assertThat(source.elements().get(1).render()).isEqualTo("let total = 0");
        assertThat(source.elements().get(5).render()).isEqualTo("total = add(1, 2)");
    }

    @Test
    void analyze_shallow_leavesNestedBlocksPristine() {
        var file = Programs.calculator("calc.ts");

        var source = analyzer(file, SHALLOW).analyze();

        var function = find(source, FunctionDeclaration.class);
        var declaration = find(source, VariableDeclaration.class);
        assertThat(function.canAnalyzeBody()).isTrue();
        assertThat(declaration.canAnalyzeBody()).isTrue();
        assertThat(function.render()).isEqualTo("function add(a, b) {\n    return a + b;\n}");
    }

    @Test
    void analyze_registersOrigins() {
        var file = Programs.calculator("calc.ts");

        var source = analyzer(file, SHALLOW).analyze();

        assertThat(source.origin()).containsSame(file.root());
        assertThat(find(source, FunctionDeclaration.class).origin())
            .hasValueSatisfying(element -> assertThat(element.kind()).isEqualTo(SyntaxKind.FUNCTION_DECLARATION));
    }

    @Test
    void analyze_twice_isNoOp() {
        var file = Programs.calculator("calc.ts");
        var analyzer = analyzer(file, SHALLOW);

        var first = analyzer.analyze();
        var elements = List.copyOf(first.elements());
        var second = analyzer.analyze();

        assertThat(second).isSameAs(first);
        assertThat(second.elements()).containsExactlyElementsOf(elements);
    }

    @Test
    void analyze_missingTrailingNewline_isAppended() {
        var file = Programs.noNewline("answer.ts");

        var source = analyzer(file, SHALLOW).analyze();

        assertThat(source.render()).isEqualTo("answer;\n");
        assertThat(source.markDirty().render()).isEqualTo("answer;\n");
    }

    // === Lazy bodies ===

    @Test
    void analyzeBody_fillsOnlyTheRequestedBlock() {
        var file = Programs.calculator("calc.ts");
        var analyzer = analyzer(file, SHALLOW);
        var source = analyzer.analyze();
        var function = find(source, FunctionDeclaration.class);

        analyzer.analyzeBody(function);

        assertThat(function.elements())
            .extracting(CodeNode::render)
            .containsExactly("\n    ", "return a + b", "\n");
        assertThat(function.elements().get(1)).isInstanceOf(UnaryOperation.class);
        assertThat(find(source, VariableDeclaration.class).canAnalyzeBody()).isTrue();
    }

    @Test
    void analyzeBody_secondCall_keepsElements() {
        var file = Programs.calculator("calc.ts");
        var analyzer = analyzer(file, SHALLOW);
        var function = find(analyzer.analyze(), FunctionDeclaration.class);

        analyzer.analyzeBody(function);
        var statement = function.elements().get(1);
        analyzer.analyzeBody(function);

        assertThat(function.elements()).hasSize(3);
        assertThat(function.elements().get(1)).isSameAs(statement);
    }

    @Test
    void analyzeBody_byAnotherAnalyzerOverSameFile_works() {
        var file = Programs.point("point.ts");
        var source = new Source(file.fileName());
        new SourceAnalyzer(file, source, SHALLOW).analyze();
        var declaration = find(source, ClassDeclaration.class);

        new SourceAnalyzer(file, source, SHALLOW).analyzeBody(declaration);

        assertThat(declaration.elements())
            .extracting(node -> node.getClass().getSimpleName())
            .containsExactly("Trivia", "Property", "Trivia", "FunctionDeclaration", "Trivia");
        assertThat(find(declaration, FunctionDeclaration.class).canAnalyzeBody()).isTrue();
    }

    @Test
    void analyzeBody_source_analyzesRoot() {
        var file = Programs.calculator("calc.ts");
        var analyzer = analyzer(file, SHALLOW);

        analyzer.analyzeBody(analyzer.source());

        assertThat(analyzer.source().isBodyAnalyzed()).isTrue();
    }

    @Test
    void analyzeBody_blockWithoutOrigin_fails() {
        var analyzer = analyzer(Programs.calculator("calc.ts"), SHALLOW);

        assertThatThrownBy(() -> analyzer.analyzeBody(new CodeBlock()))
            .isInstanceOfSatisfying(AnalysisException.class, e -> {
                assertThat(e.isRecoverable()).isFalse();
                assertThat(e.error()).isInstanceOf(AnalysisError.MalformedReference.class);
                assertThat(e.getMessage()).contains("origin element of CodeBlock");
            });
    }

    @Test
    void analyzeBody_switchThenCase_expandsStepByStep() {
        var file = Programs.dispatch("dispatch.ts");
        var analyzer = analyzer(file, SHALLOW);
        var statement = find(analyzer.analyze(), Switch.class);

        analyzer.analyzeBody(statement);
        var clause = find(statement, Case.class);

        assertThat(clause.canAnalyzeBody()).isTrue();
        assertThat(clause.render()).isEqualTo("case 1:\n        go();\n        break;");

        analyzer.analyzeBody(clause);

        assertThat(clause.elements())
            .extracting(CodeNode::render)
            .containsExactly("\n        ", "go()", "\n        ", "break");
    }

    // === Recursive analysis ===

    @Test
    void analyze_recursive_expandsEveryBlock() {
        var file = Programs.point("point.ts");

        var source = analyzer(file, RECURSIVE).analyze();
        var method = find(source, FunctionDeclaration.class);

        assertThat(method.isBodyAnalyzed()).isTrue();
        assertThat(method.isMethod()).isTrue();
        assertThat(find(source, ClassDeclaration.class).parentClass().render()).isEqualTo("Base");
    }

    @Test
    void analyze_recursiveAfterShallow_expandsPendingBlocks() {
        var file = Programs.calculator("calc.ts");
        var source = new Source(file.fileName());
        new SourceAnalyzer(file, source, SHALLOW).analyze();

        new SourceAnalyzer(file, source, RECURSIVE).analyze();

        assertThat(find(source, FunctionDeclaration.class).isBodyAnalyzed()).isTrue();
        assertThat(find(source, VariableDeclaration.class).isBodyAnalyzed()).isTrue();
        assertThat(source.render()).isEqualTo(Programs.CALCULATOR);
    }

    @Test
    void rebuildFromFields_reproducesSource() {
        assertRebuilds(Programs.calculator("calc.ts"), Programs.CALCULATOR);
        assertRebuilds(Programs.point("point.ts"), Programs.POINT);
        assertRebuilds(Programs.dispatch("dispatch.ts"), Programs.DISPATCH);
    }

    private static void assertRebuilds(SourceFile file, String text) {
        var source = analyzer(file, RECURSIVE).analyze();

        source.markDirty(true);

        assertThat(source.render()).isEqualTo(text);
    }

    // === Editing ===

    @Test
    void edit_recursiveMarkDirty_showsChange() {
        var file = Programs.calculator("calc.ts");
        var source = analyzer(file, RECURSIVE).analyze();

        var sum = source.findChild(node -> node instanceof BinaryOperation operation && operation.operator().equals("+"))
                        .map(BinaryOperation.class::cast)
                        .orElseThrow();
        sum.setOperator("-");
        source.markDirty(true);

        assertThat(source.render()).isEqualTo(Programs.CALCULATOR.replace("a + b", "a - b"));
    }

    @Test
    void edit_onlyMarkedNodesRebuild() {
        var file = Programs.calculator("calc.ts");
        var source = analyzer(file, RECURSIVE).analyze();
        var declaration = find(source, VariableDeclaration.class);
        var total = find(declaration, Property.class);

        total.setInitializer(AtomicValue.of(10));
        total.markDirty();
        source.markDirty();

        assertThat(source.render()).isEqualTo(Programs.CALCULATOR);

        declaration.markDirty();
        source.markDirty();

        assertThat(source.render()).isEqualTo(Programs.CALCULATOR.replace("let total = 0", "let total = 10"));
    }

    @Test
    void edit_untouchedSiblingsKeepLiteralText() {
        var file = Programs.calculator("calc.ts");
        var source = analyzer(file, SHALLOW).analyze();

        source.elements().set(0, new Trivia("/* rewritten */\n"));
        source.markDirty();

        assertThat(source.render()).isEqualTo(Programs.CALCULATOR.replace("// math helpers", "/* rewritten */"));
    }

    @Test
    void edit_renameIdentifierInLazyBody() {
        var file = Programs.point("point.ts");
        var analyzer = analyzer(file, SHALLOW);
        var source = analyzer.analyze();
        var declaration = analyzer.analyzeBody(find(source, ClassDeclaration.class));
        var method = analyzer.analyzeBody(find(declaration, FunctionDeclaration.class));

        var dx = method.findChild(node -> node instanceof Identifier identifier && identifier.token().equals("dx"))
                       .map(Identifier.class::cast)
                       .orElseThrow();
        dx.setToken("delta");
        source.markDirty(true);

        assertThat(source.render()).isEqualTo(Programs.POINT.replace("this.x += dx", "this.x += delta"));
    }

    // === Tree shape ===

    @Test
    void walkChildren_visitsEveryNodeOnce() {
        for (var file : List.of(Programs.calculator("calc.ts"), Programs.point("point.ts"), Programs.dispatch("dispatch.ts"))) {
            var source = analyzer(file, RECURSIVE).analyze();
            var visited = new ArrayList<CodeNode>();
            var unique = Collections.newSetFromMap(new IdentityHashMap<CodeNode, Boolean>());

            source.walkChildren(node -> {
                visited.add(node);
                unique.add(node);
            }, true);

            assertThat(unique).as(file.fileName()).hasSize(visited.size());
            for (var node : visited) {
                assertThat(node.children()).as(file.fileName())
                                           .allSatisfy(child -> assertThat(unique.contains(child)).isTrue());
            }
        }
    }

    // === Fallback ===

    @Test
    void lenient_untranslatableStatement_keptAsOpaque() {
        var file = Programs.async("async.ts");

        var source = analyzer(file, RECURSIVE).analyze();
        var opaque = find(source, Opaque.class);

        assertThat(opaque.render()).isEqualTo("await load();");
        assertThat(opaque.origin())
            .hasValueSatisfying(element -> assertThat(element.kind()).isEqualTo(SyntaxKind.EXPRESSION_STATEMENT));

        source.markDirty(true);
        assertThat(source.render()).isEqualTo(Programs.ASYNC);
    }

    @Test
    void strict_untranslatableStatement_failsAndLeavesRootPristine() {
        var file = Programs.async("async.ts");
        var analyzer = analyzer(file, STRICT);

        assertThatThrownBy(analyzer::analyze)
            .isInstanceOfSatisfying(AnalysisException.class, e -> {
                assertThat(e.isRecoverable()).isTrue();
                var error = (AnalysisError.UnsupportedConstruct) e.error();
                assertThat(error.kind()).isEqualTo(SyntaxKind.AWAIT_EXPRESSION);
                assertThat(error.text()).isEqualTo("await load()");
            });

        assertThat(analyzer.source().canAnalyzeBody()).isTrue();
        assertThat(analyzer.source().cachedText()).isEmpty();
    }

    @Test
    void strict_untranslatableStatementInBody_leavesFunctionPristine() {
        var file = Programs.awaitingBody("run.ts");
        var source = analyzer(file, STRICT).analyze();
        var function = find(source, FunctionDeclaration.class);

        var strict = new SourceAnalyzer(file, source, STRICT);
        assertThatThrownBy(() -> strict.analyzeBody(function))
            .isInstanceOfSatisfying(AnalysisException.class,
                                    e -> assertThat(((AnalysisError.UnsupportedConstruct) e.error()).kind())
                                        .isEqualTo(SyntaxKind.AWAIT_EXPRESSION));

        assertThat(function.canAnalyzeBody()).isTrue();
        assertThat(function.elements()).isEmpty();
        assertThat(source.render()).isEqualTo(Programs.AWAITING_BODY);
    }

    @Test
    void strict_failedBody_canBeRetriedLeniently() {
        var file = Programs.awaitingBody("run.ts");
        var source = analyzer(file, STRICT).analyze();
        var function = find(source, FunctionDeclaration.class);
        assertThatThrownBy(() -> new SourceAnalyzer(file, source, STRICT).analyzeBody(function))
            .isInstanceOf(AnalysisException.class);

        new SourceAnalyzer(file, source, SHALLOW).analyzeBody(function);

        assertThat(function.isBodyAnalyzed()).isTrue();
        assertThat(function.elements()).hasSize(3);
        assertThat(function.elements().get(1)).isInstanceOf(Opaque.class);
        assertThat(function.elements().get(1).render()).isEqualTo("await load();");
        assertThat(source.render()).isEqualTo(Programs.AWAITING_BODY);
    }

    @Test
    void strictRecursive_untranslatableStatementInBody_leavesRootPristine() {
        var file = Programs.awaitingBody("run.ts");
        var analyzer = analyzer(file, STRICT_RECURSIVE);

        assertThatThrownBy(analyzer::analyze)
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("AWAIT_EXPRESSION");

        assertThat(analyzer.source().canAnalyzeBody()).isTrue();
        assertThat(analyzer.source().elements()).isEmpty();
    }

    @Test
    void strictRecursive_afterShallow_leavesPendingBodyPristine() {
        var file = Programs.awaitingBody("run.ts");
        var source = analyzer(file, STRICT).analyze();
        var elements = List.copyOf(source.elements());

        assertThatThrownBy(() -> new SourceAnalyzer(file, source, STRICT_RECURSIVE).analyze())
            .isInstanceOf(AnalysisException.class);

        var function = find(source, FunctionDeclaration.class);
        assertThat(function.canAnalyzeBody()).isTrue();
        assertThat(function.elements()).isEmpty();
        assertThat(source.elements()).containsExactlyElementsOf(elements);
    }

    @Test
    void malformedHeritage_failsEvenWhenLenient() {
        var file = Programs.brokenHeritage("broken.ts");
        var analyzer = analyzer(file, SHALLOW);

        assertThatThrownBy(analyzer::analyze)
            .isInstanceOfSatisfying(AnalysisException.class, e -> {
                assertThat(e.isRecoverable()).isFalse();
                assertThat(e.error()).isEqualTo(new AnalysisError.MalformedReference(SyntaxKind.HERITAGE_CLAUSE,
                                                                                     "extends",
                                                                                     "TYPES"));
            });
        assertThat(analyzer.source().canAnalyzeBody()).isTrue();
    }
}
