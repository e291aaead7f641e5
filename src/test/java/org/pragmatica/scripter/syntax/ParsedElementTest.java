package org.pragmatica.scripter.syntax;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParsedElementTest {

    private static final String TEXT = "let a = 1;\n  // note\n  a++;\n";

    // === Ranges ===

    @Test
    void build_validRange_exposesTextAndTrivia() {
        var element = ParsedElement.builder(SyntaxKind.EXPRESSION_STATEMENT, TEXT)
                                   .range(10, 23, 27)
                                   .build();

        assertThat(element.text()).isEqualTo("a++;");
        assertThat(element.fullText()).isEqualTo("\n  // note\n  a++;");
        assertThat(element.leadingTrivia()).isEqualTo("\n  // note\n  ");
        assertThat(element.fullStart()).isEqualTo(10);
    }

    @Test
    void build_startBeforeFullStart_fails() {
        var builder = ParsedElement.builder(SyntaxKind.IDENTIFIER, TEXT).range(5, 4, 6);

        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Invalid range");
    }

    @Test
    void build_endPastText_fails() {
        var builder = ParsedElement.builder(SyntaxKind.IDENTIFIER, TEXT).range(0, 0, TEXT.length() + 1);

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void build_rangeNotSet_fails() {
        assertThatThrownBy(() -> ParsedElement.builder(SyntaxKind.IDENTIFIER, TEXT).build())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void span_secondLine_reportsLineAndColumn() {
        var element = ParsedElement.builder(SyntaxKind.EXPRESSION_STATEMENT, TEXT)
                                   .range(10, 23, 27)
                                   .build();

        assertThat(element.span().start().line()).isEqualTo(3);
        assertThat(element.span().start().column()).isEqualTo(3);
        assertThat(element.span().length()).isEqualTo(4);
    }

    // === Children ===

    @Test
    void children_absentRole_isEmpty() {
        var element = ParsedElement.builder(SyntaxKind.IDENTIFIER, TEXT).range(0, 4, 5).build();

        assertThat(element.children(Role.STATEMENTS)).isEmpty();
        assertThat(element.child(Role.NAME)).isEmpty();
        assertThat(element.has(Role.NAME)).isFalse();
    }

    @Test
    void children_keepInsertionOrder() {
        var first = ParsedElement.builder(SyntaxKind.IDENTIFIER, TEXT).range(3, 4, 5).build();
        var second = ParsedElement.builder(SyntaxKind.NUMERIC_LITERAL, TEXT).range(7, 8, 9).build();

        var element = ParsedElement.builder(SyntaxKind.VARIABLE_DECLARATION, TEXT)
                                   .range(3, 4, 9)
                                   .child(Role.NAME, first)
                                   .child(Role.NAME, second)
                                   .child(Role.INITIALIZER, null)
                                   .build();

        assertThat(element.children(Role.NAME)).containsExactly(first, second);
        assertThat(element.child(Role.NAME)).contains(first);
        assertThat(element.has(Role.INITIALIZER)).isFalse();
        assertThat(element.is(SyntaxKind.VARIABLE_DECLARATION)).isTrue();
    }

    @Test
    void children_listIsImmutable() {
        var child = ParsedElement.builder(SyntaxKind.IDENTIFIER, TEXT).range(3, 4, 5).build();
        var element = ParsedElement.builder(SyntaxKind.VARIABLE_DECLARATION, TEXT)
                                   .range(3, 4, 9)
                                   .child(Role.NAME, child)
                                   .build();

        assertThatThrownBy(() -> element.children(Role.NAME).add(child))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    // === Locations ===

    @Test
    void location_ofOffset_countsLineBreaks() {
        var location = SourceLocation.of("ab\ncd", 4);

        assertThat(location.line()).isEqualTo(2);
        assertThat(location.column()).isEqualTo(2);
        assertThat(location.offset()).isEqualTo(4);
        assertThat(location.toString()).isEqualTo("2:2");
    }

    @Test
    void location_offsetOutsideText_fails() {
        assertThatThrownBy(() -> SourceLocation.of("ab", 3))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void span_mergeAndContains() {
        var left = SourceSpan.of("abcdef", 1, 3);
        var right = SourceSpan.of("abcdef", 2, 5);
        var merged = left.merge(right);

        assertThat(merged.extract("abcdef")).isEqualTo("bcde");
        assertThat(merged.contains(left)).isTrue();
        assertThat(left.contains(right)).isFalse();
    }
}
