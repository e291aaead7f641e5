package org.pragmatica.scripter.syntax;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceSetTest {

    @Test
    void sourceFile_nonRootElement_isRejected() {
        var identifier = ParsedElement.builder(SyntaxKind.IDENTIFIER, "x").range(0, 0, 1).build();

        assertThatThrownBy(() -> new SourceFile("a.ts", identifier))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("SOURCE_FILE");
    }

    @Test
    void sourceFile_nameIsNormalized() {
        var file = new SyntaxFixture("x;\n").file("src/./util/../main.ts");

        assertThat(file.fileName()).isEqualTo("src/main.ts");
        assertThat(file.text()).isEqualTo("x;\n");
    }

    @Test
    void sourceFile_lookupWithEquivalentPath_findsFile() {
        var file = new SyntaxFixture("x;\n").file("src/main.ts");
        var set = SourceSet.of(file);

        assertThat(set.sourceFile("src/lib/../main.ts")).containsSame(file);
        assertThat(set.sourceFile("./src/main.ts")).containsSame(file);
        assertThat(set.sourceFile("src/other.ts")).isEmpty();
        assertThat(set.sourceFile(null)).isEmpty();
    }

    @Test
    void add_sameName_replacesFile() {
        var first = new SyntaxFixture("a;\n").file("main.ts");
        var second = new SyntaxFixture("b;\n").file("./main.ts");

        var set = SourceSet.of(first).add(second);

        assertThat(set.sourceFiles()).containsExactly(second);
    }

    @Test
    void sourceFiles_keepInsertionOrder() {
        var b = new SyntaxFixture("b;\n").file("b.ts");
        var a = new SyntaxFixture("a;\n").file("a.ts");

        assertThat(SourceSet.of(b, a).sourceFiles()).containsExactly(b, a);
    }
}
