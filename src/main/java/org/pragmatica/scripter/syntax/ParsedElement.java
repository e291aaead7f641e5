package org.pragmatica.scripter.syntax;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable {@link SyntaxElement} over a shared source string.
 *
 * <p>Parser adapters that do not have their own element type can describe their output
 * with this class. Instances are created through {@link #builder(SyntaxKind, String)}.
 */
public final class ParsedElement implements SyntaxElement {
    private final SyntaxKind kind;
    private final String source;
    private final int fullStart;
    private final int start;
    private final int end;
    private final Map<Role, List<SyntaxElement>> children;

    private ParsedElement(SyntaxKind kind, String source, int fullStart, int start, int end,
                          Map<Role, List<SyntaxElement>> children) {
        this.kind = kind;
        this.source = source;
        this.fullStart = fullStart;
        this.start = start;
        this.end = end;
        this.children = children;
    }

    public static Builder builder(SyntaxKind kind, String source) {
        return new Builder(kind, source);
    }

    @Override
    public SyntaxKind kind() {
        return kind;
    }

    @Override
    public int fullStart() {
        return fullStart;
    }

    @Override
    public SourceSpan span() {
        return SourceSpan.of(source, start, end);
    }

    @Override
    public String fullText() {
        return source.substring(fullStart, end);
    }

    @Override
    public String text() {
        return source.substring(start, end);
    }

    @Override
    public String leadingTrivia() {
        return source.substring(fullStart, start);
    }

    @Override
    public List<SyntaxElement> children(Role role) {
        return children.getOrDefault(role, List.of());
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    @Override
    public String toString() {
        return kind + "[" + start + ".." + end + "]";
    }

    public static final class Builder {
        private final SyntaxKind kind;
        private final String source;
        private int fullStart = -1;
        private int start = -1;
        private int end = -1;
        private final Map<Role, List<SyntaxElement>> children = new EnumMap<>(Role.class);

        private Builder(SyntaxKind kind, String source) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.source = Objects.requireNonNull(source, "source");
        }

        /**
         * Set the element range. {@code fullStart <= start <= end} must hold.
         */
        public Builder range(int fullStart, int start, int end) {
            this.fullStart = fullStart;
            this.start = start;
            this.end = end;
            return this;
        }

        public Builder child(Role role, SyntaxElement element) {
            if (element != null) {
                children.computeIfAbsent(role, r -> new ArrayList<>()).add(element);
            }
            return this;
        }

        public Builder children(Role role, List<? extends SyntaxElement> elements) {
            var list = children.computeIfAbsent(role, r -> new ArrayList<>());
            for (var element : elements) {
                list.add(Objects.requireNonNull(element, "element"));
            }
            return this;
        }

        public ParsedElement build() {
            if (fullStart < 0 || fullStart > start || start > end || end > source.length()) {
                throw new IllegalStateException("Invalid range " + fullStart + "/" + start + "/" + end
                                                + " for " + kind + " over text of length " + source.length());
            }
            var frozen = new EnumMap<Role, List<SyntaxElement>>(Role.class);
            children.forEach((role, list) -> frozen.put(role, List.copyOf(list)));
            return new ParsedElement(kind, source, fullStart, start, end, frozen);
        }
    }
}
