package org.pragmatica.scripter.syntax;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Build a span over the {@code [start, end)} offsets of the given text.
     */
    public static SourceSpan of(String text, int start, int end) {
        return new SourceSpan(SourceLocation.of(text, start), SourceLocation.of(text, end));
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public boolean contains(SourceSpan other) {
        return start.offset() <= other.start.offset() && end.offset() >= other.end.offset();
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
