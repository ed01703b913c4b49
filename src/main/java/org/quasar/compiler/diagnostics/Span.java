package org.quasar.compiler.diagnostics;

/**
 * A range in the source code, used by tokens, AST nodes and diagnostics.
 * Lines and columns are 1-indexed; the end column is inclusive.
 *
 * @param startLine   The line of the first character.
 * @param startColumn The column of the first character.
 * @param endLine     The line of the last character.
 * @param endColumn   The column of the last character.
 * @param sourceId    The logical name of the source (file name or {@code <stdin>}).
 */
public record Span(int startLine, int startColumn, int endLine, int endColumn, String sourceId) {

    /**
     * Creates a span that covers a single character.
     * @param line The line number.
     * @param column The column number.
     * @param sourceId The logical source name.
     * @return A span of length one.
     */
    public static Span at(int line, int column, String sourceId) {
        return new Span(line, column, line, column, sourceId);
    }

    /**
     * Returns the smallest span covering both given spans.
     * @param first The first span.
     * @param second The second span.
     * @return The union of both spans, tagged with the source of {@code first}.
     */
    public static Span merge(Span first, Span second) {
        boolean firstStartsEarlier = compare(first.startLine, first.startColumn, second.startLine, second.startColumn) <= 0;
        boolean firstEndsLater = compare(first.endLine, first.endColumn, second.endLine, second.endColumn) >= 0;
        return new Span(
                firstStartsEarlier ? first.startLine : second.startLine,
                firstStartsEarlier ? first.startColumn : second.startColumn,
                firstEndsLater ? first.endLine : second.endLine,
                firstEndsLater ? first.endColumn : second.endColumn,
                first.sourceId);
    }

    /**
     * Checks whether this span fully contains the other one.
     * @param other The span to test.
     * @return {@code true} if {@code other} starts at or after this span's start and ends at or before its end.
     */
    public boolean contains(Span other) {
        return compare(startLine, startColumn, other.startLine, other.startColumn) <= 0
                && compare(endLine, endColumn, other.endLine, other.endColumn) >= 0;
    }

    private static int compare(int lineA, int columnA, int lineB, int columnB) {
        if (lineA != lineB) return Integer.compare(lineA, lineB);
        return Integer.compare(columnA, columnB);
    }

    @Override
    public String toString() {
        return sourceId + ":" + startLine + ":" + startColumn;
    }
}
