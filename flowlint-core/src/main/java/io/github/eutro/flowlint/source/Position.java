package io.github.eutro.flowlint.source;

import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.Objects;

/**
 * A position in a source file. Positions are ordered by file, then line, then column.
 */
public final class Position implements Comparable<Position> {
    private static final Comparator<Position> ORDER = Comparator
            .comparing(Position::getFile)
            .thenComparingInt(Position::getLine)
            .thenComparingInt(Position::getColumn);

    /**
     * The position of synthesised code, which has no source.
     */
    public static final Position NONE = new Position("", 0, 0);

    private final String file;
    private final int line;
    private final int column;

    private Position(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    /**
     * Get a position.
     *
     * @param file   The file identifier.
     * @param line   The line, starting at 1.
     * @param column The column, starting at 1.
     * @return The position.
     */
    public static Position of(String file, int line, int column) {
        return new Position(Objects.requireNonNull(file, "file"), line, column);
    }

    /**
     * Get the position of the start of a file.
     *
     * @param file The file identifier.
     * @return The position.
     */
    public static Position ofFile(String file) {
        return of(file, 0, 0);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Whether this position comes strictly after another in the same file.
     *
     * @param other The other position.
     * @return Whether this is after {@code other}.
     */
    public boolean isAfter(Position other) {
        return file.equals(other.file) && compareTo(other) > 0;
    }

    @Override
    public int compareTo(@NotNull Position o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position that = (Position) o;
        return line == that.line && column == that.column && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
