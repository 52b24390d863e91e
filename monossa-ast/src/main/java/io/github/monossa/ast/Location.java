package io.github.monossa.ast;

import java.util.Objects;

/**
 * A position in a source file.
 */
public final class Location {
    public static final Location UNKNOWN = new Location("<unknown>", 0, 0);

    public final String file;
    public final int line;
    public final int column;

    public Location(String file, int line, int column) {
        this.file = Objects.requireNonNull(file);
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location that = (Location) o;
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
