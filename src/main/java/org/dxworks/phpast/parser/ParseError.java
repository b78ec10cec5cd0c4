package org.dxworks.phpast.parser;

import java.util.Objects;

public class ParseError {
    public final String message;
    public final int line;
    public final int column;

    public ParseError(String message, int line, int column) {
        this.message = message;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseError)) return false;
        ParseError that = (ParseError) o;
        return line == that.line && column == that.column && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, line, column);
    }

    @Override
    public String toString() {
        return message + " on line " + line;
    }
}
