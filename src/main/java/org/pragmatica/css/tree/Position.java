package org.pragmatica.css.tree;

/**
 * A position in a source file: filename, page (form-feed separated) and line, both 1-based.
 */
public record Position(String filename, int page, int line) {

    public static Position start(String filename) {
        return new Position(filename, 1, 1);
    }

    public static Position at(String filename, int page, int line) {
        return new Position(filename, page, line);
    }

    public Position nextLine() {
        return new Position(filename, page, line + 1);
    }

    public Position nextPage() {
        return new Position(filename, page + 1, 1);
    }

    @Override
    public String toString() {
        return page > 1
               ? filename + "(" + page + "):" + line
               : filename + ":" + line;
    }
}
