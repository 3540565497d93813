package com.splitttr.workspace.model;

/** Zero-based line/column location inside a file. */
public record Position(int line, int column) {

    public Position withColumn(int newColumn) {
        return new Position(line, newColumn);
    }
}
