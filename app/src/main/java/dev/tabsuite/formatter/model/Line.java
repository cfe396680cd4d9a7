package dev.tabsuite.formatter.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One physical line of a statement.
 */
public record Line(List<Cell> cells) {

    public Line {
        Objects.requireNonNull(cells, "cells");
        cells = List.copyOf(cells);
    }

    public static Line of(Cell... cells) {
        return new Line(List.of(cells));
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public boolean isContinuation() {
        return !cells.isEmpty() && cells.get(0).isContinuation();
    }

    public List<Cell> dataCells() {
        List<Cell> data = new ArrayList<>();
        for (Cell cell : cells) {
            if (cell.isData()) {
                data.add(cell);
            }
        }
        return data;
    }

    public List<Cell> comments() {
        List<Cell> comments = new ArrayList<>();
        for (Cell cell : cells) {
            if (cell.isComment()) {
                comments.add(cell);
            }
        }
        return comments;
    }

    /**
     * Cells with comments removed, keeping a leading continuation marker.
     */
    public List<Cell> withoutComments() {
        List<Cell> result = new ArrayList<>();
        for (Cell cell : cells) {
            if (!cell.isComment()) {
                result.add(cell);
            }
        }
        return result;
    }
}
