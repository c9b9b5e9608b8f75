package com.example.xlsxtpl.grid;

/**
 * Mutable two-dimensional cell grid the expansion engines operate on.
 *
 * All positions are 1-based. Row mutations never change column indices and
 * column mutations never change row indices.
 */
public interface Grid {

    /**
     * Highest row holding a cell, 0 for an empty grid.
     */
    int getMaxRow();

    /**
     * Highest column holding a cell in any row, 0 for an empty grid.
     */
    int getMaxColumn();

    /**
     * @return a String, Double, Boolean or LocalDateTime, or null for an empty cell
     */
    Object getValue(int row, int column);

    /**
     * Stores a value keeping the cell's style. Null clears the value.
     */
    void setValue(int row, int column, Object value);

    /**
     * Inserts {@code count} empty rows so the current row {@code at} moves to {@code at + count}.
     */
    void insertRows(int at, int count);

    void deleteRows(int at, int count);

    void insertColumns(int at, int count);

    void deleteColumns(int at, int count);

    /**
     * Copies height, visibility and outline level.
     */
    void copyRowMetadata(int sourceRow, int targetRow);

    /**
     * Copies width and visibility.
     */
    void copyColumnMetadata(int sourceColumn, int targetColumn);

    /**
     * Copies value and style verbatim, unrendered tags included.
     */
    void copyCell(int sourceRow, int sourceColumn, int targetRow, int targetColumn);
}
