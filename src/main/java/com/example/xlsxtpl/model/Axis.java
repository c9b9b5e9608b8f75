package com.example.xlsxtpl.model;

/**
 * Grid dimension a block directive applies to.
 */
public enum Axis {
    ROW("row", "{%"),
    COLUMN("column", "{%col");

    private final String label;
    private final String opening;

    Axis(String label, String opening) {
        this.label = label;
        this.opening = opening;
    }

    /**
     * Lower-case name used in messages ("row", "column").
     */
    public String label() {
        return label;
    }

    /**
     * Tag text for a keyword, e.g. {@code {%col endfor %}}.
     */
    public String tag(String keyword) {
        return opening + " " + keyword + " %}";
    }
}
