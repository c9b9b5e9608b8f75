package com.example.xlsxtpl.model;

public enum DirectiveType {
    FOR("for"),
    ENDFOR("endfor"),
    IF("if"),
    ENDIF("endif");

    private final String keyword;

    DirectiveType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isOpener() {
        return this == FOR || this == IF;
    }

    /**
     * Closing type expected for this opener.
     */
    public DirectiveType closer() {
        switch (this) {
            case FOR:
                return ENDFOR;
            case IF:
                return ENDIF;
            default:
                throw new IllegalStateException(this + " is not an opening directive");
        }
    }
}
