package com.example.xlsxtpl.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Parsed content of a cell holding exactly one block tag.
 *
 * {@code variable} is set for {@code for} only; {@code expression} holds the
 * iterable of a {@code for} or the condition of an {@code if}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Directive {
    DirectiveType type;
    String variable;
    String expression;

    public static Directive forOpen(String variable, String iterable) {
        return new Directive(DirectiveType.FOR, variable, iterable);
    }

    public static Directive forClose() {
        return new Directive(DirectiveType.ENDFOR, null, null);
    }

    public static Directive ifOpen(String condition) {
        return new Directive(DirectiveType.IF, null, condition);
    }

    public static Directive ifClose() {
        return new Directive(DirectiveType.ENDIF, null, null);
    }

    public boolean isOpener() {
        return type.isOpener();
    }
}
