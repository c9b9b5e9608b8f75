package com.example.xlsxtpl.parser;

import com.example.xlsxtpl.model.Axis;
import com.example.xlsxtpl.model.Directive;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a cell value into a {@link Directive} when it is a pure block tag of the
 * requested axis. Row tags are spelled {@code {% ... %}}, column tags
 * {@code {%col ... %}}, so the two scanners never pick up each other's tags.
 */
public class DirectiveParser {

    private static final Pattern FOR = Pattern.compile("^for\\s+(\\w+)\\s+in\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern ENDFOR = Pattern.compile("^endfor$");
    private static final Pattern IF = Pattern.compile("^if\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern ENDIF = Pattern.compile("^endif$");

    /**
     * @return the directive, or empty when the value is not a single recognised
     *     block tag of {@code axis}
     */
    public Optional<Directive> parse(Object cellValue, Axis axis) {
        if (!(cellValue instanceof String)) {
            return Optional.empty();
        }
        Pattern block = axis == Axis.COLUMN ? CellTags.COLUMN_BLOCK : CellTags.ROW_BLOCK;
        Matcher tag = block.matcher((String) cellValue);
        if (!tag.matches()) {
            return Optional.empty();
        }
        return parseInner(tag.group(1).trim());
    }

    private Optional<Directive> parseInner(String inner) {
        Matcher m = FOR.matcher(inner);
        if (m.matches()) {
            return Optional.of(Directive.forOpen(m.group(1), m.group(2).trim()));
        }
        if (ENDFOR.matcher(inner).matches()) {
            return Optional.of(Directive.forClose());
        }
        m = IF.matcher(inner);
        if (m.matches()) {
            return Optional.of(Directive.ifOpen(m.group(1).trim()));
        }
        if (ENDIF.matcher(inner).matches()) {
            return Optional.of(Directive.ifClose());
        }
        return Optional.empty();
    }
}
