package com.example.xlsxtpl.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Rendering options bound from application.yml.
 *
 * Example application.yml:
 *
 * xlsxtpl:
 *   render:
 *     strict-undefined: true
 *     loop-variable: loop
 *     column-loop-alias: col_loop
 *     date-format: yyyy-MM-dd
 *     number-decimals: 2
 *     thousands-separator: ","
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "xlsxtpl.render")
public class RenderProperties {

    /**
     * Referencing a name that is not bound raises instead of yielding null
     */
    private boolean strictUndefined = true;

    /**
     * Name under which every for-loop publishes its loop record
     */
    private String loopVariable = "loop";

    /**
     * Second name for the loop record of a column loop, so cells inside both a
     * row loop and a column loop can address the two records
     */
    private String columnLoopAlias = "col_loop";

    /**
     * Default pattern of the date filter (java.time pattern letters)
     */
    private String dateFormat = "yyyy-MM-dd";

    /**
     * Default number of decimals of the number_format filter
     */
    private int numberDecimals = 2;

    /**
     * Default grouping separator of the number_format filter; empty disables grouping
     */
    private String thousandsSeparator = ",";
}
