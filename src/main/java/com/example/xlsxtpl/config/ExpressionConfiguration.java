package com.example.xlsxtpl.config;

import com.example.xlsxtpl.expression.ExpressionEvaluator;
import com.example.xlsxtpl.expression.FilterRegistry;
import com.example.xlsxtpl.expression.SpelExpressionEvaluator;
import com.example.xlsxtpl.expression.StandardFilters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the expression layer. Applications add their own filters by
 * registering them on the {@link FilterRegistry} bean.
 */
@Configuration
public class ExpressionConfiguration {

    @Bean
    public FilterRegistry filterRegistry(RenderProperties renderProperties) {
        return StandardFilters.registerAll(new FilterRegistry(), renderProperties);
    }

    @Bean
    public ExpressionEvaluator expressionEvaluator(RenderProperties renderProperties, FilterRegistry filterRegistry) {
        return new SpelExpressionEvaluator(renderProperties, filterRegistry);
    }
}
