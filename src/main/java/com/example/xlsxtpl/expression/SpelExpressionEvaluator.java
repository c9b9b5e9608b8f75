package com.example.xlsxtpl.expression;

import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.core.ContextScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ExpressionEvaluator} backed by Spring Expression Language.
 *
 * Expressions run against a read-only {@link SimpleEvaluationContext} whose root
 * object is the current {@link ContextScope}, so bare names resolve to template
 * variables, {@code a.b} walks maps and bean getters, and {@code a[0]} indexes
 * lists. Pipe filters are translated into calls of a context function before
 * parsing, see {@link FilterTranslator}.
 */
@Slf4j
public class SpelExpressionEvaluator implements ExpressionEvaluator, TextTemplate.Renderer {

    private static final Method FILTER_FUNCTION = ReflectionUtils.findMethod(SpelExpressionEvaluator.class,
            "applyFilter", FilterRegistry.class, String.class, Object.class, List.class);

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Map<String, Expression> expressions = new ConcurrentHashMap<>();
    private final Map<String, TextTemplate> templates = new ConcurrentHashMap<>();
    private final FilterRegistry filters;
    private final String loopVariable;
    private final PropertyAccessor[] accessors;

    public SpelExpressionEvaluator(RenderProperties properties, FilterRegistry filters) {
        this.filters = filters;
        this.loopVariable = properties.getLoopVariable();
        boolean strict = properties.isStrictUndefined();
        this.accessors = new PropertyAccessor[] {
                new ContextScopeAccessor(strict),
                strict ? new MapAccessor() : new LenientMapAccessor(),
                DataBindingPropertyAccessor.forReadOnlyAccess()
        };
        log.debug("SpEL evaluator ready (strictUndefined={}, filters={})", strict, filters.names());
    }

    @Override
    public Object evaluate(String expression, ContextScope scope) {
        try {
            Expression parsed = expressions.computeIfAbsent(expression,
                    text -> parser.parseExpression(FilterTranslator.translate(text)));
            return parsed.getValue(contextFor(scope));
        } catch (RuntimeException e) {
            ExpressionEvaluationException cause = evaluationCause(e);
            if (cause != null) {
                throw cause;
            }
            throw new ExpressionEvaluationException("Cannot evaluate '" + expression + "': " + e.getMessage(), e);
        }
    }

    /**
     * Renders literals, substitutions and inline {@code if} / {@code for} tags.
     */
    @Override
    public String render(String template, ContextScope scope) {
        return templates.computeIfAbsent(template, TextTemplate::parse).render(this, scope);
    }

    @Override
    public String loopVariable() {
        return loopVariable;
    }

    /**
     * Target of the {@code #filter(...)} calls produced by {@link FilterTranslator}.
     */
    public static Object applyFilter(FilterRegistry registry, String name, Object value, List<Object> arguments) {
        TemplateFilter filter = registry.get(name);
        try {
            return filter.apply(value, arguments == null ? new ArrayList<>() : new ArrayList<>(arguments));
        } catch (ExpressionEvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExpressionEvaluationException("Filter '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    private EvaluationContext contextFor(ContextScope scope) {
        EvaluationContext context = SimpleEvaluationContext.forPropertyAccessors(accessors)
                .withRootObject(scope)
                .build();
        context.setVariable(FilterTranslator.FUNCTION_VARIABLE, FILTER_FUNCTION);
        context.setVariable(FilterTranslator.REGISTRY_VARIABLE, filters);
        return context;
    }

    // filter failures reach us wrapped by SpEL's function invocation
    private static ExpressionEvaluationException evaluationCause(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ExpressionEvaluationException) {
                return (ExpressionEvaluationException) t;
            }
        }
        return null;
    }
}
