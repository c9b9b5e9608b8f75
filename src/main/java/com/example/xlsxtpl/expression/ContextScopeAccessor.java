package com.example.xlsxtpl.expression;

import com.example.xlsxtpl.core.ContextScope;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypedValue;

/**
 * Resolves bare names of an expression against the {@link ContextScope} used as
 * root object. In strict mode a name no layer binds is not readable, which makes
 * the evaluation fail; otherwise it reads as null.
 */
class ContextScopeAccessor implements PropertyAccessor {

    private final boolean strict;

    ContextScopeAccessor(boolean strict) {
        this.strict = strict;
    }

    @Override
    public Class<?>[] getSpecificTargetClasses() {
        return new Class<?>[] {ContextScope.class};
    }

    @Override
    public boolean canRead(EvaluationContext context, Object target, String name) throws AccessException {
        return target instanceof ContextScope && (!strict || ((ContextScope) target).contains(name));
    }

    @Override
    public TypedValue read(EvaluationContext context, Object target, String name) throws AccessException {
        ContextScope scope = (ContextScope) target;
        if (strict && !scope.contains(name)) {
            throw new AccessException("'" + name + "' is undefined");
        }
        Object value = scope.get(name);
        return value == null ? TypedValue.NULL : new TypedValue(value);
    }

    @Override
    public boolean canWrite(EvaluationContext context, Object target, String name) {
        return false;
    }

    @Override
    public void write(EvaluationContext context, Object target, String name, Object newValue) throws AccessException {
        throw new AccessException("Template context is read-only");
    }
}
