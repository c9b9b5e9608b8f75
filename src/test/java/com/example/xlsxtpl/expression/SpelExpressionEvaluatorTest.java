package com.example.xlsxtpl.expression;

import com.example.xlsxtpl.SheetFixtures;
import com.example.xlsxtpl.config.RenderProperties;
import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.core.LoopRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SpelExpressionEvaluatorTest {

    private final SpelExpressionEvaluator evaluator = SheetFixtures.evaluator();

    private final ContextScope scope = ContextScope.of(Map.of(
            "name", "Ada",
            "order", Map.of("total", 42, "customer", Map.of("city", "London")),
            "items", List.of("a", "b", "c"),
            "price", 2,
            "qty", 3,
            "amount", 1234.5,
            "day", LocalDate.of(2024, 1, 31)));

    @Test
    public void testResolvesNamesPathsAndIndexes() {
        assertEquals("Ada", evaluator.evaluate("name", scope));
        assertEquals(42, evaluator.evaluate("order.total", scope));
        assertEquals("London", evaluator.evaluate("order.customer.city", scope));
        assertEquals("b", evaluator.evaluate("items[1]", scope));
        assertEquals("London", evaluator.evaluate("order['customer']['city']", scope));
    }

    @Test
    public void testKeepsNativeTypes() {
        assertEquals(6, evaluator.evaluate("price * qty", scope));
        assertEquals(Boolean.TRUE, evaluator.evaluate("order.total > 40 and name == 'Ada'", scope));
        assertEquals(Boolean.FALSE, evaluator.evaluate("price > qty || qty < 1", scope));
        assertEquals("Hi Ada", evaluator.evaluate("'Hi ' + name", scope));
        assertNull(evaluator.evaluate("null", scope));
    }

    @Test
    public void testReadsBeanGetters() {
        ContextScope withLoop = scope.with("loop", LoopRecord.of(1, 3));
        assertEquals(2, evaluator.evaluate("loop.index", withLoop));
        assertEquals(Boolean.FALSE, evaluator.evaluate("loop.first", withLoop));
        assertEquals(1, evaluator.evaluate("loop.revindex0", withLoop));
    }

    @Test
    public void testStrictUndefinedRaises() {
        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> evaluator.evaluate("missing", scope));
        assertTrue(e.getMessage().contains("missing"));
        assertThrows(ExpressionEvaluationException.class, () -> evaluator.evaluate("order.nothing", scope));
    }

    @Test
    public void testNullBindingIsNotUndefined() {
        Map<String, Object> data = new HashMap<>();
        data.put("note", null);
        assertNull(evaluator.evaluate("note", ContextScope.of(data)));
        assertEquals("none", evaluator.evaluate("note | default('none')", ContextScope.of(data)));
    }

    @Test
    public void testLenientModeYieldsNull() {
        RenderProperties properties = new RenderProperties();
        properties.setStrictUndefined(false);
        SpelExpressionEvaluator lenient = SheetFixtures.evaluator(properties);

        assertNull(lenient.evaluate("missing", scope));
        assertNull(lenient.evaluate("order.nothing", scope));
        assertEquals("", lenient.render("{{ missing }}", scope));
    }

    @Test
    public void testAppliesFilterChains() {
        assertEquals("ADA", evaluator.evaluate("name | upper", scope));
        assertEquals("1,234.50", evaluator.evaluate("amount | number_format", scope));
        assertEquals("1,234.5", evaluator.evaluate("amount | number_format(1)", scope));
        assertEquals("2024-01-31", evaluator.evaluate("day | date", scope));
        assertEquals("31.01.2024", evaluator.evaluate("day | date('dd.MM.yyyy')", scope));
        assertEquals(3, evaluator.evaluate("items | length", scope));
        assertEquals("ADA!", evaluator.evaluate("(name + '!') | lower | upper", scope));
    }

    @Test
    public void testFiltersBindTighterThanOperators() {
        assertEquals(Boolean.TRUE, evaluator.evaluate("items|length > 1", scope));
        assertEquals("ADA!", evaluator.evaluate("name|upper + '!'", scope));
        assertEquals(30, evaluator.evaluate("items | length * 10", scope));
        assertEquals(Boolean.TRUE, evaluator.evaluate("items|length == 3 and name|lower == 'ada'", scope));
    }

    @Test
    public void testFiltersRespectShortCircuit() {
        Map<String, Object> data = new HashMap<>();
        data.put("note", null);
        assertEquals(Boolean.FALSE, evaluator.evaluate("note != null and note|upper == 'X'", ContextScope.of(data)));
    }

    @Test
    public void testFilterArgumentsAreExpressions() {
        ContextScope withPattern = scope.with("pattern", "yyyy/MM");
        assertEquals("2024/01", evaluator.evaluate("day | date(pattern)", withPattern));
    }

    @Test
    public void testUnknownFilterRaises() {
        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> evaluator.evaluate("name | shout", scope));
        assertEquals("No filter named 'shout'", e.getMessage());
    }

    @Test
    public void testSyntaxErrorRaises() {
        assertThrows(ExpressionEvaluationException.class, () -> evaluator.evaluate("name +", scope));
    }

    @Test
    public void testUnsupportedCharacterIsWrapped() {
        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> evaluator.evaluate("name ~ price", scope));
        assertTrue(e.getMessage().startsWith("Cannot evaluate 'name ~ price': "), e.getMessage());
    }

    @Test
    public void testRenderSubstitutesEveryTag() {
        assertEquals("Hello Ada, total 42", evaluator.render("Hello {{ name }}, total {{ order.total }}", scope));
        assertEquals("Order: ", evaluator.render("Order: {{ null }}", scope));
        assertEquals("no tags", evaluator.render("no tags", scope));
        assertEquals("[ADA]", evaluator.render("[{{ name | upper }}]", scope));
    }

    @Test
    public void testRenderHonoursWhitespaceControl() {
        assertEquals("aAdab", evaluator.render("a  {{- name -}}  b", scope));
        assertEquals("a Ada b", evaluator.render("a {{ name }} b", scope));
    }

    @Test
    public void testRenderPropagatesErrors() {
        assertThrows(ExpressionEvaluationException.class, () -> evaluator.render("x {{ missing }}", scope));
        assertThrows(ExpressionEvaluationException.class, () -> evaluator.render("x {{ name ~ 1 }}", scope));
    }

    @Test
    public void testRenderInlineConditionals() {
        ContextScope on = scope.with("ok", true);
        ContextScope off = scope.with("ok", false);
        String template = "Status: {% if ok %}yes{% else %}no{% endif %}";
        assertEquals("Status: yes", evaluator.render(template, on));
        assertEquals("Status: no", evaluator.render(template, off));

        String graded = "{% if price > 5 %}high{% elif price > 1 %}mid{% else %}low{% endif %}";
        assertEquals("mid", evaluator.render(graded, scope));
        assertEquals("[]", evaluator.render("[{% if ok %}{{ name }}{% endif %}]", off));
    }

    @Test
    public void testRenderInlineLoops() {
        assertEquals("a, b, c", evaluator.render(
                "{% for i in items %}{{ i }}{% if not loop.last %}, {% endif %}{% endfor %}", scope));
        assertEquals("none", evaluator.render(
                "{% for i in nothing %}{{ i }}{% else %}none{% endfor %}", scope.with("nothing", List.of())));
        assertEquals("Ada", evaluator.render("{% for i in items %}{% endfor %}{{ name }}", scope));
    }

    @Test
    public void testRenderTrimsAroundStatementTags() {
        assertEquals("ab", evaluator.render("a {%- if true -%} b {%- endif %}", scope));
    }

    @Test
    public void testRenderRejectsUnbalancedInlineTags() {
        assertThrows(ExpressionEvaluationException.class, () -> evaluator.render("{% if true %}open", scope));
        assertThrows(ExpressionEvaluationException.class, () -> evaluator.render("text {% endif %}", scope));
        assertThrows(ExpressionEvaluationException.class, () -> evaluator.render("{% while true %}x", scope));
        assertThrows(ExpressionEvaluationException.class,
                () -> evaluator.render("{% for i in items %}x{% endif %}", scope));
    }
}
