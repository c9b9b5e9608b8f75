package com.example.xlsxtpl.expression;

import com.example.xlsxtpl.config.RenderProperties;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Calendar;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in filters: date and number formatting, case transforms and a few
 * conversions.
 */
public final class StandardFilters {

    private StandardFilters() {
    }

    public static FilterRegistry registerAll(FilterRegistry registry, RenderProperties properties) {
        String defaultDatePattern = properties.getDateFormat();
        int defaultDecimals = properties.getNumberDecimals();
        String defaultSeparator = properties.getThousandsSeparator();

        registry.register("date", (value, args) -> formatDate(value, stringArg(args, 0, defaultDatePattern)));
        registry.register("number_format", (value, args) ->
                formatNumber(value, intArg(args, 0, defaultDecimals), stringArg(args, 1, defaultSeparator)));
        registry.register("upper", (value, args) -> text(value).toUpperCase(Locale.ROOT));
        registry.register("lower", (value, args) -> text(value).toLowerCase(Locale.ROOT));
        registry.register("title", (value, args) -> title(text(value)));
        registry.register("capitalize", (value, args) -> capitalize(text(value)));
        registry.register("trim", (value, args) -> text(value).trim());
        registry.register("string", (value, args) -> text(value));
        registry.register("round", (value, args) -> round(value, intArg(args, 0, 0)));
        registry.register("int", (value, args) -> toLong(value));
        registry.register("float", (value, args) -> toDouble(value));
        registry.register("length", (value, args) -> length(value));
        registry.register("default", (value, args) -> value != null ? value : (args.isEmpty() ? "" : args.get(0)));
        return registry;
    }

    static String formatDate(Object value, String pattern) {
        TemporalAccessor temporal = toTemporal(value);
        if (temporal == null) {
            return text(value);
        }
        try {
            return DateTimeFormatter.ofPattern(pattern).format(temporal);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ExpressionEvaluationException("Cannot format " + value + " with pattern '" + pattern + "'", e);
        }
    }

    private static TemporalAccessor toTemporal(Object value) {
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneId.systemDefault());
        }
        if (value instanceof TemporalAccessor) {
            return (TemporalAccessor) value;
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneId.systemDefault());
        }
        if (value instanceof Calendar) {
            return LocalDateTime.ofInstant(((Calendar) value).toInstant(), ZoneId.systemDefault());
        }
        return null;
    }

    static String formatNumber(Object value, int decimals, String separator) {
        BigDecimal exact = toBigDecimal(value);
        if (exact == null) {
            return text(value);
        }
        BigDecimal scaled = exact.setScale(decimals, RoundingMode.HALF_EVEN);
        String grouped = String.format(Locale.ROOT, "%,." + decimals + "f", scaled);
        return ",".equals(separator) ? grouped : grouped.replace(",", separator == null ? "" : separator);
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? new BigDecimal(d) : null;
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        return null;
    }

    static Object round(Object value, int precision) {
        if (!(value instanceof Number)) {
            throw new ExpressionEvaluationException("round expects a number but got " + describe(value));
        }
        double d = ((Number) value).doubleValue();
        if (!Double.isFinite(d)) {
            return d;
        }
        return BigDecimal.valueOf(d).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1L : 0L;
        }
        if (value instanceof CharSequence) {
            String s = value.toString().trim();
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                try {
                    return (long) Double.parseDouble(s);
                } catch (NumberFormatException ignored) {
                    return 0L;
                }
            }
        }
        return 0L;
    }

    static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        if (value instanceof CharSequence) {
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    static int length(Object value) {
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new ExpressionEvaluationException("length expects a string, collection, map or array but got " + describe(value));
    }

    static String title(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = true;
            }
        }
        return out.toString();
    }

    static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static String stringArg(List<Object> args, int index, String fallback) {
        if (args.size() <= index || args.get(index) == null) {
            return fallback;
        }
        return args.get(index).toString();
    }

    private static int intArg(List<Object> args, int index, int fallback) {
        if (args.size() <= index || args.get(index) == null) {
            return fallback;
        }
        Object arg = args.get(index);
        if (arg instanceof Number) {
            return ((Number) arg).intValue();
        }
        try {
            return Integer.parseInt(arg.toString().trim());
        } catch (NumberFormatException e) {
            throw new ExpressionEvaluationException("Expected an integer argument but got '" + arg + "'", e);
        }
    }
}
