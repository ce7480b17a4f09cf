package org.buildlens.obs;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Compact JSON writer for plain maps, collections, strings, numbers and booleans.
 *
 * <p>Map entries are written in iteration order, so callers pass {@link java.util.LinkedHashMap}
 * or {@link java.util.TreeMap} when the output must be stable.
 */
public final class JsonEncoder {
    private JsonEncoder() {
    }

    public static String encode(Object value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value);
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
            return;
        }
        if (value instanceof String s) {
            appendString(sb, s);
            return;
        }
        if (value instanceof Double d) {
            appendDouble(sb, d);
            return;
        }
        if (value instanceof Float f) {
            appendDouble(sb, f.doubleValue());
            return;
        }
        if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
            return;
        }
        if (value instanceof Enum<?> e) {
            appendString(sb, e.name());
            return;
        }
        if (value instanceof Instant instant) {
            appendString(sb, instant.toString());
            return;
        }
        if (value instanceof Map<?, ?> map) {
            appendObject(sb, map);
            return;
        }
        if (value instanceof Collection<?> collection) {
            appendArray(sb, collection);
            return;
        }
        appendString(sb, String.valueOf(value));
    }

    private static void appendDouble(StringBuilder sb, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            sb.append("null");
        } else if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            sb.append((long) value).append(".0");
        } else {
            sb.append(value);
        }
    }

    private static void appendObject(StringBuilder sb, Map<?, ?> map) {
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            appendString(sb, String.valueOf(entry.getKey()));
            sb.append(':');
            appendValue(sb, entry.getValue());
        }
        sb.append('}');
    }

    private static void appendArray(StringBuilder sb, Collection<?> items) {
        sb.append('[');
        boolean first = true;
        for (Object item : items) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            appendValue(sb, item);
        }
        sb.append(']');
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c <= 0x1F) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
