package org.lite.telemetry.model;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loosely-typed upstream record. Field names and casing are not stable between upstream
 * versions, so values are only reachable through typed accessors that take an alias list in
 * priority order. The first alias whose value is present, non-null, non-blank and coercible
 * to the requested type wins; otherwise the supplied default is returned. No accessor throws.
 *
 * <p>An alias containing dots ({@code status.code}) is resolved through nested objects when
 * no field with the literal name exists.
 */
public final class RawRecord {

    private static final RawRecord EMPTY = new RawRecord(Collections.emptyMap());

    private final Map<String, Object> fields;

    private RawRecord(Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * Wraps a decoded JSON value. Anything other than an object yields the empty record.
     */
    @SuppressWarnings("unchecked")
    public static RawRecord of(Object source) {
        if (source instanceof RawRecord record) {
            return record;
        }
        if (source instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) map).forEach((k, v) -> {
                if (k != null) {
                    copy.put(String.valueOf(k), v);
                }
            });
            return new RawRecord(Collections.unmodifiableMap(copy));
        }
        return EMPTY;
    }

    public static RawRecord empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    /**
     * True if any alias resolves to a non-null value.
     */
    public boolean has(String... aliases) {
        for (String alias : aliases) {
            if (lookup(alias) != null) {
                return true;
            }
        }
        return false;
    }

    public String text(String defaultValue, String... aliases) {
        return first(RawRecord::asText, aliases).orElse(defaultValue);
    }

    public String optionalText(String... aliases) {
        return first(RawRecord::asText, aliases).orElse(null);
    }

    public long longValue(long defaultValue, String... aliases) {
        return first(RawRecord::asLong, aliases).orElse(defaultValue);
    }

    public Long optionalLong(String... aliases) {
        return first(RawRecord::asLong, aliases).orElse(null);
    }

    public int intValue(int defaultValue, String... aliases) {
        return first(RawRecord::asLong, aliases).map(Long::intValue).orElse(defaultValue);
    }

    public Integer optionalInt(String... aliases) {
        return first(RawRecord::asLong, aliases).map(Long::intValue).orElse(null);
    }

    public double doubleValue(double defaultValue, String... aliases) {
        return first(RawRecord::asDouble, aliases).orElse(defaultValue);
    }

    public Double optionalDouble(String... aliases) {
        return first(RawRecord::asDouble, aliases).orElse(null);
    }

    public boolean bool(boolean defaultValue, String... aliases) {
        return first(RawRecord::asBoolean, aliases).orElse(defaultValue);
    }

    /**
     * Accepts ISO-8601 strings (with or without offset) and epoch milliseconds.
     */
    public Instant instant(String... aliases) {
        return first(RawRecord::asInstant, aliases).orElse(null);
    }

    public RawRecord record(String... aliases) {
        return first(v -> v instanceof Map<?, ?> ? RawRecord.of(v) : null, aliases).orElse(EMPTY);
    }

    /**
     * The first alias holding a list; non-object elements of that list are skipped.
     */
    public List<RawRecord> records(String... aliases) {
        return first(RawRecord::asRecordList, aliases).orElse(Collections.emptyList());
    }

    /**
     * Reads a key/value map that upstreams ship either as an object or as an array of
     * {@code {key|tagName|name, value|tagValue}} entries.
     */
    public Map<String, String> stringMap(String... aliases) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String alias : aliases) {
            Object value = lookup(alias);
            if (value instanceof Map<?, ?> map) {
                map.forEach((k, v) -> {
                    if (k != null && v != null) {
                        result.put(String.valueOf(k), String.valueOf(v));
                    }
                });
                return result;
            }
            if (value instanceof List<?> list) {
                for (Object element : list) {
                    RawRecord entry = RawRecord.of(element);
                    String key = entry.optionalText("key", "tagName", "name");
                    String entryValue = entry.optionalText("value", "tagValue");
                    if (key != null && entryValue != null) {
                        result.put(key, entryValue);
                    }
                }
                return result;
            }
        }
        return result;
    }

    private <T> Optional<T> first(Function<Object, T> coercion, String... aliases) {
        for (String alias : aliases) {
            Object raw = lookup(alias);
            if (raw == null) {
                continue;
            }
            T coerced = coercion.apply(raw);
            if (coerced != null) {
                return Optional.of(coerced);
            }
        }
        return Optional.empty();
    }

    private Object lookup(String alias) {
        if (fields.containsKey(alias)) {
            return fields.get(alias);
        }
        int dot = alias.indexOf('.');
        if (dot <= 0 || dot == alias.length() - 1) {
            return null;
        }
        Object parent = fields.get(alias.substring(0, dot));
        if (parent instanceof Map<?, ?>) {
            return RawRecord.of(parent).lookup(alias.substring(dot + 1));
        }
        return null;
    }

    private static String asText(Object value) {
        if (value instanceof String s) {
            String trimmed = s.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }

    private static Long asLong(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? n.longValue() : null;
        }
        if (value instanceof String s) {
            Double parsed = parseDouble(s);
            return parsed != null ? parsed.longValue() : null;
        }
        return null;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof String s) {
            return parseDouble(s);
        }
        return null;
    }

    private static Boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("yes") || normalized.equals("1")) return true;
            if (normalized.equals("false") || normalized.equals("no") || normalized.equals("0")) return false;
        }
        return null;
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (!(value instanceof String s) || s.isBlank()) {
            return null;
        }
        String text = s.trim();
        Instant parsed = parseIsoInstant(text);
        if (parsed == null) {
            parsed = parseOffsetDateTime(text);
        }
        if (parsed == null) {
            Double epochMillis = parseDouble(text);
            parsed = epochMillis != null ? Instant.ofEpochMilli(epochMillis.longValue()) : null;
        }
        return parsed;
    }

    private static Instant parseIsoInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseOffsetDateTime(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static List<RawRecord> asRecordList(Object value) {
        if (!(value instanceof List<?> list)) {
            return null;
        }
        List<RawRecord> records = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element instanceof Map<?, ?>) {
                records.add(RawRecord.of(element));
            }
        }
        return Collections.unmodifiableList(records);
    }

    private static Double parseDouble(String s) {
        try {
            double d = Double.parseDouble(s.trim());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "RawRecord" + fields;
    }
}
