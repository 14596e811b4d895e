package tech.metadatastore.database.validation;

import tech.metadatastore.database.exception.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field validators shared by all metadata records.
 *
 * <p>Every method is a pure function: it returns the validated (and, for
 * containers, freshly copied) value or throws {@link ValidationException}.
 * Containers are copied so a record never aliases the caller's mutable state,
 * and their element values are never coerced.
 */
public final class Validators {

    public static final String START_TIME = "start_time";
    public static final String END_TIME = "end_time";

    private Validators() {}

    /**
     * Accepts {@code null} or a string.
     */
    public static String optionalString(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof String str) {
            return str;
        }
        throw ValidationException.wrongType(field, "a string", value);
    }

    /**
     * Accepts a non-empty string only.
     */
    public static String requiredString(Object value, String field) {
        if (value == null) {
            throw ValidationException.missing(field);
        }
        String str = optionalString(value, field);
        if (str.isEmpty()) {
            throw ValidationException.empty(field);
        }
        return str;
    }

    /**
     * Validates a mapping. {@code null} yields a new empty map.
     */
    public static Map<String, Object> dict(Object value, String field) {
        if (value == null) {
            return Collections.unmodifiableMap(new LinkedHashMap<>());
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw ValidationException.wrongType(field, "a mapping", value);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw ValidationException.wrongType(field + " key", "a string", entry.getKey());
            }
            copy.put(key, entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Validates an ordered sequence (any {@link Collection}).
     * {@code null} yields a new empty list.
     */
    public static List<Object> list(Object value, String field) {
        if (value == null) {
            return Collections.unmodifiableList(new ArrayList<>());
        }
        if (!(value instanceof Collection<?> collection)) {
            throw ValidationException.wrongType(field, "a list", value);
        }
        return Collections.unmodifiableList(new ArrayList<>(collection));
    }

    /**
     * Validates an integer. Integral numbers and numeric strings are accepted;
     * fractional numbers and booleans are not.
     */
    public static int integer(Object value, String field) {
        if (value == null) {
            throw ValidationException.missing(field);
        }
        BigInteger result;
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            result = BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof BigInteger big) {
            result = big;
        } else if (value instanceof Number number) {
            try {
                result = new BigDecimal(number.toString()).toBigIntegerExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw ValidationException.wrongType(field, "an integer", value);
            }
        } else if (value instanceof String str) {
            try {
                result = new BigInteger(str.trim());
            } catch (NumberFormatException e) {
                throw ValidationException.wrongType(field, "an integer", value);
            }
        } else {
            throw ValidationException.wrongType(field, "an integer", value);
        }
        try {
            return result.intValueExact();
        } catch (ArithmeticException e) {
            throw ValidationException.wrongType(field, "an integer in 32-bit range", value);
        }
    }

    public static int nonNegativeInteger(Object value, String field) {
        int result = integer(value, field);
        if (result < 0) {
            throw ValidationException.negative(field, result);
        }
        return result;
    }

    /**
     * Validates a required run start timestamp.
     */
    public static Instant startTime(Object value) {
        if (value == null) {
            throw ValidationException.missing(START_TIME);
        }
        return timestamp(value, START_TIME);
    }

    /**
     * Validates an optional run end timestamp.
     */
    public static Instant endTime(Object value) {
        return value == null ? null : timestamp(value, END_TIME);
    }

    /**
     * Accepts a non-null string, boolean, or a number the default BSON codecs
     * encode natively (Integer, Long, Double).
     */
    public static Object scalar(Object value, String field) {
        if (value == null) {
            throw ValidationException.missing(field);
        }
        if (value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long || value instanceof Double) {
            return value;
        }
        throw ValidationException.wrongType(field, "a string, boolean, integer, long or double", value);
    }

    /**
     * Logical references are stored as-is; only presence is checked.
     */
    public static Object reference(Object value, String field) {
        if (value == null) {
            throw ValidationException.missing(field);
        }
        return value;
    }

    private static Instant timestamp(Object value, String field) {
        Instant instant = toInstant(value, field);
        try {
            // stored as a BSON date, which holds epoch milliseconds in a long
            instant.toEpochMilli();
        } catch (ArithmeticException e) {
            throw ValidationException.malformedTimestamp(field, value, e);
        }
        return instant;
    }

    private static Instant toInstant(Object value, String field) {
        try {
            if (value instanceof Instant instant) {
                return instant;
            }
            if (value instanceof Date date) {
                // java.sql.Date and java.sql.Time do not support toInstant()
                return Instant.ofEpochMilli(date.getTime());
            }
            if (value instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            if (value instanceof ZonedDateTime zdt) {
                return zdt.toInstant();
            }
            if (value instanceof String str) {
                return OffsetDateTime.parse(str.trim()).toInstant();
            }
            if (value instanceof Number number) {
                // epoch seconds, fractional part carried as nanos
                BigDecimal seconds = new BigDecimal(number.toString());
                BigDecimal whole = new BigDecimal(seconds.toBigInteger());
                long nanos = seconds.subtract(whole).movePointRight(9).longValue();
                return Instant.ofEpochSecond(whole.longValueExact(), nanos);
            }
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            throw ValidationException.malformedTimestamp(field, value, e);
        }
        throw ValidationException.wrongType(field, "a timestamp", value);
    }

    /**
     * Rejects keys that do not name a field of the record being built.
     */
    public static void knownFields(Map<String, ?> fields, Set<String> allowed) {
        for (String key : fields.keySet()) {
            if (!allowed.contains(key)) {
                throw ValidationException.unknownField(key);
            }
        }
    }
}
