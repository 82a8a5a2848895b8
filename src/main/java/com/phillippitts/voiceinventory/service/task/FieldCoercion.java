package com.phillippitts.voiceinventory.service.task;

import com.phillippitts.voiceinventory.domain.MaintenanceType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Converts raw update values (strings, numbers, booleans from parsed JSON) to typed field values.
 */
final class FieldCoercion {

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y", "1", "si");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "0");

    private FieldCoercion() {
    }

    /**
     * @return {@code true} if the raw value carries no information (null or blank text)
     */
    static boolean isAbsent(Object raw) {
        return raw == null || (raw instanceof CharSequence cs && cs.toString().isBlank());
    }

    /**
     * @throws IllegalArgumentException if the value cannot be represented as {@code type}
     */
    static Object coerce(FieldType type, Object raw) {
        return switch (type) {
            case TEXT -> String.valueOf(raw).trim();
            case INTEGER -> toInteger(raw);
            case DECIMAL -> toDecimal(raw);
            case BOOLEAN -> toBoolean(raw);
            case DATE -> toDate(raw);
            case MAINTENANCE_TYPE -> toMaintenanceType(raw);
        };
    }

    private static Integer toInteger(Object raw) {
        if (raw instanceof Integer i) {
            return i;
        }
        BigDecimal decimal = toDecimal(raw);
        try {
            return decimal.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("not a whole number: " + raw, e);
        }
    }

    private static BigDecimal toDecimal(Object raw) {
        if (raw instanceof BigDecimal b) {
            return b;
        }
        String text = String.valueOf(raw).trim()
                .replace("€", "")
                .replace("$", "")
                .replace(',', '.')
                .trim();
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + raw, e);
        }
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        String text = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a yes/no value: " + raw);
    }

    private static LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate d) {
            return d;
        }
        try {
            return LocalDate.parse(String.valueOf(raw).trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("not an ISO date: " + raw, e);
        }
    }

    private static MaintenanceType toMaintenanceType(Object raw) {
        if (raw instanceof MaintenanceType t) {
            return t;
        }
        return MaintenanceType.parse(String.valueOf(raw))
                .orElseThrow(() -> new IllegalArgumentException("unknown maintenance type: " + raw));
    }
}
