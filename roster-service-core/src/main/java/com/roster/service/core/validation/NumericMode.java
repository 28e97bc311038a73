package com.roster.service.core.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.OptionalLong;

/**
 * How {@code serverPlayers} and {@code maxPlayers} are read. Both modes run in one pass over the input and saturate
 * at the {@code long} range instead of materializing arbitrarily long numbers.
 */
public enum NumericMode {

    /**
     * Reads the longest leading integer: optional whitespace, optional sign, optional {@code 0x} prefix, then digits.
     * Trailing text is ignored, so {@code "12abc"} reads as 12. Decimal numbers are truncated toward zero. Lists read
     * as their elements joined by commas, so {@code ["5"]} reads as 5.
     */
    LENIENT {
        @Override
        public OptionalLong parse(Object value) {
            if (value instanceof Number number) {
                return fromNumber(number, false);
            }
            if (!(value instanceof CharSequence) && !(value instanceof List<?>)) {
                return OptionalLong.empty();
            }
            StringBuilder text = new StringBuilder();
            appendText(text, value);
            return leadingInteger(text);
        }
    },

    /** Accepts only a whole optionally signed decimal integer, or an integral JSON number. */
    STRICT {
        @Override
        public OptionalLong parse(Object value) {
            if (value instanceof Number number) {
                return fromNumber(number, true);
            }
            if (!(value instanceof CharSequence text)) {
                return OptionalLong.empty();
            }
            String s = text.toString().strip();
            int i = 0;
            boolean negative = false;
            if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
                negative = s.charAt(i) == '-';
                i++;
            }
            int end = digitsEnd(s, i, 10);
            if (end == i || end != s.length()) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(signed(saturatingValue(s, i, end, 10), negative));
        }
    };

    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);

    /** @return the integer the value denotes, clamped to the {@code long} range, or empty if it does not parse */
    public abstract OptionalLong parse(Object value);

    private static OptionalLong leadingInteger(CharSequence s) {
        int i = 0;
        while (i < s.length() && isJsWhitespace(s.charAt(i))) {
            i++;
        }
        boolean negative = false;
        if (i < s.length() && (s.charAt(i) == '+' || s.charAt(i) == '-')) {
            negative = s.charAt(i) == '-';
            i++;
        }
        int radix = 10;
        if (i + 1 < s.length() && s.charAt(i) == '0' && (s.charAt(i + 1) == 'x' || s.charAt(i + 1) == 'X')) {
            radix = 16;
            i += 2;
        }
        int end = digitsEnd(s, i, radix);
        if (end == i) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(signed(saturatingValue(s, i, end, radix), negative));
    }

    private static int digitsEnd(CharSequence s, int from, int radix) {
        int i = from;
        while (i < s.length() && s.charAt(i) < 128 && Character.digit(s.charAt(i), radix) >= 0) {
            i++;
        }
        return i;
    }

    private static long saturatingValue(CharSequence s, int from, int to, int radix) {
        long acc = 0;
        for (int i = from; i < to; i++) {
            int digit = Character.digit(s.charAt(i), radix);
            if (acc > (Long.MAX_VALUE - digit) / radix) {
                return Long.MAX_VALUE;
            }
            acc = acc * radix + digit;
        }
        return acc;
    }

    private static long signed(long magnitude, boolean negative) {
        return negative ? -magnitude : magnitude;
    }

    // Whitespace a script engine skips before a number: space separators, line terminators, tab, VT, FF and BOM.
    private static boolean isJsWhitespace(char c) {
        if (c == '\t' || c == '\n' || c == '\u000B' || c == '\f' || c == '\r' || c == '\uFEFF') {
            return true;
        }
        int type = Character.getType(c);
        return type == Character.SPACE_SEPARATOR
                || type == Character.LINE_SEPARATOR
                || type == Character.PARAGRAPH_SEPARATOR;
    }

    private static void appendText(StringBuilder out, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof CharSequence text) {
            out.append(text);
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    out.append(',');
                }
                appendText(out, list.get(i));
            }
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < 1e21) {
                out.append(new BigDecimal(d).toBigInteger());
            } else {
                out.append(d);
            }
        } else if (value instanceof Number || value instanceof Boolean) {
            out.append(value);
        } else {
            out.append("[object Object]");
        }
    }

    private static OptionalLong fromNumber(Number number, boolean requireIntegral) {
        if (number instanceof BigInteger big) {
            if (big.bitLength() < 64) {
                return OptionalLong.of(big.longValue());
            }
            return OptionalLong.of(big.signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE);
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return OptionalLong.of(number.longValue());
        }
        if (number instanceof BigDecimal decimal) {
            if (requireIntegral && decimal.signum() != 0 && decimal.stripTrailingZeros().scale() > 0) {
                return OptionalLong.empty();
            }
            if (decimal.compareTo(LONG_MAX) >= 0) {
                return OptionalLong.of(Long.MAX_VALUE);
            }
            if (decimal.compareTo(LONG_MIN) <= 0) {
                return OptionalLong.of(Long.MIN_VALUE);
            }
            return OptionalLong.of(decimal.longValue());
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return OptionalLong.empty();
        }
        if (requireIntegral && d != Math.rint(d)) {
            return OptionalLong.empty();
        }
        // narrowing cast truncates toward zero and clamps to the long range
        return OptionalLong.of((long) d);
    }
}
