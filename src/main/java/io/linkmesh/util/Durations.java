package io.linkmesh.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;

/**
 * Duration text used by flags and config payloads.
 *
 * <p>Flags accept compound unit strings ({@code 24h}, {@code 1h30m}, {@code 500ms}). Config
 * payloads store the protobuf JSON form: decimal seconds with an {@code s} suffix
 * ({@code 86400s}, {@code 0.250s}). {@link #parse(String)} accepts both.
 */
public final class Durations {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private Durations() {
    }

    public static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("duration must not be blank");
        }
        String text = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(text)) {
            return Duration.ZERO;
        }
        boolean negative = text.startsWith("-");
        if (negative || text.startsWith("+")) {
            text = text.substring(1);
        }
        Duration total = Duration.ZERO;
        int i = 0;
        while (i < text.length()) {
            int numberStart = i;
            while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                i++;
            }
            if (numberStart == i) {
                throw new IllegalArgumentException("invalid duration: " + raw);
            }
            BigDecimal amount = new BigDecimal(text.substring(numberStart, i));
            int unitStart = i;
            while (i < text.length() && Character.isLetter(text.charAt(i))) {
                i++;
            }
            String unit = text.substring(unitStart, i);
            try {
                total = total.plus(toDuration(amount, unit, raw));
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("duration out of range: " + raw, e);
            }
        }
        return negative ? total.negated() : total;
    }

    public static String toProtoJson(Duration duration) {
        if (duration == null) {
            return "0s";
        }
        if (duration.getNano() == 0) {
            return duration.getSeconds() + "s";
        }
        BigDecimal seconds = BigDecimal.valueOf(duration.getSeconds())
                .add(BigDecimal.valueOf(duration.getNano(), 9));
        return seconds.stripTrailingZeros().toPlainString() + "s";
    }

    private static Duration toDuration(BigDecimal amount, String unit, String raw) {
        long nanosPerUnit = switch (unit) {
            case "ns" -> 1L;
            case "us" -> 1_000L;
            case "ms" -> 1_000_000L;
            case "s" -> 1_000_000_000L;
            case "m" -> 60L * 1_000_000_000L;
            case "h" -> 3_600L * 1_000_000_000L;
            case "d" -> 86_400L * 1_000_000_000L;
            default -> throw new IllegalArgumentException("unknown duration unit in: " + raw);
        };
        BigDecimal[] parts = amount.multiply(BigDecimal.valueOf(nanosPerUnit))
                .divideAndRemainder(BigDecimal.valueOf(NANOS_PER_SECOND));
        // Sub-nanosecond fractions are dropped; anything past Duration's range throws.
        return Duration.ofSeconds(
                parts[0].longValueExact(),
                parts[1].setScale(0, RoundingMode.DOWN).longValueExact()
        );
    }
}
