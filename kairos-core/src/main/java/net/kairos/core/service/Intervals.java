package net.kairos.core.service;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed repeat intervals: ISO-8601 ({@code PT5M}), milliseconds ({@code 60000}) or phrases such as
 * {@code "5 minutes"}, {@code "1 hour and 30 minutes"}.
 */
public final class Intervals {
    private Intervals() {}

    private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([a-z]+)");
    private static final Pattern PHRASE =
            Pattern.compile("^(\\d+(?:\\.\\d+)?\\s*[a-z]+)(\\s*(,|and)?\\s*\\d+(?:\\.\\d+)?\\s*[a-z]+)*$");

    /** Empty when {@code text} is not a fixed interval (it may still be a cron expression). */
    public static Optional<Duration> parse(String text) {
        if (text == null) return Optional.empty();
        String s = text.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) return Optional.empty();

        if (s.chars().allMatch(Character::isDigit)) {
            return positive(Duration.ofMillis(Long.parseLong(s)));
        }
        if (s.startsWith("p")) {
            try {
                return positive(Duration.parse(text.trim().toUpperCase(Locale.ROOT)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        if (!PHRASE.matcher(s).matches()) return Optional.empty();

        double millis = 0;
        Matcher m = PART.matcher(s);
        while (m.find()) {
            Long unit = unitMillis(m.group(2));
            if (unit == null) return Optional.empty();
            millis += Double.parseDouble(m.group(1)) * unit;
        }
        return positive(Duration.ofMillis(Math.round(millis)));
    }

    private static Optional<Duration> positive(Duration d) {
        return d.isZero() || d.isNegative() ? Optional.empty() : Optional.of(d);
    }

    private static Long unitMillis(String unit) {
        return switch (unit) {
            case "ms", "millisecond", "milliseconds" -> 1L;
            case "s", "sec", "secs", "second", "seconds" -> 1_000L;
            case "m", "min", "mins", "minute", "minutes" -> 60_000L;
            case "h", "hr", "hrs", "hour", "hours" -> 3_600_000L;
            case "d", "day", "days" -> 86_400_000L;
            case "w", "week", "weeks" -> 604_800_000L;
            default -> null;
        };
    }
}
