package work.lcod.envbase.shared;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses user-friendly durations such as {@code 90s}, {@code 45m} or {@code 2h}. A bare number is taken as seconds.
 */
public final class DurationParser {
    private static final Map<String, Duration> UNITS = new LinkedHashMap<>();

    static {
        // longest suffix first so "ms" wins over "s"
        UNITS.put("ms", Duration.ofMillis(1));
        UNITS.put("s", Duration.ofSeconds(1));
        UNITS.put("m", Duration.ofMinutes(1));
        UNITS.put("h", Duration.ofHours(1));
    }

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        Duration unit = Duration.ofSeconds(1);
        for (var entry : UNITS.entrySet()) {
            if (trimmed.endsWith(entry.getKey())) {
                trimmed = trimmed.substring(0, trimmed.length() - entry.getKey().length()).trim();
                unit = entry.getValue();
                break;
            }
        }
        try {
            long amount = Long.parseLong(trimmed);
            if (amount < 0) {
                throw new IllegalArgumentException("Duration must not be negative: " + raw);
            }
            return Optional.of(unit.multipliedBy(amount));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
    }
}
