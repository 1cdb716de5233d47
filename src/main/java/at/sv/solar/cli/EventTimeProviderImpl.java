package at.sv.solar.cli;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

public final class EventTimeProviderImpl implements EventTimeProvider {

    private final SunTimesProvider sunTimesProvider;

    public EventTimeProviderImpl(SunTimesProvider sunTimesProvider) {
        this.sunTimesProvider = sunTimesProvider;
    }

    @Override
    public Instant getTime(String input, LocalDate date) {
        LocalTime time = tryParseTimeString(input);
        if (time != null) return date.atTime(time).toInstant(ZoneOffset.UTC);
        try {
            if (isOffsetExpression(input)) {
                return parseOffsetExpression(input, date);
            }
            return parseSunKeywords(input, date);
        } catch (Exception e) {
            throw new InvalidSunEventExpression("Failed to parse sun event expression '" + input + "': " + e.getMessage());
        }
    }

    private LocalTime tryParseTimeString(String input) {
        if (input.isEmpty() || !Character.isDigit(input.charAt(0))) {
            return null;
        }
        try {
            return LocalTime.parse(input);
        } catch (DateTimeParseException e) {
            throw new InvalidSunEventExpression("Invalid time '" + input + "': " + e.getMessage());
        }
    }

    private boolean isOffsetExpression(String input) {
        return input.contains("+") || input.contains("-");
    }

    private Instant parseOffsetExpression(String input, LocalDate date) {
        String[] parts = input.split("[+-]");
        Instant eventTime = parseSunKeywords(parts[0].trim(), date);
        long offset = Long.parseLong(parts[1].trim());
        if (input.contains("+")) {
            return eventTime.plus(offset, ChronoUnit.MINUTES);
        } else {
            return eventTime.minus(offset, ChronoUnit.MINUTES);
        }
    }

    private Instant parseSunKeywords(String input, LocalDate date) {
        return switch (input.toLowerCase(Locale.ENGLISH)) {
            case "astronomical_start", "astronomical_dawn" -> occurring(input, sunTimesProvider.getAstronomicalDawn(date));
            case "nautical_start", "nautical_dawn" -> occurring(input, sunTimesProvider.getNauticalDawn(date));
            case "civil_start", "civil_dawn" -> occurring(input, sunTimesProvider.getCivilDawn(date));
            case "sunrise" -> occurring(input, sunTimesProvider.getSunrise(date));
            case "noon" -> sunTimesProvider.getNoon(date);
            case "mean_noon" -> sunTimesProvider.getMeanNoon(date);
            case "sunset" -> occurring(input, sunTimesProvider.getSunset(date));
            case "civil_end", "civil_dusk" -> occurring(input, sunTimesProvider.getCivilDusk(date));
            case "nautical_end", "nautical_dusk" -> occurring(input, sunTimesProvider.getNauticalDusk(date));
            case "astronomical_end", "astronomical_dusk" -> occurring(input, sunTimesProvider.getAstronomicalDusk(date));
            default -> throw new IllegalArgumentException("Invalid sun keyword: '" + input + "'");
        };
    }

    private static Instant occurring(String keyword, Optional<Instant> time) {
        return time.orElseThrow(() -> new IllegalArgumentException("'" + keyword + "' does not occur on this date"));
    }
}
