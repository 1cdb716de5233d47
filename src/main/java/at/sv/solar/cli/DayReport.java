package at.sv.solar.cli;

import at.sv.solar.DailyCrossing;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Everything the command line prints for one location and date. Events that do not occur are {@code null}.
 */
@Data
@Builder
public final class DayReport {

    private final String location;
    private final LocalDate date;

    private final Instant astronomicalDawn;
    private final Instant nauticalDawn;
    private final Instant civilDawn;
    private final Instant sunrise;
    private final Instant noon;
    private final Instant meanNoon;
    private final Instant sunset;
    private final Instant civilDusk;
    private final Instant nauticalDusk;
    private final Instant astronomicalDusk;

    private final Instant instant;
    private final double elevation;
    private final double azimuth;

    private final Double targetElevation;
    private final DailyCrossing.Outcome targetOutcome;
    private final Instant targetMorning;
    private final Instant targetEvening;

    private final String event;
    private final Instant eventTime;

    /**
     * Pre-fills the sun events of the date.
     */
    public static DayReportBuilder forDay(SunTimesProvider provider, LocalDate date) {
        return builder()
                .date(date)
                .astronomicalDawn(provider.getAstronomicalDawn(date).orElse(null))
                .nauticalDawn(provider.getNauticalDawn(date).orElse(null))
                .civilDawn(provider.getCivilDawn(date).orElse(null))
                .sunrise(provider.getSunrise(date).orElse(null))
                .noon(provider.getNoon(date))
                .meanNoon(provider.getMeanNoon(date))
                .sunset(provider.getSunset(date).orElse(null))
                .civilDusk(provider.getCivilDusk(date).orElse(null))
                .nauticalDusk(provider.getNauticalDusk(date).orElse(null))
                .astronomicalDusk(provider.getAstronomicalDusk(date).orElse(null));
    }

    public static class DayReportBuilder {

        public DayReportBuilder target(double elevation, DailyCrossing crossing) {
            return targetElevation(elevation)
                    .targetOutcome(crossing.getOutcome())
                    .targetMorning(crossing.getMorning().orElse(null))
                    .targetEvening(crossing.getEvening().orElse(null));
        }
    }
}
