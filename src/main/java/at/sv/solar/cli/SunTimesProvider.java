package at.sv.solar.cli;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Sun events of one fixed location. Events that do not occur on a date are empty.
 */
public interface SunTimesProvider {

    Optional<Instant> getAstronomicalDawn(LocalDate date);

    Optional<Instant> getNauticalDawn(LocalDate date);

    Optional<Instant> getCivilDawn(LocalDate date);

    Optional<Instant> getSunrise(LocalDate date);

    Instant getNoon(LocalDate date);

    Instant getMeanNoon(LocalDate date);

    Optional<Instant> getSunset(LocalDate date);

    Optional<Instant> getCivilDusk(LocalDate date);

    Optional<Instant> getNauticalDusk(LocalDate date);

    Optional<Instant> getAstronomicalDusk(LocalDate date);

    default String toDebugString(LocalDate date) {
        return null;
    }
}
