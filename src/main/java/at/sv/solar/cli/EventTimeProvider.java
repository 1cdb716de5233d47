package at.sv.solar.cli;

import java.time.Instant;
import java.time.LocalDate;

public interface EventTimeProvider {

    /**
     * Resolves an event expression like {@code sunrise}, {@code civil_dusk+15}, {@code noon-30} or {@code 06:30} on the
     * given UTC date. Offsets are in minutes.
     *
     * @throws InvalidSunEventExpression if the expression can't be parsed, or the event does not occur on that date
     */
    Instant getTime(String input, LocalDate date);
}
