package at.sv.solar;

import lombok.Getter;

/**
 * Signals that the sun does not cross the requested elevation on the requested date. This is a regular outcome at high
 * latitudes, raised only when a caller asks for the crossing instants unconditionally.
 */
@Getter
public class NoCrossingException extends RuntimeException {

    private final DailyCrossing.Outcome outcome;

    public NoCrossingException(DailyCrossing.Outcome outcome, String message) {
        super(message);
        this.outcome = outcome;
    }
}
