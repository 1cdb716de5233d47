package at.sv.solar;

/**
 * Polar night: the sun stays below the horizon for the whole day.
 */
public final class SunNeverRisesException extends NoCrossingException {
    public SunNeverRisesException() {
        super(DailyCrossing.Outcome.NEVER_RISES, "Sun never rises at this location on this date");
    }
}
