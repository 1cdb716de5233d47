package at.sv.solar;

/**
 * Midnight sun: the sun stays above the horizon for the whole day.
 */
public final class SunNeverSetsException extends NoCrossingException {
    public SunNeverSetsException() {
        super(DailyCrossing.Outcome.NEVER_SETS, "Sun never sets at this location on this date");
    }
}
