package at.sv.solar;

public final class ElevationUnreachableException extends NoCrossingException {
    public ElevationUnreachableException(DailyCrossing.Outcome outcome) {
        super(outcome, outcome == DailyCrossing.Outcome.ALWAYS_ABOVE
                ? "Sun stays above the target elevation for the whole day"
                : "Sun stays below the target elevation for the whole day");
    }
}
