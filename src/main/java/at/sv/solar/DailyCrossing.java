package at.sv.solar;

import lombok.EqualsAndHashCode;

import java.time.Instant;
import java.util.Optional;

/**
 * The morning and evening instants at which the sun crosses an elevation on one day, or the reason why it does not.
 */
@EqualsAndHashCode
public final class DailyCrossing {

    public enum Outcome {
        CROSSES,
        /**
         * Sunrise/sunset only: the sun stays below the horizon all day.
         */
        NEVER_RISES,
        /**
         * Sunrise/sunset only: the sun stays above the horizon all day.
         */
        NEVER_SETS,
        /**
         * The sun stays below the target elevation all day.
         */
        ALWAYS_BELOW,
        /**
         * The sun stays above the target elevation all day.
         */
        ALWAYS_ABOVE
    }

    private final Outcome outcome;
    private final Instant morning;
    private final Instant evening;

    private DailyCrossing(Outcome outcome, Instant morning, Instant evening) {
        this.outcome = outcome;
        this.morning = morning;
        this.evening = evening;
    }

    public static DailyCrossing crossing(Instant morning, Instant evening) {
        return new DailyCrossing(Outcome.CROSSES, morning, evening);
    }

    public static DailyCrossing noCrossing(Outcome outcome) {
        if (outcome == Outcome.CROSSES) {
            throw new IllegalArgumentException("A crossing needs its morning and evening instants");
        }
        return new DailyCrossing(outcome, null, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isReachable() {
        return outcome == Outcome.CROSSES;
    }

    public Optional<Instant> getMorning() {
        return Optional.ofNullable(morning);
    }

    public Optional<Instant> getEvening() {
        return Optional.ofNullable(evening);
    }

    /**
     * @return the morning and evening crossing
     * @throws SunNeverRisesException        on {@link Outcome#NEVER_RISES}
     * @throws SunNeverSetsException         on {@link Outcome#NEVER_SETS}
     * @throws ElevationUnreachableException on {@link Outcome#ALWAYS_BELOW} and {@link Outcome#ALWAYS_ABOVE}
     */
    public TimeSpan orElseThrow() {
        return switch (outcome) {
            case CROSSES -> TimeSpan.of(morning, evening);
            case NEVER_RISES -> throw new SunNeverRisesException();
            case NEVER_SETS -> throw new SunNeverSetsException();
            case ALWAYS_BELOW, ALWAYS_ABOVE -> throw new ElevationUnreachableException(outcome);
        };
    }

    @Override
    public String toString() {
        if (isReachable()) {
            return "[" + morning + "," + evening + ']';
        }
        return outcome.toString();
    }
}
