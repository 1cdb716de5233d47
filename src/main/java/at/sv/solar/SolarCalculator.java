package at.sv.solar;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Position of the sun and the times it crosses given elevations. All instants and dates are UTC; converting to local
 * time is up to the caller.
 */
public interface SolarCalculator {

    /**
     * @return the sunrise and sunset, or {@link DailyCrossing.Outcome#NEVER_RISES} / {@link DailyCrossing.Outcome#NEVER_SETS}
     */
    DailyCrossing sunriseSunset(Location location, LocalDate date);

    /**
     * @return the sunrise, empty if the sun never rises or never sets on that date
     */
    default Optional<Instant> sunrise(Location location, LocalDate date) {
        return sunriseSunset(location, date).getMorning();
    }

    /**
     * @return the sunset, empty if the sun never rises or never sets on that date
     */
    default Optional<Instant> sunset(Location location, LocalDate date) {
        return sunriseSunset(location, date).getEvening();
    }

    /**
     * Elevation of the center of the sun above the horizon, in degrees.
     */
    double elevation(Location location, Instant instant);

    /**
     * Compass bearing of the sun in degrees [0..360), measured clockwise from north.
     */
    double azimuth(Location location, Instant instant);

    /**
     * @param elevation target elevation of the sun in degrees
     * @return the morning and evening instants at which the sun reaches the elevation, or
     * {@link DailyCrossing.Outcome#ALWAYS_BELOW} / {@link DailyCrossing.Outcome#ALWAYS_ABOVE}
     */
    DailyCrossing timeOfElevation(Location location, double elevation, LocalDate date);

    default DailyCrossing dawnDusk(Location location, LocalDate date, Twilight twilight) {
        return timeOfElevation(location, twilight.getElevation(), date);
    }

    default DailyCrossing dawnDusk(Location location, LocalDate date) {
        return dawnDusk(location, date, Twilight.CIVIL);
    }

    default Optional<Instant> dawn(Location location, LocalDate date, Twilight twilight) {
        return dawnDusk(location, date, twilight).getMorning();
    }

    default Optional<Instant> dawn(Location location, LocalDate date) {
        return dawn(location, date, Twilight.CIVIL);
    }

    default Optional<Instant> dusk(Location location, LocalDate date, Twilight twilight) {
        return dawnDusk(location, date, twilight).getEvening();
    }

    default Optional<Instant> dusk(Location location, LocalDate date) {
        return dusk(location, date, Twilight.CIVIL);
    }

    /**
     * Noon UTC shifted by the longitude, without the equation of time correction.
     *
     * @see #solarTransit(Location, LocalDate)
     */
    Instant meanSolarNoon(Location location, LocalDate date);

    /**
     * True solar noon: the instant the sun crosses the local meridian.
     */
    Instant solarTransit(Location location, LocalDate date);
}
