package at.sv.solar.time;

import at.sv.solar.orbit.OrbitalElements;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Conversions between UTC instants and Julian Day numbers, the continuous day count all orbital calculations are based on.
 */
public final class JulianDay {

    /**
     * Julian Day of 2000-01-01 12:00 UTC, the reference epoch of the orbital elements.
     */
    public static final double J2000 = 2451545;

    public static final double UNIX_EPOCH = 2440587.5;

    public static final double SECONDS_PER_DAY = 86400;

    private JulianDay() {
    }

    /**
     * Only whole seconds are taken into account.
     */
    public static double toJulianDay(Instant instant) {
        return instant.getEpochSecond() / SECONDS_PER_DAY + UNIX_EPOCH;
    }

    /**
     * Truncates to whole seconds, so {@code toInstant(toJulianDay(t))} may be up to one second off.
     */
    public static Instant toInstant(double julianDay) {
        return Instant.ofEpochSecond((long) Math.floor((julianDay - UNIX_EPOCH) * SECONDS_PER_DAY));
    }

    /**
     * Julian Day of noon UTC on the given date, shifted by the longitude to approximate the local transit. This does not
     * include the equation of time correction.
     *
     * @param longitude degrees, positive east
     */
    public static double meanSolarNoon(double longitude, LocalDate date) {
        Instant noon = date.atTime(LocalTime.NOON).toInstant(ZoneOffset.UTC);
        return toJulianDay(noon) - longitude / OrbitalElements.FULL_CIRCLE_DEGREES;
    }
}
