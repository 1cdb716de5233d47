package at.sv.solar;

import at.sv.solar.orbit.HourAngle;
import at.sv.solar.orbit.OrbitalElements;
import at.sv.solar.orbit.SolarState;
import at.sv.solar.time.JulianDay;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Sunrise equation implementation. Stateless, every call evaluates the whole orbital chain again, so instances can be
 * shared between threads freely.
 */
@Slf4j
public final class SolarCalculatorImpl implements SolarCalculator {

    @Override
    public DailyCrossing sunriseSunset(Location location, LocalDate date) {
        SolarState state = stateFor(location, date);
        HourAngle hourAngle = HourAngle.sunriseSunset(location.latitude(), state.declination());
        return switch (hourAngle.outcome()) {
            case NEVER_RISES -> noCrossing(location, date, DailyCrossing.Outcome.NEVER_RISES);
            case NEVER_SETS -> noCrossing(location, date, DailyCrossing.Outcome.NEVER_SETS);
            case DEFINED -> crossing(state, hourAngle);
        };
    }

    @Override
    public double elevation(Location location, Instant instant) {
        SolarState state = stateFor(location, utcDate(instant));
        return elevation(location, state, state.hourAngleAt(JulianDay.toJulianDay(instant)));
    }

    private static double elevation(Location location, SolarState state, double hourAngle) {
        double lat = Math.toRadians(location.latitude());
        double decl = Math.toRadians(state.declination());
        return Math.toDegrees(Math.asin(Math.sin(lat) * Math.sin(decl)
                                        + Math.cos(lat) * Math.cos(decl) * Math.cos(hourAngle)));
    }

    @Override
    public double azimuth(Location location, Instant instant) {
        SolarState state = stateFor(location, utcDate(instant));
        double hourAngle = state.hourAngleAt(JulianDay.toJulianDay(instant));
        double lat = Math.toRadians(location.latitude());
        double decl = Math.toRadians(state.declination());
        double elevation = Math.toRadians(elevation(location, state, hourAngle));

        double cosAzimuth = (Math.sin(decl) * Math.cos(lat) - Math.cos(decl) * Math.sin(lat) * Math.cos(hourAngle))
                            / Math.cos(elevation);
        double azimuth = Math.toDegrees(Math.acos(clamp(cosAzimuth)));
        // acos only covers [0, 180]: mirror into the western half after the transit
        if (hourAngle >= 0) {
            azimuth = OrbitalElements.FULL_CIRCLE_DEGREES - azimuth;
        }
        return OrbitalElements.normalizeDegrees(azimuth);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }

    @Override
    public DailyCrossing timeOfElevation(Location location, double elevation, LocalDate date) {
        SolarState state = stateFor(location, date);
        HourAngle hourAngle = HourAngle.forElevation(location.latitude(), state.declination(), elevation);
        return switch (hourAngle.outcome()) {
            case NEVER_RISES -> noCrossing(location, date, DailyCrossing.Outcome.ALWAYS_BELOW);
            case NEVER_SETS -> noCrossing(location, date, DailyCrossing.Outcome.ALWAYS_ABOVE);
            case DEFINED -> crossing(state, hourAngle);
        };
    }

    @Override
    public Instant meanSolarNoon(Location location, LocalDate date) {
        return JulianDay.toInstant(JulianDay.meanSolarNoon(location.longitude(), date));
    }

    @Override
    public Instant solarTransit(Location location, LocalDate date) {
        return JulianDay.toInstant(stateFor(location, date).transit());
    }

    private static SolarState stateFor(Location location, LocalDate date) {
        SolarState state = SolarState.of(location.longitude(), date);
        log.trace("{} on {}: {}", location, date, state);
        return state;
    }

    private static DailyCrossing crossing(SolarState state, HourAngle hourAngle) {
        return DailyCrossing.crossing(JulianDay.toInstant(state.transit() - hourAngle.dayFraction()),
                JulianDay.toInstant(state.transit() + hourAngle.dayFraction()));
    }

    private static DailyCrossing noCrossing(Location location, LocalDate date, DailyCrossing.Outcome outcome) {
        log.trace("No crossing at {} on {}: {}", location, date, outcome);
        return DailyCrossing.noCrossing(outcome);
    }

    private static LocalDate utcDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }
}
