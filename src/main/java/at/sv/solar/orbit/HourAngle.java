package at.sv.solar.orbit;

/**
 * Half the angle the sun travels between its morning and evening crossing of a reference elevation. Only defined if the
 * sun actually crosses that elevation on the day in question.
 *
 * @param outcome whether the elevation is crossed
 * @param degrees the hour angle, {@link Double#NaN} unless {@link Outcome#DEFINED}
 */
public record HourAngle(Outcome outcome, double degrees) {

    /**
     * Elevation of the upper limb of the sun at sunrise and sunset: 34' of refraction plus 16' of solar radius below the
     * horizon.
     */
    public static final double SUNRISE_SUNSET_ELEVATION = -50.0 / 60.0;

    public enum Outcome {
        DEFINED,
        /**
         * The sun stays below the reference elevation all day. For sunrise this is the polar night.
         */
        NEVER_RISES,
        /**
         * The sun stays above the reference elevation all day. For sunset this is the midnight sun.
         */
        NEVER_SETS
    }

    /**
     * Hour angle of sunrise and sunset, using {@link #SUNRISE_SUNSET_ELEVATION}.
     */
    public static HourAngle sunriseSunset(double latitude, double declination) {
        return forElevation(latitude, declination, SUNRISE_SUNSET_ELEVATION);
    }

    /**
     * Inverts the elevation formula for an arbitrary target elevation. Inputs outside the physical domain are not
     * rejected; they end up as a {@code NaN} angle.
     */
    public static HourAngle forElevation(double latitude, double declination, double elevation) {
        double lat = Math.toRadians(latitude);
        double decl = Math.toRadians(declination);
        double ratio = (Math.sin(Math.toRadians(elevation)) - Math.sin(lat) * Math.sin(decl))
                       / (Math.cos(lat) * Math.cos(decl));
        if (ratio > 1) {
            return new HourAngle(Outcome.NEVER_RISES, Double.NaN);
        }
        if (ratio < -1) {
            return new HourAngle(Outcome.NEVER_SETS, Double.NaN);
        }
        return new HourAngle(Outcome.DEFINED, Math.toDegrees(Math.acos(ratio)));
    }

    public boolean isDefined() {
        return outcome == Outcome.DEFINED;
    }

    /**
     * The hour angle as a fraction of a day, i.e. the offset of the crossings from the transit in Julian days.
     */
    public double dayFraction() {
        return degrees / OrbitalElements.FULL_CIRCLE_DEGREES;
    }
}
