package at.sv.solar.orbit;

import static at.sv.solar.time.JulianDay.J2000;

/**
 * Low order model of the apparent solar orbit. All angles are in degrees, all times in Julian days.
 */
public final class OrbitalElements {

    public static final double FULL_CIRCLE_DEGREES = 360.0;
    private static final double HALF_CIRCLE_DEGREES = 180.0;

    private static final double MEAN_ANOMALY_AT_J2000 = 357.5291;
    private static final double MEAN_ANOMALY_PER_DAY = 0.98560028;

    private static final double CENTER_C1 = 1.9148;
    private static final double CENTER_C2 = 0.0200;
    private static final double CENTER_C3 = 0.0003;

    private static final double PERIHELION_AT_J2000 = 102.93005;
    private static final double PERIHELION_PER_CENTURY = 0.3179526;
    private static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    private static final double EQUATION_OF_TIME_C1 = 0.0053;
    private static final double EQUATION_OF_TIME_C2 = 0.0069;

    /**
     * sin(23.44°), the obliquity of the ecliptic.
     */
    private static final double SIN_OBLIQUITY = 0.39779;

    private OrbitalElements() {
    }

    /**
     * @return the mean anomaly in [0, 360)
     */
    public static double meanAnomaly(double julianDay) {
        return normalizeDegrees(MEAN_ANOMALY_AT_J2000 + MEAN_ANOMALY_PER_DAY * (julianDay - J2000));
    }

    /**
     * Reduces an angle into [0, 360).
     */
    public static double normalizeDegrees(double degrees) {
        double angle = Math.IEEEremainder(degrees, FULL_CIRCLE_DEGREES);
        if (angle < 0) {
            angle += FULL_CIRCLE_DEGREES;
        }
        // a tiny negative remainder rounds up to the full circle
        return angle >= FULL_CIRCLE_DEGREES ? angle - FULL_CIRCLE_DEGREES : angle;
    }

    /**
     * Difference between the true anomaly of the elliptical orbit and the mean anomaly of a circular one.
     */
    public static double equationOfCenter(double meanAnomaly) {
        double m = Math.toRadians(meanAnomaly);
        return CENTER_C1 * Math.sin(m) + CENTER_C2 * Math.sin(2 * m) + CENTER_C3 * Math.sin(3 * m);
    }

    public static double argumentOfPerihelion(double julianDay) {
        return PERIHELION_AT_J2000 + PERIHELION_PER_CENTURY * (julianDay - J2000) / DAYS_PER_JULIAN_CENTURY;
    }

    public static double eclipticLongitude(double meanAnomaly, double equationOfCenter, double julianDay) {
        return (meanAnomaly + equationOfCenter + HALF_CIRCLE_DEGREES + argumentOfPerihelion(julianDay)) % FULL_CIRCLE_DEGREES;
    }

    /**
     * Applies the equation of time to a mean solar noon.
     *
     * @return the Julian Day of the true solar transit
     */
    public static double transit(double julianDay, double meanAnomaly, double eclipticLongitude) {
        double equationOfTime = EQUATION_OF_TIME_C1 * Math.sin(Math.toRadians(meanAnomaly))
                                - EQUATION_OF_TIME_C2 * Math.sin(Math.toRadians(2 * eclipticLongitude));
        return julianDay + equationOfTime;
    }

    public static double declination(double eclipticLongitude) {
        return Math.toDegrees(Math.asin(Math.sin(Math.toRadians(eclipticLongitude)) * SIN_OBLIQUITY));
    }
}
