package at.sv.solar.orbit;

import at.sv.solar.time.JulianDay;

import java.time.LocalDate;

/**
 * The orbital chain evaluated at the mean solar noon of one UTC date for one longitude. Recomputed for every query.
 *
 * @param meanSolarNoon     Julian Day of the mean solar noon
 * @param meanAnomaly       degrees
 * @param equationOfCenter  degrees
 * @param eclipticLongitude degrees
 * @param declination       degrees
 * @param transit           Julian Day of the true solar transit
 */
public record SolarState(double meanSolarNoon, double meanAnomaly, double equationOfCenter, double eclipticLongitude,
                         double declination, double transit) {

    public static SolarState of(double longitude, LocalDate date) {
        double noon = JulianDay.meanSolarNoon(longitude, date);
        double meanAnomaly = OrbitalElements.meanAnomaly(noon);
        double equationOfCenter = OrbitalElements.equationOfCenter(meanAnomaly);
        double eclipticLongitude = OrbitalElements.eclipticLongitude(meanAnomaly, equationOfCenter, noon);
        return new SolarState(noon, meanAnomaly, equationOfCenter, eclipticLongitude,
                OrbitalElements.declination(eclipticLongitude),
                OrbitalElements.transit(noon, meanAnomaly, eclipticLongitude));
    }

    /**
     * Hour angle of the given Julian Day in radians within [-π, π], negative before the nearest transit. Instants more
     * than half a day away from {@link #transit()} wrap around to the neighbouring day.
     */
    public double hourAngleAt(double julianDay) {
        return Math.IEEEremainder(2 * Math.PI * (julianDay - transit), 2 * Math.PI);
    }
}
