package at.sv.solar;

import java.util.Locale;

/**
 * A point on the surface of the Earth. Values are not validated: out of range coordinates simply propagate through the
 * calculations.
 *
 * @param latitude  degrees [-90..90], positive north
 * @param longitude degrees [-180..180], positive east
 */
public record Location(double latitude, double longitude) {

    public static Location of(double latitude, double longitude) {
        return new Location(latitude, longitude);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.4f°%s, %.4f°%s",
                Math.abs(latitude), latitude < 0 ? "S" : "N",
                Math.abs(longitude), longitude < 0 ? "W" : "E");
    }
}
