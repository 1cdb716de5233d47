package at.sv.solar.cli;

import at.sv.solar.Location;
import at.sv.solar.SolarCalculator;
import at.sv.solar.Twilight;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    private final SolarCalculator calculator;
    private final Location location;

    public SunTimesProviderImpl(SolarCalculator calculator, Location location) {
        this.calculator = calculator;
        this.location = location;
    }

    @Override
    public Optional<Instant> getAstronomicalDawn(LocalDate date) {
        return calculator.dawn(location, date, Twilight.ASTRONOMICAL);
    }

    @Override
    public Optional<Instant> getNauticalDawn(LocalDate date) {
        return calculator.dawn(location, date, Twilight.NAUTICAL);
    }

    @Override
    public Optional<Instant> getCivilDawn(LocalDate date) {
        return calculator.dawn(location, date, Twilight.CIVIL);
    }

    @Override
    public Optional<Instant> getSunrise(LocalDate date) {
        return calculator.sunrise(location, date);
    }

    @Override
    public Instant getNoon(LocalDate date) {
        return calculator.solarTransit(location, date);
    }

    @Override
    public Instant getMeanNoon(LocalDate date) {
        return calculator.meanSolarNoon(location, date);
    }

    @Override
    public Optional<Instant> getSunset(LocalDate date) {
        return calculator.sunset(location, date);
    }

    @Override
    public Optional<Instant> getCivilDusk(LocalDate date) {
        return calculator.dusk(location, date, Twilight.CIVIL);
    }

    @Override
    public Optional<Instant> getNauticalDusk(LocalDate date) {
        return calculator.dusk(location, date, Twilight.NAUTICAL);
    }

    @Override
    public Optional<Instant> getAstronomicalDusk(LocalDate date) {
        return calculator.dusk(location, date, Twilight.ASTRONOMICAL);
    }

    @Override
    public String toDebugString(LocalDate date) {
        return "astronomical_dawn: " + format(getAstronomicalDawn(date)) +
               "\nnautical_dawn: " + format(getNauticalDawn(date)) +
               "\ncivil_dawn: " + format(getCivilDawn(date)) +
               "\nsunrise: " + format(getSunrise(date)) +
               "\nnoon: " + format(getNoon(date)) +
               "\nmean_noon: " + format(getMeanNoon(date)) +
               "\nsunset: " + format(getSunset(date)) +
               "\ncivil_dusk: " + format(getCivilDusk(date)) +
               "\nnautical_dusk: " + format(getNauticalDusk(date)) +
               "\nastronomical_dusk: " + format(getAstronomicalDusk(date));
    }

    private String format(Optional<Instant> time) {
        return time.map(this::format).orElse("-");
    }

    private String format(Instant time) {
        return TIME_FORMATTER.format(time);
    }
}
