package at.sv.solar;

import at.sv.solar.cli.DayReport;
import at.sv.solar.cli.DayReportWriter;
import at.sv.solar.cli.EventTimeProviderImpl;
import at.sv.solar.cli.InvalidSunEventExpression;
import at.sv.solar.cli.SunTimesProvider;
import at.sv.solar.cli.SunTimesProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.function.Supplier;

@Command(name = "SolarPosition", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the sun events of a day and the position of the sun for a location. All times are UTC.")
public final class SolarPosition implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SolarPosition.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            description = "The UTC date to compute the sun events for. Default: the date of --time, or today.")
    LocalDate date;
    @Option(names = "--time", paramLabel = "<instant>",
            description = "The UTC instant to compute the position of the sun for, e.g. 2022-06-21T12:00:00Z. " +
                          "Default: noon UTC of --date, or now.")
    Instant time;
    @Option(names = "--target", paramLabel = "<degrees>",
            description = "An additional solar elevation in degrees to compute the morning and evening crossing for.")
    Double targetElevation;
    @Option(names = "--event", paramLabel = "<expression>",
            description = "A sun event expression to resolve on the date, e.g. sunrise, civil_dusk+15, noon-30 or 06:30.")
    String event;
    @Option(names = "--json",
            defaultValue = "${env:JSON_OUTPUT:-false}",
            description = "Print the report as JSON. Default: ${DEFAULT-VALUE}")
    boolean json;

    private final SolarCalculator calculator;
    private final Supplier<Instant> currentTime;

    public SolarPosition() {
        this(new SolarCalculatorImpl(), Instant::now);
    }

    public SolarPosition(SolarCalculator calculator, Supplier<Instant> currentTime) {
        this.calculator = calculator;
        this.currentTime = currentTime;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SolarPosition()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertGeographicConfigurations();
        Location location = Location.of(latitude, longitude);
        Instant instant = resolveInstant();
        LocalDate day = date != null ? date : LocalDate.ofInstant(instant, ZoneOffset.UTC);
        LOG.info("Location: {}, date: {}, instant: {}", location, day, instant);

        SunTimesProvider sunTimesProvider = new SunTimesProviderImpl(calculator, location);
        LOG.debug("Solar times:\n{}", sunTimesProvider.toDebugString(day));
        DayReport.DayReportBuilder report = DayReport.forDay(sunTimesProvider, day)
                                                     .location(location.toString())
                                                     .instant(instant)
                                                     .elevation(calculator.elevation(location, instant))
                                                     .azimuth(calculator.azimuth(location, instant));
        if (targetElevation != null) {
            report.target(targetElevation, calculator.timeOfElevation(location, targetElevation, day));
        }
        if (event != null) {
            report.event(event).eventTime(resolveEvent(sunTimesProvider, day));
        }
        print(report.build());
    }

    private Instant resolveInstant() {
        if (time != null) {
            return time;
        }
        if (date != null) {
            return date.atTime(LocalTime.NOON).toInstant(ZoneOffset.UTC);
        }
        return currentTime.get();
    }

    private Instant resolveEvent(SunTimesProvider sunTimesProvider, LocalDate day) {
        try {
            return new EventTimeProviderImpl(sunTimesProvider).getTime(event.trim(), day);
        } catch (InvalidSunEventExpression e) {
            fail("--event: " + e.getMessage());
            return null;
        }
    }

    private void print(DayReport report) {
        DayReportWriter writer = new DayReportWriter();
        String output = json ? writer.toJson(report) : writer.toText(report);
        if (spec != null) {
            spec.commandLine().getOut().println(output);
            spec.commandLine().getOut().flush();
        } else {
            System.out.println(output);
        }
    }

    private void assertGeographicConfigurations() {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
