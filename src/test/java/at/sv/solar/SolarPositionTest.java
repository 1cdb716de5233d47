package at.sv.solar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SolarPositionTest {

    private Instant now;
    private StringWriter out;
    private StringWriter err;
    private PrintWriter outWriter;
    private PrintWriter errWriter;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2022-06-21T12:00:00Z");
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new SolarPosition(new SolarCalculatorImpl(), () -> now));
        outWriter = new PrintWriter(out);
        errWriter = new PrintWriter(err);
        commandLine.setOut(outWriter);
        commandLine.setErr(errWriter);
    }

    private int execute(String... args) {
        int exitCode = commandLine.execute(args);
        outWriter.flush();
        errWriter.flush();
        return exitCode;
    }

    @Test
    void date_printsEventsOfThatDay_andPositionAtNoon() {
        int exitCode = execute("--lat", "43.65", "--long", "-79.38", "--date", "2000-01-01");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("location: 43.6500°N, 79.3800°W")
                                  .contains("date: 2000-01-01")
                                  .contains("sunrise: 12:50:5")
                                  .contains("sunset: 21:50:3")
                                  .contains("noon: 17:20:4")
                                  .contains("instant: 2000-01-01T12:00:00Z")
                                  .contains("elevation: -9.01°");
    }

    @Test
    void noDateOrTime_usesCurrentTime() {
        int exitCode = execute("--lat", "40.7128", "--long", "-74.006");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("date: 2022-06-21")
                                  .contains("instant: 2022-06-21T12:00:00Z")
                                  .contains("elevation: 26.48°");
    }

    @Test
    void time_definesDateAndPosition() {
        int exitCode = execute("--lat", "43.65", "--long", "-79.38", "--time", "2000-01-01T17:00:00Z");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("date: 2000-01-01")
                                  .contains("elevation: 23.16°")
                                  .contains("azimuth: 174.79°");
    }

    @Test
    void target_printsCrossing() {
        int exitCode = execute("--lat", "43.65", "--long", "-79.38", "--date", "2000-01-01", "--target", "10");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("target_elevation: 10.00°")
                                  .contains("target_outcome: CROSSES")
                                  .contains("target_morning: 14:07:5")
                                  .contains("target_evening: 20:33:4");
    }

    @Test
    void target_unreachable_printsOutcome() {
        int exitCode = execute("--lat", "43.65", "--long", "-79.38", "--date", "2000-01-01", "--target", "30");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("target_outcome: ALWAYS_BELOW")
                                  .contains("target_morning: -");
    }

    @Test
    void event_resolvesExpression() {
        int exitCode = execute("--lat", "43.65", "--long", "-79.38", "--date", "2000-01-01", "--event", "sunrise+30");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("event: sunrise+30")
                                  .contains("event_time: 2000-01-01T13:20:5");
    }

    @Test
    void event_invalid_fails() {
        int exitCode = execute("--lat", "43.65", "--long", "-79.38", "--event", "golden_hour");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--event").contains("golden_hour");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void event_doesNotOccur_fails() {
        int exitCode = execute("--lat", "78.614803", "--long", "15.895517", "--date", "2021-12-01", "--event", "sunrise");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("does not occur");
    }

    @Test
    void latitudeOutOfRange_fails() {
        int exitCode = execute("--lat", "91", "--long", "0");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--lat must be between -90 and 90 degrees");
    }

    @Test
    void longitudeOutOfRange_fails() {
        int exitCode = execute("--lat", "0", "--long", "-180.5");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--long must be between -180 and 180 degrees");
    }

    @Test
    void latitudeNaN_fails() {
        int exitCode = execute("--lat", "NaN", "--long", "0");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--lat must be between -90 and 90 degrees");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void longitudeNaN_fails() {
        int exitCode = execute("--lat", "0", "--long", "NaN");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("--long must be between -180 and 180 degrees");
    }

    @Test
    void json_printsMachineReadableReport() throws Exception {
        int exitCode = execute("--lat", "78.614803", "--long", "15.895517", "--date", "2021-12-01", "--json");

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(out.toString());
        assertThat(json.get("location").asText()).isEqualTo("78.6148°N, 15.8955°E");
        assertThat(json.get("date").asText()).isEqualTo("2021-12-01");
        assertThat(json.has("sunrise")).isFalse();
        assertThat(json.has("civilDawn")).isFalse();
        assertThat(json.get("nauticalDawn").asText()).startsWith("2021-12-01T08:40:");
        assertThat(json.get("instant").asText()).isEqualTo("2021-12-01T12:00:00Z");
        assertThat(json.get("elevation").asDouble()).isCloseTo(-11.0, within(0.5));
    }
}
