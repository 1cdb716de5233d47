package at.sv.solar.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class DayReportWriter {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    private final ObjectMapper mapper;

    public DayReportWriter() {
        mapper = new ObjectMapper();
        // ISO-8601 strings, e.g. 2021-01-01T06:45:03Z
        mapper.registerModule(new SimpleModule()
                .addSerializer(Instant.class, ToStringSerializer.instance)
                .addSerializer(LocalDate.class, ToStringSerializer.instance));
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(DayReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    public String toText(DayReport report) {
        StringBuilder sb = new StringBuilder()
                .append("location: ").append(report.getLocation())
                .append("\ndate: ").append(report.getDate())
                .append("\nastronomical_dawn: ").append(format(report.getAstronomicalDawn()))
                .append("\nnautical_dawn: ").append(format(report.getNauticalDawn()))
                .append("\ncivil_dawn: ").append(format(report.getCivilDawn()))
                .append("\nsunrise: ").append(format(report.getSunrise()))
                .append("\nnoon: ").append(format(report.getNoon()))
                .append("\nmean_noon: ").append(format(report.getMeanNoon()))
                .append("\nsunset: ").append(format(report.getSunset()))
                .append("\ncivil_dusk: ").append(format(report.getCivilDusk()))
                .append("\nnautical_dusk: ").append(format(report.getNauticalDusk()))
                .append("\nastronomical_dusk: ").append(format(report.getAstronomicalDusk()))
                .append("\n\ninstant: ").append(report.getInstant())
                .append(String.format(Locale.ROOT, "\nelevation: %.2f°", report.getElevation()))
                .append(String.format(Locale.ROOT, "\nazimuth: %.2f°", report.getAzimuth()));
        if (report.getTargetElevation() != null) {
            sb.append(String.format(Locale.ROOT, "\n\ntarget_elevation: %.2f°", report.getTargetElevation()))
              .append("\ntarget_outcome: ").append(report.getTargetOutcome())
              .append("\ntarget_morning: ").append(format(report.getTargetMorning()))
              .append("\ntarget_evening: ").append(format(report.getTargetEvening()));
        }
        if (report.getEvent() != null) {
            sb.append("\n\nevent: ").append(report.getEvent())
              .append("\nevent_time: ").append(report.getEventTime());
        }
        return sb.toString();
    }

    private static String format(Instant time) {
        if (time == null) return "-";
        return TIME_FORMATTER.format(time);
    }
}
