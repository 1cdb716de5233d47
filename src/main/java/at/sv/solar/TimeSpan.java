package at.sv.solar;

import java.time.Duration;
import java.time.Instant;

public record TimeSpan(Instant start, Instant end) {

    public static TimeSpan of(Instant start, Instant end) {
        return new TimeSpan(start, end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ']';
    }
}
