package at.sv.solar;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Twilight {
    CIVIL(-6.0),
    NAUTICAL(-12.0),
    ASTRONOMICAL(-18.0);

    /**
     * Solar elevation in degrees marking the start of the twilight in the morning and its end in the evening.
     */
    private final double elevation;
}
