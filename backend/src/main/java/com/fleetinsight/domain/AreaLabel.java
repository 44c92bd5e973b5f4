package com.fleetinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * City area derived from latitude.
 */
public enum AreaLabel {
    NORTH("North"),
    CENTER("Center"),
    SOUTH("South");

    private final String label;

    AreaLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Case-insensitive match on the label text (e.g. "north", "North"). */
    public static Optional<AreaLabel> fromLabel(String text) {
        return Labels.match(values(), text, AreaLabel::label);
    }
}
