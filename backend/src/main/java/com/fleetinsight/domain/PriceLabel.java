package com.fleetinsight.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Price tier by fare per km. UNKNOWN when the distance gives no usable rate.
 */
public enum PriceLabel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    PREMIUM("Premium"),
    UNKNOWN("Unknown");

    private final String label;

    PriceLabel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<PriceLabel> fromLabel(String text) {
        return Labels.match(values(), text, PriceLabel::label);
    }
}
