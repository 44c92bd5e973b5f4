package com.fleetinsight.domain;

import java.util.Optional;
import java.util.function.Function;

final class Labels {

    private Labels() {
    }

    static <E extends Enum<E>> Optional<E> match(E[] values, String text, Function<E, String> labelOf) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String candidate = text.strip();
        for (E value : values) {
            if (labelOf.apply(value).equalsIgnoreCase(candidate) || value.name().equalsIgnoreCase(candidate)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
