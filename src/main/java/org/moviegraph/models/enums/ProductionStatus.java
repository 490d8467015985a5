package org.moviegraph.models.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
public enum ProductionStatus {
    RUMORED(0, "Rumored"),
    RELEASED(1, "Released"),
    POST_PRODUCTION(2, "Post Production");

    private final int id;
    private final String label;

    ProductionStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public static Optional<ProductionStatus> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values())
                .filter(status -> status.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
