package com.marketplace.compliance.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum LicenseType {
    PRODUCER,
    GROWER,
    DISPENSARY,
    MERCHANT;

    public static Optional<LicenseType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst();
    }
}
