package com.mike.leadscout.entity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Platform {
    SLACK, LINKEDIN;

    public static Optional<Platform> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String upper = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.name().equals(upper))
                .findFirst();
    }
}
