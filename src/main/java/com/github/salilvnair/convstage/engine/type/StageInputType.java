package com.github.salilvnair.convstage.engine.type;

import java.util.Locale;
import java.util.Optional;

public enum StageInputType {
    COLUMN("column"),
    HARDCODED("hardcoded");

    private final String code;

    StageInputType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<StageInputType> from(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (StageInputType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
