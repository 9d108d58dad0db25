package org.dxworks.fortranframe.export;

import java.util.Locale;
import java.util.Optional;

public enum OutputFormat {
    TEXT,
    JSON,
    GRAPH,
    DOT;

    public static Optional<OutputFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
