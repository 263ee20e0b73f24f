package com.netbet.trustedsession.generation;

import java.util.Locale;

public enum GenerationMode {
    /** Race a pool of workers, first success wins. */
    PARALLEL,
    /** One producer at a time with bounded retries. */
    SEQUENTIAL;

    public static GenerationMode fromProperty(String value) {
        if (value == null || value.isBlank()) return PARALLEL;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
