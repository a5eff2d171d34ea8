package fr.lapetina.ocr.scheduler.domain.model;

import java.util.Locale;

/**
 * Compute device the engine runs on.
 */
public enum Device {
    GPU,
    CPU,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
