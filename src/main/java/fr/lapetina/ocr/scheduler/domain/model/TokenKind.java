package fr.lapetina.ocr.scheduler.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Result artifact a download token grants access to.
 */
public enum TokenKind {
    MARKDOWN("markdown", "text/markdown; charset=utf-8"),
    JSON("json", "application/json"),
    ARCHIVE("archive", "application/zip");

    private final String wireName;
    private final String contentType;

    TokenKind(String wireName, String contentType) {
        this.wireName = wireName;
        this.contentType = contentType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String contentType() {
        return contentType;
    }

    @JsonCreator
    public static TokenKind fromWireName(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown token kind: " + value));
    }
}
