package fr.lapetina.ocr.scheduler.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One page produced by the inference engine.
 * Immutable and thread-safe.
 *
 * @param pageIndex 1-based page number within the source document
 * @param payload   structured layout output for the page
 * @param markdown  markdown rendering of the page, may be empty
 * @param images    encoded images referenced by the markdown, keyed by engine-assigned name
 */
public record PageResult(
        int pageIndex,
        Map<String, Object> payload,
        String markdown,
        Map<String, byte[]> images
) {
    public PageResult {
        if (pageIndex < 1) {
            throw new IllegalArgumentException("Page index must be 1-based: " + pageIndex);
        }
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        markdown = markdown != null ? markdown : "";
        // Engine order drives image file names on collision
        images = images != null ? Collections.unmodifiableMap(new LinkedHashMap<>(images)) : Map.of();
    }

    public boolean hasMarkdown() {
        return !markdown.isBlank();
    }

    public static PageResult of(int pageIndex, String markdown) {
        return new PageResult(pageIndex, Map.of("page", pageIndex), markdown, Map.of());
    }
}
