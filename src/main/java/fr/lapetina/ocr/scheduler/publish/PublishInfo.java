package fr.lapetina.ocr.scheduler.publish;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a job's results can be fetched after publishing.
 * Empty strings mark artifacts that did not exist.
 */
public record PublishInfo(
        String backend,
        String markdownUrl,
        String jsonUrl,
        String archiveUrl,
        String imagesUrlPrefix
) {

    /**
     * Status-file form, keyed the way clients read it.
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("backend", backend);
        map.put("md_url", markdownUrl);
        map.put("json_url", jsonUrl);
        map.put("zip_url", archiveUrl);
        map.put("images_url_prefix", imagesUrlPrefix);
        return map;
    }
}
