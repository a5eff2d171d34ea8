package fr.lapetina.ocr.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/tasks/{id}/tokens}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TokenRequest {

    private String kind;

    @JsonProperty("max_downloads")
    private Integer maxDownloads;

    @JsonProperty("ttl_seconds")
    private Long ttlSeconds;

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public Integer getMaxDownloads() { return maxDownloads; }
    public void setMaxDownloads(Integer maxDownloads) { this.maxDownloads = maxDownloads; }

    public Long getTtlSeconds() { return ttlSeconds; }
    public void setTtlSeconds(Long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
}
