package fr.lapetina.ocr.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ocr.scheduler.domain.model.TokenKind;
import fr.lapetina.ocr.scheduler.security.DownloadToken;

import java.time.Instant;

/**
 * Issued download token as returned to the client.
 */
public record TokenResponse(
        @JsonProperty("token") String token,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("kind") TokenKind kind,
        @JsonProperty("max_downloads") int maxDownloads,
        @JsonProperty("expire_at") Instant expireAt,
        @JsonProperty("download_url") String downloadUrl
) {

    public static TokenResponse of(DownloadToken token) {
        return new TokenResponse(
                token.token(),
                token.taskId(),
                token.kind(),
                token.maxDownloads(),
                token.expireAt(),
                "/v1/download/" + token.token());
    }
}
