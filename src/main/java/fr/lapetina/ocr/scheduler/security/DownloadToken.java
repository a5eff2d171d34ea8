package fr.lapetina.ocr.scheduler.security;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ocr.scheduler.domain.model.TokenKind;

import java.time.Instant;

/**
 * Persisted capability token granting limited downloads of one result artifact.
 *
 * @param backend    {@code local} (file path) or {@code remote} (object key)
 * @param remain     downloads left, never negative
 * @param expireAt   instant from which the token is dead
 */
public record DownloadToken(
        @JsonProperty("token") String token,
        @JsonProperty("backend") String backend,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("kind") TokenKind kind,
        @JsonProperty("object_key") @JsonInclude(JsonInclude.Include.NON_NULL) String objectKey,
        @JsonProperty("file_path") @JsonInclude(JsonInclude.Include.NON_NULL) String filePath,
        @JsonProperty("max_downloads") int maxDownloads,
        @JsonProperty("remain") int remain,
        @JsonProperty("expire_at") Instant expireAt
) {
    public static final String LOCAL = "local";
    public static final String REMOTE = "remote";

    public DownloadToken {
        remain = Math.max(0, remain);
    }

    /**
     * Dead tokens are exhausted or at/after their expiry instant.
     */
    public boolean isDead(Instant now) {
        return remain <= 0 || !now.isBefore(expireAt);
    }

    @JsonIgnore
    public boolean isRemote() {
        return REMOTE.equals(backend);
    }

    DownloadToken decremented() {
        return new DownloadToken(token, backend, taskId, kind, objectKey, filePath,
                maxDownloads, remain - 1, expireAt);
    }
}
