package fr.lapetina.ocr.scheduler.security;

import java.nio.file.Path;

/**
 * Result of a successful token consumption: the token state after the decrement and
 * where to deliver the content from. Exactly one of {@code localPath} and
 * {@code signedUrl} is set.
 */
public record TokenGrant(DownloadToken token, Path localPath, String signedUrl) {

    public int remaining() {
        return token.remain();
    }

    public boolean isRedirect() {
        return signedUrl != null;
    }
}
