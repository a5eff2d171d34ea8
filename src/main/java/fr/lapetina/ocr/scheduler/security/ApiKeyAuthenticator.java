package fr.lapetina.ocr.scheduler.security;

import fr.lapetina.ocr.scheduler.domain.exception.AuthenticationException;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Checks {@code Authorization: Bearer <key>} headers against the configured API keys.
 *
 * With no key configured every request passes (development mode). Keys are compared
 * in constant time.
 */
public final class ApiKeyAuthenticator {

    private static final String BEARER = "bearer";

    private final List<byte[]> apiKeys;
    private final String requiredPrefix;

    public ApiKeyAuthenticator(Collection<String> apiKeys, String requiredPrefix) {
        this.apiKeys = apiKeys == null ? List.of() : apiKeys.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .map(key -> key.getBytes(StandardCharsets.UTF_8))
                .toList();
        this.requiredPrefix = requiredPrefix == null ? "" : requiredPrefix.trim();
    }

    public static ApiKeyAuthenticator fromConfig(SchedulerConfig.AuthConfig config) {
        return new ApiKeyAuthenticator(config.getApiKeys(), config.getRequireKeyPrefix());
    }

    public boolean isEnabled() {
        return !apiKeys.isEmpty();
    }

    /**
     * Validates an {@code Authorization} header value.
     *
     * @throws AuthenticationException UNAUTHORIZED when the header is missing, not a bearer
     *                                 token or lacks the required prefix; FORBIDDEN when the
     *                                 key is unknown
     */
    public void authenticate(String authorization) {
        if (!isEnabled()) {
            return;
        }
        String key = bearerToken(authorization);
        if (key == null) {
            throw AuthenticationException.unauthorized("Missing Bearer token");
        }
        if (!requiredPrefix.isEmpty() && !key.startsWith(requiredPrefix)) {
            throw AuthenticationException.unauthorized("Invalid token prefix");
        }
        byte[] candidate = key.getBytes(StandardCharsets.UTF_8);
        boolean accepted = false;
        for (byte[] apiKey : apiKeys) {
            accepted |= MessageDigest.isEqual(apiKey, candidate);
        }
        if (!accepted) {
            throw AuthenticationException.forbidden("Invalid API key");
        }
    }

    private static String bearerToken(String authorization) {
        if (authorization == null) {
            return null;
        }
        String value = authorization.trim();
        int space = value.indexOf(' ');
        if (space < 0 || !value.substring(0, space).toLowerCase(Locale.ROOT).equals(BEARER)) {
            return null;
        }
        String token = value.substring(space + 1).trim();
        return token.isEmpty() ? null : token;
    }
}
