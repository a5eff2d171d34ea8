package fr.lapetina.ocr.scheduler.security;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ocr.scheduler.domain.exception.StorageException;
import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;
import fr.lapetina.ocr.scheduler.domain.model.TokenKind;
import fr.lapetina.ocr.scheduler.publish.RemoteObjectStore;
import fr.lapetina.ocr.scheduler.storage.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Issues and consumes download tokens.
 *
 * <p>The whole table is one JSON map keyed by token string, rewritten through an atomic
 * replace on every change. Each lookup-mutate-persist cycle runs under a single lock, so
 * two concurrent consumers can never both see the last remaining use.
 */
public final class TokenStore {

    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);

    private static final int TOKEN_BYTES = 24;
    private static final TypeReference<LinkedHashMap<String, DownloadToken>> TABLE_TYPE = new TypeReference<>() {
    };

    private final Path storePath;
    private final Path storageRoot;
    private final String backend;
    private final RemoteObjectStore remoteStore;
    private final Duration signExpiry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<String, DownloadToken> tokens;

    public TokenStore(
            Path storePath,
            Path storageRoot,
            String backend,
            RemoteObjectStore remoteStore,
            Duration signExpiry,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.storePath = storePath;
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        this.backend = DownloadToken.REMOTE.equals(backend) ? DownloadToken.REMOTE : DownloadToken.LOCAL;
        if (DownloadToken.REMOTE.equals(this.backend)) {
            Objects.requireNonNull(remoteStore, "Remote object store is required for the remote backend");
        }
        this.remoteStore = remoteStore;
        this.signExpiry = signExpiry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.tokens = load();
        log.info("TokenStore initialized: path={}, backend={}, tokens={}", storePath, this.backend, tokens.size());
    }

    public TokenStore(Path storePath, Path storageRoot, ObjectMapper objectMapper) {
        this(storePath, storageRoot, DownloadToken.LOCAL, null, Duration.ofHours(1), objectMapper, Clock.systemUTC());
    }

    private Map<String, DownloadToken> load() {
        if (!Files.exists(storePath)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, DownloadToken> loaded = objectMapper.readValue(storePath.toFile(), TABLE_TYPE);
            return loaded != null ? loaded : new LinkedHashMap<>();
        } catch (IOException e) {
            log.warn("Token store unreadable, starting empty: path={}, error={}", storePath, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * Issues a token and persists it before returning.
     *
     * @param locator    local file path for the local backend, object key for the remote one
     * @param maxUses    number of permitted downloads, at least 1
     * @param ttlSeconds lifetime; 0 yields a token that is already dead
     */
    public DownloadToken createToken(String taskId, TokenKind kind, String locator, int maxUses, long ttlSeconds) {
        if (maxUses < 1) {
            throw new ValidationException("max_downloads must be >= 1");
        }
        if (ttlSeconds < 0) {
            throw new ValidationException("ttl_seconds must be >= 0");
        }
        Objects.requireNonNull(locator, "Locator is required");
        boolean remote = DownloadToken.REMOTE.equals(backend);
        if (!remote) {
            PathGuard.requireUnder(storageRoot, Path.of(locator));
        }

        DownloadToken token = new DownloadToken(
                newTokenString(),
                backend,
                taskId,
                kind,
                remote ? locator : null,
                remote ? null : locator,
                maxUses,
                maxUses,
                clock.instant().plusSeconds(ttlSeconds)
        );

        lock.lock();
        try {
            tokens.put(token.token(), token);
            try {
                persist();
            } catch (StorageException e) {
                tokens.remove(token.token());
                throw e;
            }
        } finally {
            lock.unlock();
        }
        log.info("Download token issued: taskId={}, kind={}, maxDownloads={}, ttlSeconds={}",
                taskId, kind.wireName(), maxUses, ttlSeconds);
        return token;
    }

    /**
     * Consumes one use of a token.
     *
     * @return the grant, or empty if the token is unknown, expired or exhausted
     *         (dead tokens are purged on the way)
     * @throws fr.lapetina.ocr.scheduler.domain.exception.PathViolationException if a local
     *         token points outside the storage root
     */
    public Optional<TokenGrant> consume(String tokenString) {
        if (tokenString == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            DownloadToken current = tokens.get(tokenString);
            if (current == null) {
                return Optional.empty();
            }
            if (current.isDead(clock.instant())) {
                tokens.remove(tokenString);
                persist();
                log.debug("Dead token purged: taskId={}, remain={}", current.taskId(), current.remain());
                return Optional.empty();
            }

            Path localPath = current.isRemote()
                    ? null
                    : PathGuard.requireUnder(storageRoot, Path.of(current.filePath()));

            DownloadToken updated = current.decremented();
            tokens.put(tokenString, updated);
            try {
                persist();
            } catch (StorageException e) {
                tokens.put(tokenString, current);
                throw e;
            }

            String signedUrl = current.isRemote()
                    ? remoteStore.sign(current.objectKey(), signExpiry)
                    : null;
            log.info("Download token consumed: taskId={}, kind={}, remain={}",
                    updated.taskId(), updated.kind().wireName(), updated.remain());
            return Optional.of(new TokenGrant(updated, localPath, signedUrl));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired or exhausted token.
     *
     * @return number of tokens removed
     */
    public int purgeDead() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int before = tokens.size();
            tokens.values().removeIf(t -> t.isDead(now));
            int removed = before - tokens.size();
            if (removed > 0) {
                persist();
                log.info("Dead tokens purged: removed={}, remaining={}", removed, tokens.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tokens.size();
        } finally {
            lock.unlock();
        }
    }

    public String getBackend() {
        return backend;
    }

    private void persist() {
        try {
            AtomicFiles.writeJson(objectMapper, storePath, tokens);
        } catch (IOException e) {
            throw new StorageException("Cannot persist token store " + storePath, e);
        }
    }

    private String newTokenString() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
