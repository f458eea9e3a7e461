package com.dbbaskette.envsync.service.crypto;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import com.dbbaskette.envsync.error.EncryptionFailureException;
import com.dbbaskette.envsync.error.StaleKeyException;
import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.service.github.GitHubSecretsClient;
import com.dbbaskette.envsync.service.github.RepoRef;
import com.dbbaskette.envsync.service.github.ScopePublicKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Seals plaintext values for a scope using the scope's cached public key.
 *
 * <p>Keys are cached per repository and scope for the configured TTL. Fetching goes through
 * {@link ConcurrentHashMap#compute}, so concurrent writers to the same scope share one fetch.
 * Invalidation only removes the entry if it still holds the rejected key id.
 */
@Service
public class SealedEncryptor {

    private static final Logger log = LoggerFactory.getLogger(SealedEncryptor.class);

    private record CacheKey(String repository, SecretScope scope) {}

    private record CachedKey(ScopePublicKey key, Instant fetchedAt) {}

    private final ConcurrentHashMap<CacheKey, CachedKey> cache = new ConcurrentHashMap<>();
    private final GitHubSecretsClient client;
    private final EnvSyncProperties properties;
    private final Clock clock;

    public SealedEncryptor(GitHubSecretsClient client, EnvSyncProperties properties, Clock clock) {
        this.client = client;
        this.properties = properties;
        this.clock = clock;
    }

    public EncryptedSecret encryptFor(RepoRef repo, SecretScope scope, String plaintext) {
        ScopePublicKey key = publicKey(repo, scope);
        try {
            byte[] recipient = Base64.getDecoder().decode(key.key());
            byte[] sealed = SealedBox.seal(plaintext.getBytes(StandardCharsets.UTF_8), recipient);
            return new EncryptedSecret(Base64.getEncoder().encodeToString(sealed), key.keyId());
        } catch (IllegalArgumentException e) {
            throw new EncryptionFailureException("Public key for " + scope + " is not a valid Curve25519 key", e);
        }
    }

    /**
     * Seals the value and hands it to {@code submit}. If the remote reports the key as stale,
     * the key is refetched and the submit retried exactly once.
     *
     * @throws EncryptionFailureException when the refreshed key is rejected as well
     */
    public <T> T withSealedValue(RepoRef repo, SecretScope scope, String plaintext, Function<EncryptedSecret, T> submit) {
        EncryptedSecret sealed = encryptFor(repo, scope, plaintext);
        try {
            return submit.apply(sealed);
        } catch (StaleKeyException first) {
            log.warn("Key {} for {} {} rejected, refreshing", sealed.keyId(), repo.fullName(), scope);
            invalidate(repo, scope, sealed.keyId());
            EncryptedSecret resealed = encryptFor(repo, scope, plaintext);
            try {
                return submit.apply(resealed);
            } catch (StaleKeyException second) {
                invalidate(repo, scope, resealed.keyId());
                throw new EncryptionFailureException("Key for " + scope + " rejected again after refresh", second);
            }
        }
    }

    public void invalidate(RepoRef repo, SecretScope scope, String staleKeyId) {
        cache.computeIfPresent(new CacheKey(repo.fullName(), scope),
                (k, cached) -> cached.key().keyId().equals(staleKeyId) ? null : cached);
    }

    ScopePublicKey publicKey(RepoRef repo, SecretScope scope) {
        CachedKey cached = cache.compute(new CacheKey(repo.fullName(), scope), (k, existing) -> {
            if (existing != null && isFresh(existing)) {
                return existing;
            }
            return new CachedKey(client.getPublicKey(repo, scope), clock.instant());
        });
        return cached.key();
    }

    private boolean isFresh(CachedKey cached) {
        return cached.fetchedAt().plus(properties.getGithub().getKeyCacheTtl()).isAfter(clock.instant());
    }
}
