package com.gateproof.trust;

import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of signing entities and the only component that touches private keys.
 *
 * <p>Verification resolves the key that was valid at the signature's embedded timestamp, so
 * signatures made before a rotation or a revocation keep verifying. Signing against one entity is
 * serialized; distinct entities sign in parallel.
 */
public class TrustLayer {
    private static final Logger log = LoggerFactory.getLogger(TrustLayer.class);

    private final Map<String, SigningEntity> entities = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int thresholdAttempts;
    private final Duration thresholdBackoff;

    public TrustLayer() {
        this(Clock.systemUTC(), 3, Duration.ofMillis(100));
    }

    public TrustLayer(Clock clock, int thresholdAttempts, Duration thresholdBackoff) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.thresholdAttempts = Math.max(1, thresholdAttempts);
        this.thresholdBackoff = Objects.requireNonNull(thresholdBackoff, "thresholdBackoff");
    }

    public SigningEntity register(String identity, SigningRole role, Instant validFrom, Instant validUntil) {
        KeyPair keyPair = Ed25519Keys.generate();
        return register(identity, role, validFrom, validUntil, keyPair.getPublic(), Ed25519Keys.signerFor(keyPair.getPrivate()));
    }

    public SigningEntity register(
            String identity,
            SigningRole role,
            Instant validFrom,
            Instant validUntil,
            PublicKey publicKey,
            KeySigner signer) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(validFrom, "validFrom");
        KeyVersion initial = new KeyVersion(identity + "#1", Objects.requireNonNull(publicKey, "publicKey"),
                Objects.requireNonNull(signer, "signer"), validFrom, validUntil);
        SigningEntity entity = new SigningEntity(identity, role, validFrom, validUntil, initial);
        if (entities.putIfAbsent(identity, entity) != null) {
            throw new IllegalArgumentException("Signing entity already registered: " + identity);
        }
        log.info("trust.entity.registered identity={} role={} keyId={}", identity, role, initial.keyId());
        return entity;
    }

    public KeyVersion rotateKey(String identity, Instant newKeyValidFrom, Duration overlap) {
        KeyPair keyPair = Ed25519Keys.generate();
        return rotateKey(identity, newKeyValidFrom, overlap, keyPair.getPublic(), Ed25519Keys.signerFor(keyPair.getPrivate()));
    }

    /**
     * Adds a key generation starting at {@code newKeyValidFrom}; the previous key stays valid for
     * {@code overlap} beyond that point.
     */
    public KeyVersion rotateKey(String identity, Instant newKeyValidFrom, Duration overlap, PublicKey publicKey, KeySigner signer) {
        SigningEntity entity = requireEntity(identity);
        synchronized (entity) {
            if (entity.isRevoked()) {
                throw new RevokedEntityException(identity, entity.revokedAt());
            }
            KeyVersion current = entity.currentKey();
            if (!newKeyValidFrom.isAfter(current.validFrom())) {
                throw new IllegalArgumentException("New key must become valid after " + current.validFrom());
            }
            String keyId = identity + "#" + (entity.keys().size() + 1);
            KeyVersion next = new KeyVersion(keyId, publicKey, signer, newKeyValidFrom, entity.validUntil());
            entity.addKey(next, newKeyValidFrom.plus(overlap));
            log.info("trust.key.rotated identity={} keyId={} validFrom={} previousKeyUntil={}",
                    identity, keyId, newKeyValidFrom, newKeyValidFrom.plus(overlap));
            return next;
        }
    }

    public void revoke(String identity) {
        SigningEntity entity = requireEntity(identity);
        entity.revoke(now());
        log.warn("trust.entity.revoked identity={} revokedAt={}", identity, entity.revokedAt());
    }

    public Optional<SigningEntity> entity(String identity) {
        return Optional.ofNullable(entities.get(identity));
    }

    /** Signs with the first active entity authorized for {@code role}, in identity order. */
    public EntitySignature sign(byte[] digest, SigningRole role) {
        Objects.requireNonNull(role, "role");
        List<SigningEntity> candidates = activeEntities(Set.of(role));
        if (candidates.isEmpty()) {
            throw new SigningUnavailableException("No active signing entity for role " + role);
        }
        SigningUnavailableException last = null;
        for (SigningEntity entity : candidates) {
            try {
                return signWith(entity, digest);
            } catch (SigningUnavailableException | RevokedEntityException e) {
                log.warn("trust.sign.candidate.failed identity={} role={} reason={}", entity.identity(), role, e.getMessage());
                last = e instanceof SigningUnavailableException sue ? sue : new SigningUnavailableException(e.getMessage(), e);
            }
        }
        throw last;
    }

    public EntitySignature signAs(String identity, byte[] digest) {
        return signWith(requireEntity(identity), digest);
    }

    /**
     * Collects signatures from distinct entities holding any of {@code roles} until
     * {@code threshold} are gathered. Unavailable signers are retried with linear backoff; a set
     * below threshold is never returned.
     */
    public ThresholdSignature signThreshold(byte[] digest, Set<SigningRole> roles, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1");
        }
        Map<String, EntitySignature> collected = new LinkedHashMap<>();
        for (int attempt = 1; attempt <= thresholdAttempts; attempt++) {
            for (SigningEntity entity : activeEntities(roles)) {
                if (collected.size() >= threshold) {
                    break;
                }
                if (collected.containsKey(entity.identity())) {
                    continue;
                }
                try {
                    collected.put(entity.identity(), signWith(entity, digest));
                } catch (SigningUnavailableException | RevokedEntityException e) {
                    log.warn("trust.threshold.signer.failed identity={} attempt={} reason={}", entity.identity(), attempt, e.getMessage());
                }
            }
            if (collected.size() >= threshold) {
                return new ThresholdSignature(threshold, new ArrayList<>(collected.values()));
            }
            if (attempt < thresholdAttempts) {
                long backoffMs = thresholdBackoff.toMillis() * attempt;
                log.warn("trust.threshold.retry attempt={} collected={} threshold={} backoffMs={}", attempt, collected.size(), threshold, backoffMs);
                sleep(backoffMs);
            }
        }
        throw new SigningUnavailableException("Collected " + collected.size() + " of " + threshold + " required signatures for roles " + roles);
    }

    public boolean verify(byte[] digest, EntitySignature signature) {
        SigningEntity entity = entities.get(signature.entityId());
        return entity != null && verify(digest, signature, entity);
    }

    public boolean verify(byte[] digest, EntitySignature signature, SigningEntity entity) {
        if (!entity.identity().equals(signature.entityId()) || entity.role() != signature.role()) {
            return false;
        }
        if (!entity.isValidAt(signature.signedAt())) {
            return false;
        }
        return entity.key(signature.keyId())
                .map(key -> KeyDescriptor.of(entity, key).verify(digest, signature))
                .orElse(false);
    }

    public boolean verifyThreshold(byte[] digest, ThresholdSignature thresholdSignature) {
        if (thresholdSignature.threshold() < 1) {
            return false;
        }
        Set<String> validSigners = new LinkedHashSet<>();
        for (EntitySignature signature : thresholdSignature.signatures()) {
            if (verify(digest, signature)) {
                validSigners.add(signature.entityId());
            }
        }
        return validSigners.size() >= thresholdSignature.threshold();
    }

    /** Public key descriptors for every signature, for bundling with exported evidence. */
    public List<KeyDescriptor> describe(Collection<EntitySignature> signatures) {
        List<KeyDescriptor> descriptors = new ArrayList<>();
        for (EntitySignature signature : signatures) {
            SigningEntity entity = entities.get(signature.entityId());
            if (entity == null) {
                throw new IllegalArgumentException("Unknown signing entity " + signature.entityId());
            }
            KeyVersion key = entity.key(signature.keyId())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown key " + signature.keyId()));
            KeyDescriptor descriptor = KeyDescriptor.of(entity, key);
            if (!descriptors.contains(descriptor)) {
                descriptors.add(descriptor);
            }
        }
        return descriptors;
    }

    private EntitySignature signWith(SigningEntity entity, byte[] digest) {
        Objects.requireNonNull(digest, "digest");
        synchronized (entity) {
            if (entity.isRevoked()) {
                throw new RevokedEntityException(entity.identity(), entity.revokedAt());
            }
            Instant signedAt = now();
            if (!entity.isValidAt(signedAt)) {
                throw new SigningUnavailableException("Signing entity " + entity.identity() + " is outside its validity interval");
            }
            KeyVersion key = entity.keyValidAt(signedAt)
                    .orElseThrow(() -> new SigningUnavailableException("No valid key for " + entity.identity() + " at " + signedAt));
            byte[] input = EntitySignature.signingInput(digest, entity.identity(), key.keyId(), entity.role(), signedAt);
            byte[] value = key.signer().sign(input);
            return new EntitySignature(entity.identity(), key.keyId(), entity.role(), signedAt, Ed25519Keys.ALGORITHM,
                    Base64.getEncoder().encodeToString(value));
        }
    }

    private List<SigningEntity> activeEntities(Set<SigningRole> roles) {
        Instant now = now();
        return entities.values().stream()
                .filter(entity -> roles.contains(entity.role()))
                .filter(entity -> !entity.isRevoked())
                .filter(entity -> entity.isValidAt(now))
                .sorted(Comparator.comparing(SigningEntity::identity))
                .toList();
    }

    private SigningEntity requireEntity(String identity) {
        SigningEntity entity = entities.get(identity);
        if (entity == null) {
            throw new IllegalArgumentException("Unknown signing entity " + identity);
        }
        return entity;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SigningUnavailableException("Interrupted while waiting for signers", e);
        }
    }
}
