package com.gateproof.lifecycle;

import java.security.SecureRandom;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one {@link AnchorChain} per lifecycle instance.
 */
public class LifecycleRegistry {
    private static final int NONCE_BYTES = 16;

    private final Map<String, AnchorChain> chains = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    public AnchorChain open(String lifecycleId, byte[] rootSecret) {
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        return register(AnchorChain.fromSecret(lifecycleId, rootSecret, nonce));
    }

    public AnchorChain register(AnchorChain chain) {
        AnchorChain previous = chains.putIfAbsent(chain.lifecycleId(), chain);
        if (previous != null) {
            throw new IllegalStateException("Lifecycle already registered: " + chain.lifecycleId());
        }
        return chain;
    }

    public Optional<AnchorChain> chain(String lifecycleId) {
        return Optional.ofNullable(chains.get(lifecycleId));
    }

    public Optional<Anchor> anchor(String lifecycleId, Stage stage) {
        return chain(lifecycleId).flatMap(chain -> chain.anchorFor(stage));
    }
}
