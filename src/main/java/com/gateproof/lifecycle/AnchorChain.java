package com.gateproof.lifecycle;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gateproof.crypto.CanonicalEncoder;
import com.gateproof.crypto.Digests;

/**
 * Per-lifecycle chain of stage anchors. Each anchor is HMAC-SHA256 keyed with its parent's digest, so
 * a child reveals nothing about its parent while the parent reproduces every child.
 *
 * <p>One chain is the exclusive anchoring resource of its lifecycle instance: derivation is
 * serialized on the chain and stages must be anchored strictly in order.
 */
public final class AnchorChain {
    private static final Logger log = LoggerFactory.getLogger(AnchorChain.class);
    private static final String ROOT_DOMAIN = "gateproof.anchor.root.v1";
    private static final String STAGE_DOMAIN = "gateproof.anchor.stage.v1";

    private final String lifecycleId;
    private final byte[] nonce;
    private final Anchor root;
    private final Map<Stage, Anchor> anchors = new EnumMap<>(Stage.class);

    private AnchorChain(String lifecycleId, byte[] rootKey, byte[] nonce) {
        if (lifecycleId == null || lifecycleId.isBlank()) {
            throw new IllegalArgumentException("lifecycleId must not be blank");
        }
        this.lifecycleId = lifecycleId;
        this.nonce = Objects.requireNonNull(nonce, "nonce").clone();
        byte[] rootDigest = Digests.hmacSha256(rootKey, new CanonicalEncoder(ROOT_DOMAIN)
                .field(lifecycleId)
                .field(nonce)
                .toByteArray());
        this.root = new Anchor(lifecycleId, null, Digests.toHex(rootDigest), null, "", Digests.toHex(nonce));
    }

    public static AnchorChain fromSecret(String lifecycleId, byte[] rootSecret, byte[] nonce) {
        return new AnchorChain(lifecycleId, Objects.requireNonNull(rootSecret, "rootSecret"), nonce);
    }

    public static AnchorChain fromPassphrase(String lifecycleId, char[] passphrase, byte[] kdfSalt, byte[] nonce) {
        byte[] rootKey = Digests.pbkdf2(Objects.requireNonNull(passphrase, "passphrase"), Objects.requireNonNull(kdfSalt, "kdfSalt"));
        return new AnchorChain(lifecycleId, rootKey, nonce);
    }

    public String lifecycleId() {
        return lifecycleId;
    }

    public Anchor root() {
        return root;
    }

    public synchronized Anchor derive(Anchor parent, Stage stage, byte[] salt) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(salt, "salt");

        Anchor expectedParent = stage.previous() == null ? root : anchors.get(stage.previous());
        if (expectedParent == null) {
            throw new InvalidParentException(lifecycleId, stage, "stage " + stage.previous().id() + " has not been anchored");
        }
        if (!expectedParent.lifecycleId().equals(parent.lifecycleId()) || !expectedParent.digest().equals(parent.digest())) {
            throw new InvalidParentException(lifecycleId, stage, "supplied parent does not match anchor " + expectedParent.label());
        }

        String digest = deriveDigest(parent.digest(), stage, salt, nonce);
        Anchor existing = anchors.get(stage);
        if (existing != null) {
            if (existing.digest().equals(digest)) {
                return existing;
            }
            throw new InvalidParentException(lifecycleId, stage, "stage is already anchored with different inputs");
        }

        Anchor anchor = new Anchor(lifecycleId, stage, digest, parent.digest(), Digests.toHex(salt), Digests.toHex(nonce));
        anchors.put(stage, anchor);
        log.info("anchor.derived lifecycle={} stage={} digest={}", lifecycleId, stage.id(), digest);
        return anchor;
    }

    /** Derives {@code stage} from whichever anchor currently precedes it. */
    public synchronized Anchor advance(Stage stage, byte[] salt) {
        Objects.requireNonNull(stage, "stage");
        Anchor parent = stage.previous() == null ? root : anchors.get(stage.previous());
        if (parent == null) {
            throw new InvalidParentException(lifecycleId, stage, "stage " + stage.previous().id() + " has not been anchored");
        }
        return derive(parent, stage, salt);
    }

    public synchronized Optional<Anchor> anchorFor(Stage stage) {
        return Optional.ofNullable(anchors.get(stage));
    }

    public synchronized Optional<Stage> tip() {
        Stage latest = null;
        for (Stage stage : anchors.keySet()) {
            latest = stage;
        }
        return Optional.ofNullable(latest);
    }

    public static String deriveDigest(String parentDigest, Stage stage, byte[] salt, byte[] nonce) {
        byte[] key = Digests.fromHex(parentDigest);
        byte[] message = new CanonicalEncoder(STAGE_DOMAIN)
                .field(stage.id())
                .field(salt)
                .field(nonce)
                .toByteArray();
        return Digests.toHex(Digests.hmacSha256(key, message));
    }

    /** True when {@code child} is exactly what {@code parent} derives for the child's stage and salt. */
    public static boolean verifyLink(Anchor parent, Anchor child) {
        if (parent == null || child == null || child.isRoot()) {
            return false;
        }
        if (!parent.digest().equals(child.parentDigest())) {
            return false;
        }
        Stage expectedParentStage = child.stage().previous();
        if (expectedParentStage != parent.stage()) {
            return false;
        }
        String recomputed = deriveDigest(parent.digest(), child.stage(), Digests.fromHex(child.saltHex()), Digests.fromHex(child.nonceHex()));
        return recomputed.equals(child.digest());
    }
}
