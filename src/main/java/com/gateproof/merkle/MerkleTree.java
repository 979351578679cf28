package com.gateproof.merkle;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

import com.gateproof.crypto.Digests;

/**
 * Binary Merkle tree over receipt digests in insertion order.
 *
 * <p>Leaves are {@code SHA256(0x00 || digest)} and inner nodes {@code SHA256(0x01 || left || right)}.
 * A level with an odd node count pairs its last node with itself, at every level. A proof step with
 * side {@link Side#LEFT} recomputes {@code SHA256(0x01 || sibling || current)}; {@link Side#RIGHT}
 * recomputes {@code SHA256(0x01 || current || sibling)}.
 */
public final class MerkleTree {
    private static final byte[] LEAF_PREFIX = {0x00};
    private static final byte[] NODE_PREFIX = {0x01};

    private final List<String> leafDigests;
    private final List<List<byte[]>> levels;

    private MerkleTree(List<String> leafDigests, List<List<byte[]>> levels) {
        this.leafDigests = leafDigests;
        this.levels = levels;
    }

    public static MerkleTree build(List<String> digests) {
        if (digests == null || digests.isEmpty()) {
            throw new IllegalArgumentException("A Merkle tree needs at least one leaf");
        }
        List<byte[]> level = new ArrayList<>(digests.size());
        for (String digest : digests) {
            level.add(leafHash(Digests.fromHex(digest)));
        }
        List<List<byte[]>> levels = new ArrayList<>();
        levels.add(level);
        while (level.size() > 1) {
            List<byte[]> parents = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                byte[] left = level.get(i);
                byte[] right = i + 1 < level.size() ? level.get(i + 1) : left;
                parents.add(nodeHash(left, right));
            }
            levels.add(parents);
            level = parents;
        }
        return new MerkleTree(List.copyOf(digests), levels);
    }

    public String root() {
        return Digests.toHex(levels.get(levels.size() - 1).get(0));
    }

    public int size() {
        return leafDigests.size();
    }

    public int indexOf(String digest) {
        return leafDigests.indexOf(digest);
    }

    public InclusionProof prove(int leafIndex, String batchId) {
        if (leafIndex < 0 || leafIndex >= leafDigests.size()) {
            throw new IndexOutOfBoundsException("Leaf index " + leafIndex + " outside batch of " + leafDigests.size());
        }
        List<ProofStep> steps = new ArrayList<>();
        int index = leafIndex;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            List<byte[]> level = levels.get(depth);
            if (index % 2 == 0) {
                byte[] sibling = index + 1 < level.size() ? level.get(index + 1) : level.get(index);
                steps.add(new ProofStep(Digests.toHex(sibling), Side.RIGHT));
            } else {
                steps.add(new ProofStep(Digests.toHex(level.get(index - 1)), Side.LEFT));
            }
            index /= 2;
        }
        return new InclusionProof(leafDigests.get(leafIndex), steps, leafIndex, leafDigests.size(), batchId, root());
    }

    /**
     * Recomputes the root from the proof and compares it with {@code expectedRoot}. Proofs whose
     * length or sides disagree with the leaf index and count are rejected.
     */
    public static boolean verify(InclusionProof proof, String expectedRoot) {
        if (proof == null || expectedRoot == null || !Digests.isSha256Hex(proof.leafDigest())) {
            return false;
        }
        if (proof.leafCount() < 1 || proof.leafIndex() < 0 || proof.leafIndex() >= proof.leafCount()) {
            return false;
        }
        if (proof.steps().size() != height(proof.leafCount())) {
            return false;
        }
        byte[] current = leafHash(Digests.fromHex(proof.leafDigest()));
        int index = proof.leafIndex();
        for (ProofStep step : proof.steps()) {
            if (step == null || !Digests.isSha256Hex(step.siblingHash())) {
                return false;
            }
            Side expectedSide = index % 2 == 0 ? Side.RIGHT : Side.LEFT;
            if (step.side() != expectedSide) {
                return false;
            }
            byte[] sibling = Digests.fromHex(step.siblingHash());
            current = step.side() == Side.LEFT ? nodeHash(sibling, current) : nodeHash(current, sibling);
            index /= 2;
        }
        if (!Digests.isSha256Hex(expectedRoot)) {
            return false;
        }
        return MessageDigest.isEqual(current, Digests.fromHex(expectedRoot));
    }

    public static void requireValid(InclusionProof proof, String expectedRoot) {
        if (!verify(proof, expectedRoot)) {
            throw new ProofVerificationException("Inclusion proof does not recompute to root " + expectedRoot);
        }
    }

    static int height(int leafCount) {
        int height = 0;
        int width = leafCount;
        while (width > 1) {
            width = (width + 1) / 2;
            height++;
        }
        return height;
    }

    static byte[] leafHash(byte[] digest) {
        return Digests.sha256(LEAF_PREFIX, digest);
    }

    static byte[] nodeHash(byte[] left, byte[] right) {
        return Digests.sha256(NODE_PREFIX, left, right);
    }
}
