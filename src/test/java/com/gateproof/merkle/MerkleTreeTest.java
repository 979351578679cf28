package com.gateproof.merkle;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.gateproof.crypto.Digests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MerkleTreeTest {

    @Test
    void shouldProveThirdOfFiveReceiptsWithThreeSteps() {
        List<String> leaves = leaves(5);
        MerkleTree tree = MerkleTree.build(leaves);

        InclusionProof proof = tree.prove(2, "batch-1");

        assertEquals(3, proof.steps().size());
        assertEquals(leaves.get(2), proof.leafDigest());
        assertTrue(MerkleTree.verify(proof, tree.root()));
    }

    @Test
    void shouldChangeRootWhenLeafOrderChanges() {
        List<String> leaves = leaves(5);
        List<String> swapped = new ArrayList<>(leaves);
        swapped.set(2, leaves.get(3));
        swapped.set(3, leaves.get(2));

        assertNotEquals(MerkleTree.build(leaves).root(), MerkleTree.build(swapped).root());
    }

    @Test
    void shouldVerifyEveryLeafForAssortedSizes() {
        for (int size : new int[] { 1, 2, 3, 7, 8, 9 }) {
            MerkleTree tree = MerkleTree.build(leaves(size));
            for (int index = 0; index < size; index++) {
                assertTrue(MerkleTree.verify(tree.prove(index, "b"), tree.root()), "size " + size + " index " + index);
            }
        }
    }

    @Test
    void shouldHashSingleLeafWithLeafPrefix() {
        String leaf = Digests.sha256Hex("only");
        MerkleTree tree = MerkleTree.build(List.of(leaf));

        assertEquals(Digests.toHex(MerkleTree.leafHash(Digests.fromHex(leaf))), tree.root());
        assertNotEquals(leaf, tree.root());
    }

    @Test
    void shouldRejectNonMemberAndTamperedProofs() {
        MerkleTree tree = MerkleTree.build(leaves(5));
        InclusionProof proof = tree.prove(2, "batch-1");

        InclusionProof nonMember = new InclusionProof(Digests.sha256Hex("outsider"), proof.steps(), 2, 5, "batch-1", tree.root());
        List<ProofStep> flipped = new ArrayList<>(proof.steps());
        flipped.set(0, new ProofStep(proof.steps().get(0).siblingHash(), Side.LEFT));
        InclusionProof wrongSide = new InclusionProof(proof.leafDigest(), flipped, 2, 5, "batch-1", tree.root());
        InclusionProof truncated = new InclusionProof(proof.leafDigest(), proof.steps().subList(0, 2), 2, 5, "batch-1", tree.root());

        assertFalse(MerkleTree.verify(nonMember, tree.root()));
        assertFalse(MerkleTree.verify(wrongSide, tree.root()));
        assertFalse(MerkleTree.verify(truncated, tree.root()));
        assertFalse(MerkleTree.verify(proof, MerkleTree.build(leaves(4)).root()));
        assertThrows(ProofVerificationException.class, () -> MerkleTree.requireValid(nonMember, tree.root()));
    }

    @Test
    void shouldRefuseEmptyTreeAndOutOfRangeIndex() {
        assertThrows(IllegalArgumentException.class, () -> MerkleTree.build(List.of()));
        assertThrows(IndexOutOfBoundsException.class, () -> MerkleTree.build(leaves(3)).prove(3, "b"));
    }

    @Test
    void shouldComputeHeightOfPaddedTree() {
        assertEquals(0, MerkleTree.height(1));
        assertEquals(1, MerkleTree.height(2));
        assertEquals(3, MerkleTree.height(5));
        assertEquals(3, MerkleTree.height(8));
        assertEquals(4, MerkleTree.height(9));
    }

    static List<String> leaves(int count) {
        List<String> leaves = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            leaves.add(Digests.sha256Hex("r" + i));
        }
        return leaves;
    }
}
