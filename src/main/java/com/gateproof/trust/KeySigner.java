package com.gateproof.trust;

/**
 * Produces raw signature bytes with one private key. Implementations backed by remote signers or
 * HSMs throw {@link SigningUnavailableException} when the key cannot be reached.
 */
@FunctionalInterface
public interface KeySigner {
    byte[] sign(byte[] input);
}
