package com.gateproof.merkle;

/** Position of a sibling hash relative to the node being recomputed. */
public enum Side {
    LEFT,
    RIGHT
}
