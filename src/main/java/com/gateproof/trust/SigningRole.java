package com.gateproof.trust;

public enum SigningRole {
    MODEL_OWNER,
    AUDITOR,
    PLATFORM_OPERATOR,
    REGULATOR
}
