package com.tokengate.model;

public enum SetupStep {
    CONFIRM_OVERWRITE,
    TOKEN_ADDRESS,
    MIN_BALANCE,
    VERIFIER_ADDRESS
}
