package com.tokengate.model;

public enum SessionState {
    AWAITING_ADDRESS,
    CHECKING_BALANCE,
    AWAITING_TRANSFER,
    CONFIRMING_TRANSFER,
    VERIFIED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == VERIFIED || this == FAILED || this == EXPIRED;
    }
}
