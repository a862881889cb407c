package com.tokengate.chain;

public class ChainClientException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED,
        NOT_FOUND,
        TRANSIENT
    }

    private final Kind kind;

    public ChainClientException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ChainClientException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.RATE_LIMITED || kind == Kind.TRANSIENT;
    }
}
