package com.vaultsearch.embed;

import java.time.Duration;

public class EmbedTimeoutException extends RuntimeException {
    private final Duration timeout;

    public EmbedTimeoutException(Duration timeout) {
        super("Embedding timeout after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
