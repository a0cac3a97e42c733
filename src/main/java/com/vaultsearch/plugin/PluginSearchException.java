package com.vaultsearch.plugin;

import java.io.IOException;

/**
 * Raised once every attempt against the plugin endpoint ended in a server
 * error or a transport failure.
 */
public class PluginSearchException extends IOException {
    private final int statusCode;
    private final int attempts;

    public PluginSearchException(String message, int statusCode, int attempts) {
        super(message);
        this.statusCode = statusCode;
        this.attempts = attempts;
    }

    public PluginSearchException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.statusCode = 0;
        this.attempts = attempts;
    }

    public int statusCode() {
        return statusCode;
    }

    public int attempts() {
        return attempts;
    }

    public boolean isTransportFailure() {
        return statusCode == 0;
    }
}
