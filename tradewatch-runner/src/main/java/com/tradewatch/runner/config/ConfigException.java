package com.tradewatch.runner.config;

/**
 * Invalid or unreadable startup configuration. Fatal: the application exits.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
