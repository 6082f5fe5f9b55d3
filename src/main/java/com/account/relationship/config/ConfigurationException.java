package com.account.relationship.config;

/**
 * Runtime exception thrown when startup configuration cannot be loaded.
 * Startup must abort: the bad-domain gate cannot run without its disallow-list.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
