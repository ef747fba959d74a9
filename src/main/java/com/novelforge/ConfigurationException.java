package com.novelforge;

/**
 * Fatal misconfiguration: an agent requested for a phase that has none, a tool name the
 * agent does not expose, an unknown provider. Never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
