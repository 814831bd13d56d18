package com.easydev.mail.error;

import java.util.List;

/**
 * Required connection settings are missing or malformed.
 */
public class ConfigurationException extends MailDispatchException {

    private final List<String> missingKeys;

    public ConfigurationException(final String message) {
        this(message, List.of(), null);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        this(message, List.of(), cause);
    }

    private ConfigurationException(final String message, final List<String> missingKeys, final Throwable cause) {
        super(message, cause);
        this.missingKeys = List.copyOf(missingKeys);
    }

    public static ConfigurationException missing(final String namespace, final List<String> keys) {
        return new ConfigurationException(
                "Missing required email configuration for '" + namespace + "': " + String.join(", ", keys),
                keys, null);
    }

    /** Names of the required keys that were absent; empty for other configuration errors. */
    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
