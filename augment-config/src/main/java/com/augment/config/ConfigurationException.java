package com.augment.config;

import java.io.IOException;

/** A configuration file that cannot be read, parsed or validated. */
public class ConfigurationException extends IOException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
