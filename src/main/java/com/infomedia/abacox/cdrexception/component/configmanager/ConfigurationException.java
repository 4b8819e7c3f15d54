package com.infomedia.abacox.cdrexception.component.configmanager;

/**
 * Settings or reference data could not be loaded or failed validation. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
