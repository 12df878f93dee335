package org.netpreserve.pdfharvest.config;

/**
 * A job file is missing, malformed or lacks a required option. Fatal for that job only.
 */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
