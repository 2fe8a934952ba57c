package com.questrail.rotator.config;

/**
 * Indicates that a configuration value could not be interpreted.
 */
public final class TranslatorConfigException extends RuntimeException
{
    public TranslatorConfigException(String message) {
        super(message);
    }

    public TranslatorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
