package com.tally.service.core.support;

/**
 * Rejected configuration input: an unknown rollup period, a malformed cron expression, an unknown
 * timezone, an unknown counter/log type or a non-positive retention cap. Raised before any side effect
 * takes place.
 */
public class ConfigurationException extends TallyException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
