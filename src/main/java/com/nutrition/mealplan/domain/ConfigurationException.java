package com.nutrition.mealplan.domain;

/**
 * Malformed constraints, weights or parameters. Raised before any solve attempt
 * and never retried.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
