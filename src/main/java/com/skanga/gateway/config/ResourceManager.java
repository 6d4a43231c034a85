package com.skanga.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Looks up user-facing error messages from {@code errors.properties}.
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String ERROR_BUNDLE = "errors";
    private static final ResourceBundle errorMessages = loadBundle();

    private ResourceManager() {
    }

    private static ResourceBundle loadBundle() {
        try {
            return ResourceBundle.getBundle(ERROR_BUNDLE);
        } catch (MissingResourceException e) {
            logger.warn("Error message bundle '{}' not found, falling back to message keys", ERROR_BUNDLE);
            return null;
        }
    }

    /**
     * Formats the message registered under {@code messageKey}.
     *
     * @param messageKey key in errors.properties
     * @param args       values for the {@code {0}}, {@code {1}} ... placeholders
     * @return the formatted message, or the key itself when it is not registered
     */
    public static String getErrorMessage(String messageKey, Object... args) {
        if (errorMessages == null || !errorMessages.containsKey(messageKey)) {
            logger.debug("No error message registered for key '{}'", messageKey);
            return messageKey;
        }
        String pattern = errorMessages.getString(messageKey);
        return args.length == 0 ? pattern : MessageFormat.format(pattern, args);
    }
}
