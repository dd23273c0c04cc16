package org.truetranslation.scripture.core;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Shared access to the {@code messages} bundle. Engine error strings and CLI
 * diagnostics both come from here.
 */
public class LocalizationManager {
    private static final String BUNDLE_NAME = "messages";
    private static LocalizationManager instance;
    private final ResourceBundle bundle;
    private final Locale locale;

    public LocalizationManager() {
        this(Locale.getDefault());
    }

    public LocalizationManager(Locale locale) {
        ResourceBundle tempBundle;
        try {
            tempBundle = ResourceBundle.getBundle(BUNDLE_NAME, locale);
        } catch (MissingResourceException e) {
            System.err.println("Warning: No localization file found for locale '" + locale + "'. Falling back to default.");
            tempBundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
        }
        this.bundle = tempBundle;
        this.locale = locale;
    }

    public String getString(String key) {
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return key;
        }
    }

    public String getString(String key, Object... args) {
        return new MessageFormat(getString(key), locale).format(args);
    }

    public static synchronized LocalizationManager getInstance() {
        if (instance == null) {
            instance = new LocalizationManager();
        }
        return instance;
    }
}
