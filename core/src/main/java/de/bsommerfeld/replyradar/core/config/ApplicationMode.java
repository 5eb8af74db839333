package de.bsommerfeld.replyradar.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Enumeration representing the running mode of the application.
 * TEST swaps every outbound collaborator (content source, classifier
 * backends, notifier) for an offline stub.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the current application mode from system properties ("app.mode")
     * or environment variables ("APP_MODE"). Defaults to PROD if not set or
     * invalid.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("APP_MODE");
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    /**
     * Like {@link #get()}, but a {@code --test} command line flag wins over
     * property and environment.
     */
    public static ApplicationMode resolve(String[] args) {
        if (args != null && Arrays.asList(args).contains("--test")) {
            return TEST;
        }
        return get();
    }

    public boolean isTest() {
        return this == TEST;
    }
}
